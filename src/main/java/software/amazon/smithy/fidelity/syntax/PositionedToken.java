/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * A token paired with where it sits in a file.
 *
 * @param token The token
 * @param position The position of the start of the token's leading trivia
 * @param textPosition The position of the token's text, after its leading trivia
 * @param endPosition The position just after the token's trailing trivia
 */
public record PositionedToken(
        RawSyntax.Token token,
        AbsolutePosition position,
        AbsolutePosition textPosition,
        AbsolutePosition endPosition
) {
}
