/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * Thrown when printed syntax doesn't reproduce its source byte for byte.
 */
public final class RoundTripMismatchException extends SyntaxIntegrityException {
    private final int offset;

    RoundTripMismatchException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * @return The first offset at which the printed text and the source differ
     */
    public int offset() {
        return offset;
    }
}
