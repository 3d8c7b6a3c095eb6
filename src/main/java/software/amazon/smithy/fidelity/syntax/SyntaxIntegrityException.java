/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * Thrown when a syntax tree turns out to be inconsistent with the source it
 * was built from. Nothing derived from such a tree can be trusted.
 */
public abstract class SyntaxIntegrityException extends RuntimeException {
    SyntaxIntegrityException(String message) {
        super(message);
    }
}
