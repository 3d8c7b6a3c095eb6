/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * Thrown when a position derived from a tree disagrees with the position
 * of the same offset in the source.
 */
public final class PositionMismatchException extends SyntaxIntegrityException {
    private final AbsolutePosition treePosition;
    private final AbsolutePosition sourcePosition;

    PositionMismatchException(AbsolutePosition treePosition, AbsolutePosition sourcePosition) {
        super("Position " + treePosition + " computed from the syntax tree should be identical to "
              + sourcePosition + " computed from the source");
        this.treePosition = treePosition;
        this.sourcePosition = sourcePosition;
    }

    public AbsolutePosition treePosition() {
        return treePosition;
    }

    public AbsolutePosition sourcePosition() {
        return sourcePosition;
    }
}
