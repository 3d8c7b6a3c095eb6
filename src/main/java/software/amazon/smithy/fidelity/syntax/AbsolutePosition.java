/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * A position within a source file. Never stored in a {@link RawSyntax},
 * only derived from one by accumulating widths.
 *
 * @param offset 0-based byte offset
 * @param line 1-based line
 * @param column 1-based byte column
 */
public record AbsolutePosition(int offset, int line, int column) {
    public static final AbsolutePosition START = new AbsolutePosition(0, 1, 1);

    /**
     * @return {@code line:column}
     */
    public String lineAndColumn() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return lineAndColumn() + " (" + offset + ")";
    }
}
