/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

/**
 * A non-empty span of the new source whose text, and the old syntax
 * covering it, are unchanged from the old source.
 *
 * @param start Start offset in the new source, inclusive
 * @param end End offset in the new source, exclusive
 */
public record ReuseRange(int start, int end) {
    public ReuseRange {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid reuse range [" + start + ", " + end + ")");
        }
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
