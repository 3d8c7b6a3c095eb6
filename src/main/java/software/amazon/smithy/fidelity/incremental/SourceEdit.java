/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import software.amazon.smithy.fidelity.document.SourceBuffer;

/**
 * Replacement of the bytes {@code [start, end)} of the old source with
 * {@code replacementLength} new bytes.
 *
 * @param start Start offset in the old source, inclusive
 * @param end End offset in the old source, exclusive
 * @param replacementLength Length of the replacement text in bytes
 */
public record SourceEdit(int start, int end, int replacementLength) {
    private static final Pattern EDIT_PATTERN = Pattern.compile("([0-9]+):([0-9]+)-([0-9]+):([0-9]+)=(.*)", Pattern.DOTALL);

    /**
     * @return How much this edit shifts the text after it
     */
    public int delta() {
        return replacementLength - (end - start);
    }

    /**
     * @return Whether this edit only inserts text
     */
    public boolean isInsertion() {
        return start == end;
    }

    /**
     * A replacement touches the bytes it overlaps. An insertion touches a
     * span only when it lands strictly inside of it.
     *
     * @param spanStart Start of an old span, inclusive
     * @param spanEnd End of an old span, exclusive
     * @return Whether this edit changes any byte of the span
     */
    public boolean touches(int spanStart, int spanEnd) {
        if (isInsertion()) {
            return spanStart < start && start < spanEnd;
        }
        return spanStart < end && start < spanEnd;
    }

    /**
     * @param spanStart Start of an old span, inclusive
     * @param spanEnd End of an old span, inclusive
     * @return Whether this edit overlaps the span or is adjacent to it
     */
    public boolean intersectsOrTouches(int spanStart, int spanEnd) {
        return !(end < spanStart || start > spanEnd);
    }

    /**
     * Parses an edit in the form {@code startLine:startColumn-endLine:endColumn=text},
     * with 1-based lines and byte columns in {@code oldSource}.
     *
     * @param pattern The edit to parse
     * @param oldSource The source the edit's positions refer to
     * @return The parsed edit
     * @throws MalformedEditException If the pattern can't be parsed or is
     *  out of the bounds of {@code oldSource}
     */
    public static SourceEdit parse(String pattern, SourceBuffer oldSource) {
        Matcher matcher = EDIT_PATTERN.matcher(pattern);
        if (!matcher.matches()) {
            throw new MalformedEditException("Invalid edit pattern: " + pattern);
        }

        int start = resolve(oldSource, pattern, matcher.group(1), matcher.group(2));
        int end = resolve(oldSource, pattern, matcher.group(3), matcher.group(4));
        if (end < start) {
            throw new MalformedEditException("Edit ends before it starts: " + pattern);
        }
        // The replacement comes from the command line as text, not bytes
        int replacementLength = matcher.group(5).getBytes(StandardCharsets.UTF_8).length;
        return new SourceEdit(start, end, replacementLength);
    }

    private static int resolve(SourceBuffer source, String pattern, String line, String column) {
        int offset;
        try {
            offset = source.offsetOf(Integer.parseInt(line), Integer.parseInt(column));
        } catch (NumberFormatException e) {
            throw new MalformedEditException("Could not parse edit position as integer: " + pattern, e);
        }
        if (offset < 0) {
            throw new MalformedEditException("Edit position " + line + ":" + column + " is outside of the source: "
                    + pattern);
        }
        return offset;
    }
}
