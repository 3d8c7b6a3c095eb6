/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.document;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import software.amazon.smithy.fidelity.syntax.AbsolutePosition;

/**
 * Immutable in-memory representation of a source file, indexed by line.
 *
 * <p>The text is held as a {@link String} with exactly one char per byte
 * of the underlying file (ISO-8859-1), so every offset, width and column
 * handed out by this class is a byte count, and {@link #toBytes()} gives
 * back the original bytes even if they were not valid UTF-8.
 *
 * <p>Lines and columns are 1-based. {@code \n}, {@code \r\n} and a lone
 * {@code \r} each terminate a line.
 *
 * <p>Methods on this class return {@code -1} or {@code null} for out of
 * bounds lookups rather than throwing.
 */
public final class SourceBuffer {
    private final String text;
    private final int[] lineIndices;

    private SourceBuffer(String text, int[] lineIndices) {
        this.text = text;
        this.lineIndices = lineIndices;
    }

    /**
     * @param bytes Raw contents of a file
     * @return The created buffer
     */
    public static SourceBuffer fromBytes(byte[] bytes) {
        return of(new String(bytes, StandardCharsets.ISO_8859_1));
    }

    /**
     * @param text Text to create a buffer for, one char per byte
     * @return The created buffer
     */
    public static SourceBuffer of(String text) {
        return new SourceBuffer(text, computeLineIndices(text));
    }

    /**
     * @param text Printed syntax, one char per byte
     * @return The bytes {@code text} stands for
     */
    public static byte[] toBytes(CharSequence text) {
        return text.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * @return A copy of the bytes of this buffer
     */
    public byte[] toBytes() {
        return toBytes(text);
    }

    /**
     * @return The text of this buffer
     */
    public String text() {
        return text;
    }

    /**
     * @return The length of this buffer in bytes
     */
    public int length() {
        return text.length();
    }

    /**
     * @return The number of lines in this buffer, which is always at least 1
     */
    public int lineCount() {
        return lineIndices.length;
    }

    /**
     * @param line The 1-based line to find the start of
     * @return The offset of the start of {@code line}, or {@code -1} if the
     *  line doesn't exist
     */
    public int indexOfLine(int line) {
        if (line < 1 || line > lineIndices.length) {
            return -1;
        }
        return lineIndices[line - 1];
    }

    /**
     * @param offset The offset to find the line of. The end of the buffer
     *               is a valid offset and belongs to the last line.
     * @return The 1-based line {@code offset} is within, or {@code -1} if the
     *  offset is out of bounds
     */
    public int lineOfOffset(int offset) {
        if (offset < 0 || offset > length()) {
            return -1;
        }
        int idx = Arrays.binarySearch(lineIndices, offset);
        if (idx >= 0) {
            return idx + 1;
        }
        // Insertion point is the first line starting after offset
        return -(idx + 1);
    }

    /**
     * @param offset The offset to find the position of
     * @return The absolute position of {@code offset}, or {@code null} if the
     *  offset is out of bounds
     */
    public AbsolutePosition positionAtOffset(int offset) {
        int line = lineOfOffset(offset);
        if (line < 0) {
            return null;
        }
        return new AbsolutePosition(offset, line, offset - indexOfLine(line) + 1);
    }

    /**
     * @param line The 1-based line
     * @param column The 1-based column, in bytes
     * @return The offset of the given line and column, or {@code -1} if the
     *  position is outside of the buffer. The column just past the last byte
     *  of a line (before its terminator) is valid, as is the end of the buffer.
     */
    public int offsetOf(int line, int column) {
        int lineStart = indexOfLine(line);
        if (lineStart < 0 || column < 1) {
            return -1;
        }

        int offset = lineStart + column - 1;
        int limit = line == lineIndices.length ? length() : contentEnd(line);
        if (offset > limit) {
            return -1;
        }
        return offset;
    }

    /**
     * @param start The start of the span, inclusive
     * @param end The end of the span, exclusive
     * @return The text within the span, or {@code null} if the span is out of
     *  bounds or start > end
     */
    public String copySpan(int start, int end) {
        if (start < 0 || end > length() || start > end) {
            return null;
        }
        return text.substring(start, end);
    }

    /**
     * @param line The 1-based line to copy
     * @return The text of the line including its terminator, or {@code null}
     *  if the line doesn't exist
     */
    public String copyLine(int line) {
        int start = indexOfLine(line);
        if (start < 0) {
            return null;
        }
        int end = line == lineIndices.length ? length() : lineIndices[line];
        return text.substring(start, end);
    }

    // Offset of the line terminator ending the given (non-last) line
    private int contentEnd(int line) {
        int next = lineIndices[line];
        if (next >= 2 && text.charAt(next - 1) == '\n' && text.charAt(next - 2) == '\r') {
            return next - 2;
        }
        return next - 1;
    }

    private static int[] computeLineIndices(String text) {
        List<Integer> indices = new ArrayList<>();
        indices.add(0);
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                indices.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                indices.add(i + 1);
            }
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }
}
