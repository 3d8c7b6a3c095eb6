/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

import java.util.List;
import software.amazon.smithy.cli.ColorFormatter;
import software.amazon.smithy.cli.Style;
import software.amazon.smithy.fidelity.document.SourceBuffer;

/**
 * Human-readable renderings of {@link ReuseRange}s, for debugging
 * incremental parsing. Neither rendering affects what gets reused.
 */
public final class ReuseReport {
    private static final String REPARSE_START = "<reparse>";
    private static final String REPARSE_END = "</reparse>";

    private ReuseReport() {
    }

    /**
     * Renders {@code newSource} with the reused and re-lexed parts told apart.
     * With colors enabled, reused text is green and re-lexed text red,
     * otherwise re-lexed text is wrapped in {@code <reparse>} tags.
     *
     * @param newSource The new source
     * @param ranges The reuse ranges computed for {@code newSource}
     * @param colors The formatter to color the output with
     * @return The rendered source, followed by a newline
     */
    public static String renderVisual(SourceBuffer newSource, List<ReuseRange> ranges, ColorFormatter colors) {
        StringBuilder builder = new StringBuilder();
        int current = 0;
        for (ReuseRange range : ranges) {
            appendReparsed(builder, newSource, current, range.start(), colors);
            String reused = newSource.copySpan(range.start(), range.end());
            builder.append(colors.isColorEnabled() ? colors.style(reused, Style.GREEN) : reused);
            current = range.end();
        }
        appendReparsed(builder, newSource, current, newSource.length(), colors);
        builder.append('\n');
        return builder.toString();
    }

    /**
     * Renders one {@code Reused <line>:<column> to <line>:<column>} line per
     * range, with the end position being exclusive.
     *
     * @param newSource The new source
     * @param ranges The reuse ranges computed for {@code newSource}
     * @return The rendered log
     */
    public static String renderLog(SourceBuffer newSource, List<ReuseRange> ranges) {
        StringBuilder builder = new StringBuilder();
        for (ReuseRange range : ranges) {
            builder.append("Reused ")
                    .append(newSource.positionAtOffset(range.start()).lineAndColumn())
                    .append(" to ")
                    .append(newSource.positionAtOffset(range.end()).lineAndColumn())
                    .append('\n');
        }
        return builder.toString();
    }

    private static void appendReparsed(
            StringBuilder builder,
            SourceBuffer source,
            int start,
            int end,
            ColorFormatter colors
    ) {
        if (start == end) {
            return;
        }
        String reparsed = source.copySpan(start, end);
        if (colors.isColorEnabled()) {
            builder.append(colors.style(reparsed, Style.RED));
        } else {
            builder.append(REPARSE_START).append(reparsed).append(REPARSE_END);
        }
    }
}
