/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.fidelity.document.SourceBuffer;

public class ReuseReportTest {
    @Test
    public void marksReparsedText() {
        SourceBuffer source = SourceBuffer.of("let x = 42");

        String visual = ReuseReport.renderVisual(source, List.of(new ReuseRange(0, 8)), AnsiColorFormatter.NO_COLOR);

        assertThat(visual, equalTo("let x = <reparse>42</reparse>\n"));
    }

    @Test
    public void marksEverythingWithoutRanges() {
        SourceBuffer source = SourceBuffer.of("a\nb");

        String visual = ReuseReport.renderVisual(source, List.of(), AnsiColorFormatter.NO_COLOR);

        assertThat(visual, equalTo("<reparse>a\nb</reparse>\n"));
    }

    @Test
    public void fullyReusedSourceHasNoMarkers() {
        SourceBuffer source = SourceBuffer.of("abc");

        String visual = ReuseReport.renderVisual(source, List.of(new ReuseRange(0, 3)), AnsiColorFormatter.NO_COLOR);

        assertThat(visual, equalTo("abc\n"));
    }

    @Test
    public void colorsInsteadOfMarkersWhenEnabled() {
        SourceBuffer source = SourceBuffer.of("let x = 42");

        String visual = ReuseReport.renderVisual(source, List.of(new ReuseRange(0, 8)), AnsiColorFormatter.FORCE_COLOR);

        assertThat(visual, not(containsString("<reparse>")));
        assertThat(visual, containsString("\u001b["));
        assertThat(visual, containsString("42"));
    }

    @Test
    public void logsRangesAsLinesAndColumns() {
        SourceBuffer source = SourceBuffer.of("let x = 1;\nlet y = 42;\n");
        List<ReuseRange> ranges = List.of(new ReuseRange(0, 19), new ReuseRange(21, 23));

        assertThat(ReuseReport.renderLog(source, ranges), equalTo(
                "Reused 1:1 to 2:9\n"
                + "Reused 2:11 to 3:1\n"));
    }
}
