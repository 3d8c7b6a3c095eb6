/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import software.amazon.smithy.fidelity.document.SourceBuffer;

public class SourceEditTest {
    @Test
    public void parsesReplacement() {
        SourceEdit edit = SourceEdit.parse("1:9-1:10=42", SourceBuffer.of("let x = 1"));

        assertThat(edit, equalTo(new SourceEdit(8, 9, 2)));
        assertThat(edit.delta(), equalTo(1));
    }

    @Test
    public void parsesMultiLineDeletion() {
        SourceEdit edit = SourceEdit.parse("1:2-2:2=", SourceBuffer.of("ab\ncd"));

        assertThat(edit, equalTo(new SourceEdit(1, 4, 0)));
        assertThat(edit.delta(), equalTo(-3));
    }

    @Test
    public void parsesInsertionAtEnd() {
        SourceEdit edit = SourceEdit.parse("2:1-2:1=x", SourceBuffer.of("a\n"));

        assertThat(edit, equalTo(new SourceEdit(2, 2, 1)));
        assertThat(edit.isInsertion(), is(true));
    }

    @Test
    public void replacementCanContainSeparators() {
        SourceEdit edit = SourceEdit.parse("1:1-1:1==\n-", SourceBuffer.of("a"));

        assertThat(edit.replacementLength(), equalTo(3));
    }

    @Test
    public void countsReplacementInUtf8Bytes() {
        SourceEdit edit = SourceEdit.parse("1:1-1:1=é", SourceBuffer.of("a"));

        assertThat(edit.replacementLength(), equalTo(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1:1=x",
            "1:1-1:1",
            "a:1-1:1=x",
            "3:1-3:1=x",
            "1:5-1:1=x",
            "1:1-1:9=x",
            "99999999999:1-1:1=x"
    })
    public void rejectsMalformedPatterns(String pattern) {
        SourceBuffer source = SourceBuffer.of("abc\ndef");

        assertThrows(MalformedEditException.class, () -> SourceEdit.parse(pattern, source));
    }

    @Test
    public void replacementTouchesOverlappingSpans() {
        SourceEdit edit = new SourceEdit(2, 4, 1);

        assertThat(edit.touches(0, 2), is(false));
        assertThat(edit.touches(0, 3), is(true));
        assertThat(edit.touches(3, 6), is(true));
        assertThat(edit.touches(4, 6), is(false));
    }

    @Test
    public void insertionTouchesOnlyEnclosingSpans() {
        SourceEdit edit = new SourceEdit(2, 2, 1);

        assertThat(edit.touches(0, 2), is(false));
        assertThat(edit.touches(2, 4), is(false));
        assertThat(edit.touches(1, 3), is(true));
    }

    @Test
    public void intersectsOrTouchesIncludesNeighbors() {
        SourceEdit edit = new SourceEdit(2, 4, 0);

        assertThat(edit.intersectsOrTouches(0, 2), is(true));
        assertThat(edit.intersectsOrTouches(4, 5), is(true));
        assertThat(edit.intersectsOrTouches(0, 1), is(false));
        assertThat(edit.intersectsOrTouches(5, 9), is(false));
    }
}
