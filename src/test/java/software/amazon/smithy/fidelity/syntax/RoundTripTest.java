/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.ParsingCache;

public class RoundTripTest {
    @Test
    public void verifiesLexedSource() {
        SourceBuffer source = SourceBuffer.of("let x = 1; /* c */\n");

        List<RawSyntax.Token> tokens = RoundTrip.verifyLex(source, Syntax.parser());

        assertThat(tokens.size(), equalTo(6));
    }

    @Test
    public void verifiesParsedSource() {
        SourceBuffer source = SourceBuffer.of("let x = (1 + 2) * 3;\r\n");

        RawSyntax root = RoundTrip.verifyParse(source, Syntax.parser(), null);

        assertThat(root.print(), equalTo(source.text()));
    }

    @Test
    public void reportsFirstDifferingOffset() {
        SourceBuffer source = SourceBuffer.of("abc");

        RoundTripMismatchException e = assertThrows(RoundTripMismatchException.class,
                () -> RoundTrip.verifyPrinted(source, "abd"));

        assertThat(e.offset(), equalTo(2));
    }

    @Test
    public void reportsLengthDifference() {
        SourceBuffer source = SourceBuffer.of("abc");

        RoundTripMismatchException e = assertThrows(RoundTripMismatchException.class,
                () -> RoundTrip.verifyPrinted(source, "ab"));

        assertThat(e.offset(), equalTo(2));
    }

    @Test
    public void catchesLexerThatDropsTrivia() {
        SyntaxParser lossy = new SyntaxParser() {
            @Override
            public List<RawSyntax.Token> tokenize(SourceBuffer source) {
                return Syntax.tokenize(source).stream()
                        .map(token -> RawSyntax.Token.of(token.kind(), token.text()))
                        .collect(Collectors.toList());
            }

            @Override
            public RawSyntax parse(SourceBuffer source, ParsingCache cache) {
                return Syntax.parse(source, cache).root();
            }
        };

        RoundTripMismatchException e = assertThrows(RoundTripMismatchException.class,
                () -> RoundTrip.verifyLex(SourceBuffer.of("a b"), lossy));

        assertThat(e.offset(), equalTo(1));
    }

    @Test
    public void catchesPositionDisagreement() {
        RawSyntax root = ParserTest.parse("a b");

        PositionMismatchException e = assertThrows(PositionMismatchException.class,
                () -> RoundTrip.verifyPositions(SourceBuffer.of("a\nb"), root));

        assertThat(e.treePosition(), equalTo(new AbsolutePosition(2, 1, 3)));
        assertThat(e.sourcePosition(), equalTo(new AbsolutePosition(2, 2, 1)));
    }

    @Test
    public void catchesWidthDisagreement() {
        RawSyntax root = ParserTest.parse("a b");

        assertThrows(RoundTripMismatchException.class, () -> RoundTrip.verifyPositions(SourceBuffer.of("a"), root));
    }
}
