/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import software.amazon.smithy.fidelity.document.SourceBuffer;

public class SyntaxPositionsTest {
    @Test
    public void positionsTokensAcrossLines() {
        RawSyntax root = ParserTest.parse("let x\n  = 1");
        List<PositionedToken> tokens = SyntaxPositions.tokens(root);

        assertThat(tokens, hasSize(5));
        assertThat(tokens.get(1).position(), equalTo(new AbsolutePosition(4, 1, 5)));
        PositionedToken equal = tokens.get(2);
        assertThat(equal.token().kind(), equalTo(SyntaxKind.EQUAL));
        assertThat(equal.position(), equalTo(new AbsolutePosition(5, 1, 6)));
        assertThat(equal.textPosition(), equalTo(new AbsolutePosition(8, 2, 3)));
        assertThat(equal.endPosition(), equalTo(new AbsolutePosition(10, 2, 5)));
        assertThat(tokens.get(3).position(), equalTo(new AbsolutePosition(10, 2, 5)));
    }

    @Test
    public void findsNodeByIdentity() {
        RawSyntax.Layout root = ParserTest.parse("a;\nb + c;");
        RawSyntax.Layout items = (RawSyntax.Layout) root.child(0);
        RawSyntax.Layout second = (RawSyntax.Layout) items.child(1);
        RawSyntax.Layout binary = (RawSyntax.Layout) second.child(0);

        assertThat(SyntaxPositions.positionOf(root, second), equalTo(new AbsolutePosition(2, 1, 3)));
        assertThat(SyntaxPositions.positionOf(root, binary.child(2)), equalTo(new AbsolutePosition(7, 2, 5)));
    }

    @Test
    public void lastTokenIsEof() {
        RawSyntax root = ParserTest.parse("a\r\n// end\r\n");
        PositionedToken eof = SyntaxPositions.lastToken(root);

        assertThat(eof.token().kind(), equalTo(SyntaxKind.EOF));
        assertThat(eof.position(), equalTo(new AbsolutePosition(1, 1, 2)));
        assertThat(eof.textPosition(), equalTo(new AbsolutePosition(11, 3, 1)));
    }

    @Test
    public void countsCarriageReturnLineFeedSplitBetweenTokensOnce() {
        RawSyntax.Token unknown = RawSyntax.Token.of(SyntaxKind.UNKNOWN, "x\r");
        RawSyntax.Token eof = new RawSyntax.Token(SyntaxKind.EOF, "",
                Trivia.of(TriviaPiece.counted(TriviaKind.NEWLINE, 1)), Trivia.EMPTY);
        RawSyntax statement = RawSyntax.Layout.of(SyntaxKind.UNKNOWN_STMT, unknown);
        RawSyntax root = RawSyntax.Layout.of(SyntaxKind.SOURCE_FILE,
                RawSyntax.Layout.of(SyntaxKind.CODE_BLOCK_ITEM_LIST, statement), eof);
        SourceBuffer source = SourceBuffer.of("x\r\n");

        PositionedToken last = SyntaxPositions.lastToken(root);

        assertThat(last.position(), equalTo(new AbsolutePosition(2, 1, 3)));
        assertThat(last.textPosition(), equalTo(new AbsolutePosition(3, 2, 1)));
        assertThat(SyntaxPositions.positionOf(root, eof), equalTo(source.positionAtOffset(2)));
        RoundTrip.verifyPositions(source, root);
    }

    @ParameterizedTest
    @MethodSource("sources")
    public void positionsAgreeWithSource(String text) {
        SourceBuffer source = SourceBuffer.of(text);
        RawSyntax root = Syntax.parse(source).root();

        for (PositionedToken token : SyntaxPositions.tokens(root)) {
            assertThat(token.position(), equalTo(source.positionAtOffset(token.position().offset())));
            assertThat(token.textPosition(), equalTo(source.positionAtOffset(token.textPosition().offset())));
        }
        RoundTrip.verifyPositions(source, root);
    }

    static Stream<String> sources() {
        return Stream.of(
                "",
                "\n",
                "let x = 1;\r\nlet y = 2;\rlet z = 3;\n",
                "/* multi\nline\r\ncomment */ a /* trailing\n */ b",
                "\"bad\n\"bad\r\n\"",
                "#!x\r\n\r\n\n\r");
    }
}
