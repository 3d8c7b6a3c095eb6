/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class RawSyntaxTest {
    private static final Trivia ONE_SPACE = Trivia.of(TriviaPiece.counted(TriviaKind.SPACE, 1));

    @Test
    void tokenWidthIncludesTrivia() {
        RawSyntax.Token token = new RawSyntax.Token(
                SyntaxKind.IDENTIFIER,
                "abc",
                Trivia.of(TriviaPiece.counted(TriviaKind.NEWLINE, 2), TriviaPiece.textual(TriviaKind.LINE_COMMENT, "//")),
                ONE_SPACE);

        assertThat(token.width(), equalTo(8));
        assertThat(token.print(), equalTo("\n\n//abc "));
    }

    @Test
    void layoutPrintsChildrenInOrder() {
        RawSyntax.Layout expr = binary("a", "+", "b");

        assertThat(expr.print(), equalTo("a + b "));
        assertThat(expr.width(), equalTo(6));
        assertThat(expr.toString(), equalTo("BinaryExpr[6]"));
    }

    @Test
    void missingChildrenAreZeroWidth() {
        RawSyntax.Token let = new RawSyntax.Token(SyntaxKind.KW_LET, "let", Trivia.EMPTY, ONE_SPACE);
        RawSyntax.Token name = RawSyntax.Token.of(SyntaxKind.IDENTIFIER, "x");
        RawSyntax.Layout decl = RawSyntax.Layout.of(SyntaxKind.LET_DECL, let, name, null, null, null);

        assertThat(decl.childCount(), equalTo(5));
        assertThat(decl.isMissing(1), is(false));
        assertThat(decl.isMissing(2), is(true));
        assertThat(decl.width(), equalTo(5));
        assertThat(decl.print(), equalTo("let x"));
        assertThat(decl.childOffset(4), equalTo(5));
        assertThat(decl.firstToken(), sameInstance(let));
        assertThat(decl.lastToken(), sameInstance(name));
    }

    @Test
    void emptyLayoutHasNoTokens() {
        RawSyntax.Layout list = new RawSyntax.Layout(SyntaxKind.CODE_BLOCK_ITEM_LIST, new ArrayList<>());

        assertThat(list.width(), equalTo(0));
        assertThat(list.firstToken(), nullValue());
        assertThat(list.lastToken(), nullValue());
        assertThat(list.tokens().isEmpty(), is(true));
    }

    @Test
    void replacingChildSharesTheRest() {
        RawSyntax.Layout expr = binary("a", "+", "b");
        RawSyntax replacement = identifier("c");

        RawSyntax.Layout replaced = expr.withReplacedChild(2, replacement);

        assertThat(replaced, not(sameInstance(expr)));
        assertThat(replaced.child(0), sameInstance(expr.child(0)));
        assertThat(replaced.child(1), sameInstance(expr.child(1)));
        assertThat(replaced.child(2), sameInstance(replacement));
        assertThat(replaced.print(), equalTo("a + c "));
        assertThat(expr.print(), equalTo("a + b "));
    }

    @Test
    void replacingChildWithNullMakesItMissing() {
        RawSyntax.Layout expr = binary("a", "+", "b");

        RawSyntax.Layout replaced = expr.withReplacedChild(2, null);

        assertThat(replaced.isMissing(2), is(true));
        assertThat(replaced.print(), equalTo("a + "));
    }

    @Test
    void iteratesTokensAndNodesInDocumentOrder() {
        RawSyntax.Layout expr = binary("a", "+", "b");
        List<SyntaxKind> kinds = new ArrayList<>();
        expr.consume(node -> kinds.add(node.kind()));

        assertThat(kinds, contains(
                SyntaxKind.BINARY_EXPR,
                SyntaxKind.IDENTIFIER_EXPR,
                SyntaxKind.IDENTIFIER,
                SyntaxKind.PLUS,
                SyntaxKind.IDENTIFIER_EXPR,
                SyntaxKind.IDENTIFIER));
        assertThat(expr.tokens().size(), equalTo(3));
    }

    @Test
    void rejectsMismatchedKinds() {
        assertThrows(IllegalArgumentException.class, () -> RawSyntax.Token.of(SyntaxKind.BINARY_EXPR, "a"));
        assertThrows(IllegalArgumentException.class, () -> RawSyntax.Layout.of(SyntaxKind.PLUS));
    }

    @Test
    void rejectsInvalidTriviaPieces() {
        assertThrows(IllegalArgumentException.class, () -> TriviaPiece.counted(TriviaKind.SPACE, 0));
        assertThrows(IllegalArgumentException.class, () -> TriviaPiece.counted(TriviaKind.LINE_COMMENT, 1));
        assertThrows(IllegalArgumentException.class, () -> TriviaPiece.textual(TriviaKind.NEWLINE, "\n"));
    }

    @Test
    void countedTriviaPrintsRepeatedSpelling() {
        Trivia trivia = Trivia.of(
                TriviaPiece.counted(TriviaKind.CARRIAGE_RETURN_LINE_FEED, 2),
                TriviaPiece.counted(TriviaKind.TAB, 3));

        assertThat(trivia.text(), equalTo("\r\n\r\n\t\t\t"));
        assertThat(trivia.width(), equalTo(7));
    }

    static RawSyntax.Layout identifier(String name) {
        return RawSyntax.Layout.of(SyntaxKind.IDENTIFIER_EXPR,
                new RawSyntax.Token(SyntaxKind.IDENTIFIER, name, Trivia.EMPTY, ONE_SPACE));
    }

    static RawSyntax.Layout binary(String left, String operator, String right) {
        SyntaxKind operatorKind = operator.equals("+") ? SyntaxKind.PLUS : SyntaxKind.STAR;
        return RawSyntax.Layout.of(SyntaxKind.BINARY_EXPR,
                identifier(left),
                new RawSyntax.Token(operatorKind, operator, Trivia.EMPTY, ONE_SPACE),
                identifier(right));
    }
}
