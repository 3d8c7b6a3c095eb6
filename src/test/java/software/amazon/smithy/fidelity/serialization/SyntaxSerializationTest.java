/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.serialization;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.syntax.RawSyntax;
import software.amazon.smithy.fidelity.syntax.Syntax;
import software.amazon.smithy.fidelity.syntax.SyntaxKind;
import software.amazon.smithy.fidelity.syntax.Trivia;
import software.amazon.smithy.fidelity.syntax.TriviaKind;
import software.amazon.smithy.fidelity.syntax.TriviaPiece;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

public class SyntaxSerializationTest {
    @Test
    public void roundTripsBinaryExpression() {
        RawSyntax root = parse("a+b");

        RawSyntax copy = SyntaxDeserializer.deserialize(SyntaxSerializer.serialize(root));

        assertThat(copy.print(), equalTo("a+b"));
        assertThat(copy.width(), equalTo(3));
        List<RawSyntax> binaries = new ArrayList<>();
        copy.consume(node -> {
            if (node.kind() == SyntaxKind.BINARY_EXPR) {
                binaries.add(node);
            }
        });
        assertThat(binaries, hasSize(1));
        List<RawSyntax.Token> significant = new ArrayList<>();
        copy.forEachToken(token -> {
            if (token.kind() != SyntaxKind.EOF) {
                significant.add(token);
            }
        });
        assertThat(significant, hasSize(3));
    }

    @Test
    public void writesOneRecordPerNode() {
        ObjectNode node = SyntaxSerializer.toNode(parse("a")).expectObjectNode();

        assertThat(node.expectStringMember("kind").getValue(), equalTo("SourceFile"));
        assertThat(node.expectNumberMember("width").getValue().intValue(), equalTo(1));
        assertThat(node.expectArrayMember("layout").size(), equalTo(2));

        ObjectNode eof = node.expectArrayMember("layout").get(1).get().expectObjectNode();
        assertThat(eof.expectStringMember("kind").getValue(), equalTo("eof"));
        assertThat(eof.expectStringMember("text").getValue(), equalTo(""));
    }

    @Test
    public void writesTriviaPieces() {
        RawSyntax.Token identifier = new RawSyntax.Token(SyntaxKind.IDENTIFIER, "a", Trivia.EMPTY, Trivia.of(
                TriviaPiece.counted(TriviaKind.SPACE, 2),
                TriviaPiece.textual(TriviaKind.LINE_COMMENT, "// x")));
        ObjectNode token = SyntaxSerializer.toNode(identifier).expectObjectNode();

        assertThat(token.expectNumberMember("width").getValue().intValue(), equalTo(7));
        assertThat(token.expectArrayMember("leadingTrivia").size(), equalTo(0));

        ObjectNode piece = token.expectArrayMember("trailingTrivia").get(0).get().expectObjectNode();
        assertThat(piece.expectStringMember("kind").getValue(), equalTo("Space"));
        assertThat(piece.expectNumberMember("value").getValue().intValue(), equalTo(2));
        ObjectNode comment = token.expectArrayMember("trailingTrivia").get(1).get().expectObjectNode();
        assertThat(comment.expectStringMember("value").getValue(), equalTo("// x"));
    }

    @Test
    public void keepsMissingChildren() {
        RawSyntax root = parse("let x");

        RawSyntax.Layout copy = (RawSyntax.Layout) SyntaxDeserializer.deserialize(SyntaxSerializer.serialize(root));
        RawSyntax.Layout items = (RawSyntax.Layout) copy.child(0);
        RawSyntax.Layout decl = (RawSyntax.Layout) items.child(0);

        assertThat(decl.childCount(), equalTo(5));
        assertThat(decl.isMissing(2), is(true));
        assertThat(decl.isMissing(4), is(true));
    }

    @Test
    public void roundTripsTriviaAndNonAsciiBytes() {
        byte[] bytes = {'#', '!', 'x', '\r', '\n', (byte) 0xC3, (byte) 0xA9, ' ', '/', '*', (byte) 0xFF, '*', '/', '\n'};
        SourceBuffer source = SourceBuffer.fromBytes(bytes);
        RawSyntax root = Syntax.parse(source).root();

        String json = SyntaxSerializer.serialize(root);
        RawSyntax copy = SyntaxDeserializer.deserialize(json);

        assertThat(SourceBuffer.toBytes(copy.print()), equalTo(bytes));
        assertThat(SyntaxSerializer.serialize(copy), equalTo(json));
    }

    @Test
    public void widthIsOptional() {
        RawSyntax token = SyntaxDeserializer.deserialize("{\"kind\": \"identifier\", \"text\": \"a\"}");

        assertThat(token.kind(), equalTo(SyntaxKind.IDENTIFIER));
        assertThat(token.width(), equalTo(1));
    }

    @Test
    public void readsFromNode() {
        Node node = Node.objectNodeBuilder()
                .withMember("kind", "IdentifierExpr")
                .withMember("layout", Node.fromNodes(Node.objectNodeBuilder()
                        .withMember("kind", "identifier")
                        .withMember("text", "b")
                        .build()))
                .build();

        RawSyntax syntax = SyntaxDeserializer.fromNode(node);

        assertThat(syntax.kind(), equalTo(SyntaxKind.IDENTIFIER_EXPR));
        assertThat(syntax.print(), equalTo("b"));
    }

    @Test
    public void readsEmptySourceFile() {
        RawSyntax root = SyntaxDeserializer.deserialize("{\"kind\": \"SourceFile\", \"layout\": ["
                + "{\"kind\": \"CodeBlockItemList\", \"layout\": []},"
                + " {\"kind\": \"eof\", \"text\": \"\", \"leadingTrivia\": [{\"kind\": \"Newline\", \"value\": 1}]}]}");

        assertThat(root.kind(), equalTo(SyntaxKind.SOURCE_FILE));
        assertThat(root.print(), equalTo("\n"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[]",
            "{\"text\": \"a\"}",
            "{\"kind\": \"Nope\", \"layout\": []}",
            "{\"kind\": \"identifier\", \"layout\": []}",
            "{\"kind\": \"BinaryExpr\", \"text\": \"a\"}",
            "{\"kind\": \"BinaryExpr\", \"layout\": {}}",
            "{\"kind\": \"plus\", \"text\": \"-\"}",
            "{\"kind\": \"identifier\", \"text\": 1}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"width\": 5}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"width\": -1}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"leadingTrivia\": [{\"kind\": \"Space\", \"value\": 0}]}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"leadingTrivia\": [{\"kind\": \"Space\", \"value\": \" \"}]}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"leadingTrivia\": [{\"kind\": \"LineComment\", \"value\": 1}]}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"leadingTrivia\": [{\"kind\": \"Shrug\", \"value\": 1}]}",
            "{\"kind\": \"identifier\", \"text\": \"a\", \"trailingTrivia\": [{\"kind\": \"Space\"}]}",
            "{\"kind\": \"IdentifierExpr\", \"width\": 1, \"layout\": [{\"kind\": \"identifier\", \"text\": \"ab\"}]}",
            "{\"kind\": \"IdentifierExpr\", \"layout\": [{\"kind\": \"identifier\", \"text\": \"a\", \"width\": 2}]}",
            "{\"kind\": \"IdentifierExpr\", \"layout\": [1]}",
            "{\"kind\": \"BinaryExpr\", \"layout\": []}",
            "{\"kind\": \"LetDecl\", \"layout\": [{\"kind\": \"kw_let\", \"text\": \"let\"}]}",
            "{\"kind\": \"LetDecl\", \"layout\": [null, null, null, null, null, null, null]}",
            "{\"kind\": \"CodeBlockItemList\", \"layout\": [null]}",
            "{\"kind\": \"SourceFile\", \"layout\": [{\"kind\": \"CodeBlockItemList\", \"layout\": []}, null]}",
            "{\"kind\": \"SourceFile\", \"layout\": [{\"kind\": \"CodeBlockItemList\", \"layout\": []},"
                    + " {\"kind\": \"identifier\", \"text\": \"a\"}]}",
            "{\"kind\": \"SourceFile\", \"layout\": [{\"kind\": \"eof\", \"text\": \"\"},"
                    + " {\"kind\": \"eof\", \"text\": \"\"}]}"
    })
    public void rejectsMalformedDocuments(String json) {
        assertThrows(MalformedDocumentException.class, () -> SyntaxDeserializer.deserialize(json));
    }

    private static RawSyntax parse(String text) {
        return Syntax.parse(SourceBuffer.of(text)).root();
    }
}
