/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.serialization;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.fidelity.syntax.RawSyntax;
import software.amazon.smithy.fidelity.syntax.Trivia;
import software.amazon.smithy.fidelity.syntax.TriviaPiece;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Converts a {@link RawSyntax} tree into its interchange document, a JSON
 * {@link Node} with one object per syntax node.
 *
 * <p>A layout looks like:
 * <pre>
 *     {"kind": "BinaryExpr", "width": 3, "layout": [...]}
 * </pre>
 * where missing children are {@code null}. A token looks like:
 * <pre>
 *     {"kind": "identifier", "text": "a", "width": 2,
 *      "leadingTrivia": [], "trailingTrivia": [{"kind": "Space", "value": 1}]}
 * </pre>
 * Counted trivia has a number {@code value}, and comments and garbage text
 * have a string {@code value}. Widths are redundant and are checked by
 * {@link SyntaxDeserializer}.
 */
public final class SyntaxSerializer {
    static final String KIND = "kind";
    static final String WIDTH = "width";
    static final String LAYOUT = "layout";
    static final String TEXT = "text";
    static final String LEADING_TRIVIA = "leadingTrivia";
    static final String TRAILING_TRIVIA = "trailingTrivia";
    static final String VALUE = "value";

    private SyntaxSerializer() {
    }

    /**
     * @param node The tree to serialize
     * @return The interchange document for {@code node}
     */
    public static Node toNode(RawSyntax node) {
        if (node instanceof RawSyntax.Token token) {
            return ObjectNode.builder()
                    .withMember(KIND, token.kind().serializedName())
                    .withMember(TEXT, token.text())
                    .withMember(WIDTH, Node.from(token.width()))
                    .withMember(LEADING_TRIVIA, toNode(token.leadingTrivia()))
                    .withMember(TRAILING_TRIVIA, toNode(token.trailingTrivia()))
                    .build();
        }

        RawSyntax.Layout layout = (RawSyntax.Layout) node;
        List<Node> children = new ArrayList<>(layout.childCount());
        for (RawSyntax child : layout.children()) {
            children.add(child == null ? Node.nullNode() : toNode(child));
        }
        return ObjectNode.builder()
                .withMember(KIND, layout.kind().serializedName())
                .withMember(WIDTH, Node.from(layout.width()))
                .withMember(LAYOUT, ArrayNode.fromNodes(children))
                .build();
    }

    /**
     * @param node The tree to serialize
     * @return The interchange document for {@code node}, as pretty printed JSON
     */
    public static String serialize(RawSyntax node) {
        return Node.prettyPrintJson(toNode(node));
    }

    private static ArrayNode toNode(Trivia trivia) {
        List<Node> pieces = new ArrayList<>(trivia.pieces().size());
        for (TriviaPiece piece : trivia.pieces()) {
            Node value = piece.kind().isCounted() ? Node.from(piece.count()) : Node.from(piece.text());
            pieces.add(ObjectNode.builder()
                    .withMember(KIND, piece.kind().serializedName())
                    .withMember(VALUE, value)
                    .build());
        }
        return ArrayNode.fromNodes(pieces);
    }
}
