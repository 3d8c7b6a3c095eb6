/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.serialization;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import software.amazon.smithy.fidelity.syntax.RawSyntax;
import software.amazon.smithy.fidelity.syntax.SyntaxKind;
import software.amazon.smithy.fidelity.syntax.Trivia;
import software.amazon.smithy.fidelity.syntax.TriviaKind;
import software.amazon.smithy.fidelity.syntax.TriviaPiece;
import software.amazon.smithy.model.loader.ModelSyntaxException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.NumberNode;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;

/**
 * Converts an interchange document written by {@link SyntaxSerializer}
 * back into a {@link RawSyntax} tree.
 *
 * <p>All text in the resulting tree is copied out of the document, so the
 * tree doesn't depend on the document once built. Any inconsistency in the
 * document fails the whole conversion with a {@link MalformedDocumentException}.
 */
public final class SyntaxDeserializer {
    private SyntaxDeserializer() {
    }

    /**
     * @param json The interchange document, as JSON
     * @return The tree it describes
     * @throws MalformedDocumentException If the document is invalid
     */
    public static RawSyntax deserialize(String json) {
        Node node;
        try {
            node = Node.parse(json);
        } catch (ModelSyntaxException e) {
            throw new MalformedDocumentException("Syntax tree document is not valid JSON: " + e.getMessage(), e);
        }
        return fromNode(node);
    }

    /**
     * @param node The interchange document
     * @return The tree it describes
     * @throws MalformedDocumentException If the document is invalid
     */
    public static RawSyntax fromNode(Node node) {
        ObjectNode object = expectObject(node, "syntax node");
        String kindName = expectString(object, SyntaxSerializer.KIND);
        SyntaxKind kind = SyntaxKind.fromSerializedName(kindName);
        if (kind == null) {
            throw new MalformedDocumentException("Unknown syntax kind `" + kindName + "`");
        }

        RawSyntax result = kind.isToken() ? token(kind, object) : layout(kind, object);

        Optional<Node> width = object.getMember(SyntaxSerializer.WIDTH);
        if (width.isPresent()) {
            int expected = expectNatural(width.get(), "width of " + kindName);
            if (expected != result.width()) {
                throw new MalformedDocumentException(String.format(
                        "`%s` node claims a width of %d, but its contents are %d bytes wide",
                        kindName, expected, result.width()));
            }
        }
        return result;
    }

    private static RawSyntax.Token token(SyntaxKind kind, ObjectNode object) {
        if (object.getMember(SyntaxSerializer.LAYOUT).isPresent()) {
            throw new MalformedDocumentException("Token kind `" + kind.serializedName() + "` can't have a layout");
        }
        String text = expectString(object, SyntaxSerializer.TEXT);
        if (kind.spelling() != null && !kind.spelling().equals(text)) {
            throw new MalformedDocumentException(String.format(
                    "Token kind `%s` must have text `%s`, found `%s`", kind.serializedName(), kind.spelling(), text));
        }
        Trivia leading = trivia(object, SyntaxSerializer.LEADING_TRIVIA);
        Trivia trailing = trivia(object, SyntaxSerializer.TRAILING_TRIVIA);
        return new RawSyntax.Token(kind, text, leading, trailing);
    }

    private static RawSyntax.Layout layout(SyntaxKind kind, ObjectNode object) {
        Optional<Node> layoutMember = object.getMember(SyntaxSerializer.LAYOUT);
        if (layoutMember.isEmpty()) {
            throw new MalformedDocumentException("Layout kind `" + kind.serializedName() + "` is missing its layout");
        }
        ArrayNode elements = expectArray(layoutMember.get(), "layout of " + kind.serializedName());
        if (kind.hasFixedChildCount() && elements.size() != kind.childCount()) {
            throw new MalformedDocumentException(String.format(
                    "`%s` must have %d children, found %d", kind.serializedName(), kind.childCount(), elements.size()));
        }
        List<RawSyntax> children = new ArrayList<>(elements.size());
        for (Node element : elements.getElements()) {
            if (element.isNullNode() && !kind.hasFixedChildCount()) {
                throw new MalformedDocumentException("`" + kind.serializedName() + "` can't have missing children");
            }
            children.add(element.isNullNode() ? null : fromNode(element));
        }
        if (kind == SyntaxKind.SOURCE_FILE) {
            expectChild(kind, children, 0, SyntaxKind.CODE_BLOCK_ITEM_LIST);
            expectChild(kind, children, 1, SyntaxKind.EOF);
        }
        return new RawSyntax.Layout(kind, children);
    }

    private static void expectChild(SyntaxKind parent, List<RawSyntax> children, int index, SyntaxKind kind) {
        RawSyntax child = children.get(index);
        if (child == null || child.kind() != kind) {
            throw new MalformedDocumentException(String.format(
                    "Child %d of `%s` must be `%s`, found %s", index, parent.serializedName(), kind.serializedName(),
                    child == null ? "nothing" : "`" + child.kind().serializedName() + "`"));
        }
    }

    private static Trivia trivia(ObjectNode token, String member) {
        Optional<Node> triviaMember = token.getMember(member);
        if (triviaMember.isEmpty()) {
            return Trivia.EMPTY;
        }

        List<TriviaPiece> pieces = new ArrayList<>();
        for (Node element : expectArray(triviaMember.get(), member).getElements()) {
            ObjectNode piece = expectObject(element, "trivia piece");
            String kindName = expectString(piece, SyntaxSerializer.KIND);
            TriviaKind kind = TriviaKind.fromSerializedName(kindName);
            if (kind == null) {
                throw new MalformedDocumentException("Unknown trivia kind `" + kindName + "`");
            }

            Node value = piece.getMember(SyntaxSerializer.VALUE)
                    .orElseThrow(() -> new MalformedDocumentException("Trivia piece `" + kindName + "` has no value"));
            if (kind.isCounted()) {
                int count = expectNatural(value, "count of " + kindName);
                if (count == 0) {
                    throw new MalformedDocumentException("Trivia piece `" + kindName + "` must have a positive count");
                }
                pieces.add(TriviaPiece.counted(kind, count));
            } else {
                Optional<StringNode> text = value.asStringNode();
                if (text.isEmpty()) {
                    throw new MalformedDocumentException("Trivia piece `" + kindName + "` must have string text");
                }
                pieces.add(TriviaPiece.textual(kind, text.get().getValue()));
            }
        }
        return Trivia.of(pieces);
    }

    private static ObjectNode expectObject(Node node, String what) {
        return node.asObjectNode()
                .orElseThrow(() -> new MalformedDocumentException("Expected " + what + " to be an object, found "
                        + node.getType()));
    }

    private static ArrayNode expectArray(Node node, String what) {
        return node.asArrayNode()
                .orElseThrow(() -> new MalformedDocumentException("Expected " + what + " to be an array, found "
                        + node.getType()));
    }

    private static String expectString(ObjectNode object, String member) {
        return object.getMember(member)
                .flatMap(Node::asStringNode)
                .map(StringNode::getValue)
                .orElseThrow(() -> new MalformedDocumentException("Expected a string `" + member + "` member"));
    }

    private static int expectNatural(Node node, String what) {
        Optional<NumberNode> number = node.asNumberNode();
        if (number.isEmpty() || !number.get().isNaturalNumber()) {
            throw new MalformedDocumentException("Expected " + what + " to be a non-negative integer");
        }
        long value = number.get().getValue().longValue();
        if (value > Integer.MAX_VALUE) {
            throw new MalformedDocumentException("Expected " + what + " to fit in an int, found " + value);
        }
        return (int) value;
    }
}
