/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.fidelity.document.SourceBuffer;

/**
 * Derives {@link AbsolutePosition}s for nodes of a tree from the widths of
 * everything before them. Positions are never cached in the nodes, which
 * stay reusable at any offset in any tree.
 *
 * <p>Lines are resolved against the printed text of the whole tree, so a
 * {@code \r\n} split between two tokens is still one line break.
 */
public final class SyntaxPositions {
    private SyntaxPositions() {
    }

    /**
     * Finds the position of the first occurrence of {@code target} in
     * {@code root}, comparing nodes by identity.
     *
     * @param root The root of the tree
     * @param target The node to find
     * @return The position of the start of {@code target}, including its
     *  leading trivia, or {@code null} if {@code target} isn't in the tree
     */
    public static AbsolutePosition positionOf(RawSyntax root, RawSyntax target) {
        Walk walk = new Walk(target);
        if (!walk.visit(root)) {
            return null;
        }
        return SourceBuffer.of(root.print()).positionAtOffset(walk.offset);
    }

    /**
     * @param root The root of the tree
     * @return Every token in the tree, with its position
     */
    public static List<PositionedToken> tokens(RawSyntax root) {
        SourceBuffer printed = SourceBuffer.of(root.print());
        List<PositionedToken> tokens = new ArrayList<>();
        int[] offset = {0};
        root.forEachToken(token -> {
            int start = offset[0];
            offset[0] += token.width();
            tokens.add(new PositionedToken(
                    token,
                    printed.positionAtOffset(start),
                    printed.positionAtOffset(start + token.leadingTrivia().width()),
                    printed.positionAtOffset(offset[0])));
        });
        return tokens;
    }

    /**
     * @param root The root of the tree
     * @return The position of the last token of the tree, which for a
     *  source file is the start of its eof token's leading trivia
     */
    public static PositionedToken lastToken(RawSyntax root) {
        List<PositionedToken> tokens = tokens(root);
        if (tokens.isEmpty()) {
            return null;
        }
        return tokens.get(tokens.size() - 1);
    }

    private static final class Walk {
        private final RawSyntax target;
        private int offset;

        Walk(RawSyntax target) {
            this.target = target;
        }

        // Returns true once the target has been found, leaving offset at its start
        boolean visit(RawSyntax node) {
            if (node == target) {
                return true;
            }
            if (node instanceof RawSyntax.Layout layout) {
                for (RawSyntax child : layout.children()) {
                    if (child != null && visit(child)) {
                        return true;
                    }
                }
            } else {
                offset += node.width();
            }
            return false;
        }
    }
}
