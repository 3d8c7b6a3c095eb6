/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable, position-free node of a full-fidelity syntax tree.
 *
 * <p>A node is either a {@link Token}, which holds text and the trivia
 * surrounding it, or a {@link Layout}, which holds an ordered list of
 * children. Every node caches its width in bytes, and printing a node
 * reproduces exactly the source it was built from.
 *
 * <p>Nodes never change once built, and carry no parent pointers or
 * offsets, so the same instance can appear in many trees, or many times in
 * one tree. Incremental parsing relies on this: a new tree reuses a subtree
 * of an old tree by referencing the old instance.
 */
public abstract sealed class RawSyntax {
    final SyntaxKind kind;

    RawSyntax(SyntaxKind kind) {
        this.kind = Objects.requireNonNull(kind);
    }

    public final SyntaxKind kind() {
        return kind;
    }

    /**
     * @return The number of bytes this node prints as
     */
    public abstract int width();

    /**
     * @param out Where to print the exact text of this node
     */
    public abstract void print(StringBuilder out);

    /**
     * @return The exact text of this node
     */
    public final String print() {
        StringBuilder builder = new StringBuilder(width());
        print(builder);
        return builder.toString();
    }

    /**
     * Applies {@code consumer} to every token of this node, in order.
     *
     * @param consumer Consumer to do something with each token
     */
    public abstract void forEachToken(Consumer<Token> consumer);

    /**
     * Applies {@code consumer} to this node and every present descendant in
     * depth-first order.
     *
     * @param consumer Consumer to do something with each node
     */
    public final void consume(Consumer<RawSyntax> consumer) {
        consumer.accept(this);
        if (this instanceof Layout layout) {
            for (RawSyntax child : layout.children) {
                if (child != null) {
                    child.consume(consumer);
                }
            }
        }
    }

    /**
     * @return The tokens of this node in order
     */
    public final List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        forEachToken(tokens::add);
        return tokens;
    }

    /**
     * @return The first token of this node, or {@code null} if it has none
     */
    public abstract Token firstToken();

    /**
     * @return The last token of this node, or {@code null} if it has none
     */
    public abstract Token lastToken();

    @Override
    public final String toString() {
        return kind.serializedName() + "[" + width() + "]";
    }

    /**
     * A token, along with the trivia on either side of it.
     */
    public static final class Token extends RawSyntax {
        private final String text;
        private final Trivia leadingTrivia;
        private final Trivia trailingTrivia;
        private final int width;

        public Token(SyntaxKind kind, String text, Trivia leadingTrivia, Trivia trailingTrivia) {
            super(kind);
            if (!kind.isToken()) {
                throw new IllegalArgumentException(kind + " is not a token kind");
            }
            this.text = Objects.requireNonNull(text);
            this.leadingTrivia = Objects.requireNonNull(leadingTrivia);
            this.trailingTrivia = Objects.requireNonNull(trailingTrivia);
            this.width = leadingTrivia.width() + text.length() + trailingTrivia.width();
        }

        /**
         * @param kind The token kind
         * @param text The token text, with no trivia
         * @return A token with no trivia
         */
        public static Token of(SyntaxKind kind, String text) {
            return new Token(kind, text, Trivia.EMPTY, Trivia.EMPTY);
        }

        public String text() {
            return text;
        }

        public Trivia leadingTrivia() {
            return leadingTrivia;
        }

        public Trivia trailingTrivia() {
            return trailingTrivia;
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public void print(StringBuilder out) {
            leadingTrivia.print(out);
            out.append(text);
            trailingTrivia.print(out);
        }

        @Override
        public void forEachToken(Consumer<Token> consumer) {
            consumer.accept(this);
        }

        @Override
        public Token firstToken() {
            return this;
        }

        @Override
        public Token lastToken() {
            return this;
        }
    }

    /**
     * A grammar production, made of child nodes. A {@code null} child is
     * missing: it takes up no space but keeps the position of every other
     * child stable.
     */
    public static final class Layout extends RawSyntax {
        private final List<RawSyntax> children;
        private final int width;

        public Layout(SyntaxKind kind, List<RawSyntax> children) {
            super(kind);
            if (!kind.isLayout()) {
                throw new IllegalArgumentException(kind + " is not a layout kind");
            }
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
            int sum = 0;
            for (RawSyntax child : this.children) {
                if (child != null) {
                    sum += child.width();
                }
            }
            this.width = sum;
        }

        /**
         * @param kind The layout kind
         * @param children Children in order, {@code null} for missing children
         * @return The created layout
         */
        public static Layout of(SyntaxKind kind, RawSyntax... children) {
            List<RawSyntax> list = new ArrayList<>(children.length);
            Collections.addAll(list, children);
            return new Layout(kind, list);
        }

        /**
         * @return The children of this layout, which may contain {@code null}
         */
        public List<RawSyntax> children() {
            return children;
        }

        /**
         * @param index Index of the child
         * @return The child, or {@code null} if it is missing
         */
        public RawSyntax child(int index) {
            return children.get(index);
        }

        public int childCount() {
            return children.size();
        }

        /**
         * @param index Index of the child to check
         * @return Whether the child at {@code index} is missing
         */
        public boolean isMissing(int index) {
            return children.get(index) == null;
        }

        /**
         * @param index Index of the child
         * @return The offset of the child relative to the start of this layout
         */
        public int childOffset(int index) {
            int offset = 0;
            for (int i = 0; i < index; i++) {
                RawSyntax child = children.get(i);
                if (child != null) {
                    offset += child.width();
                }
            }
            return offset;
        }

        /**
         * @param index Index of the child to replace
         * @param newChild The replacement, or {@code null} to mark it missing
         * @return A new layout sharing every other child with this one
         */
        public Layout withReplacedChild(int index, RawSyntax newChild) {
            List<RawSyntax> copy = new ArrayList<>(children);
            copy.set(index, newChild);
            return new Layout(kind, copy);
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public void print(StringBuilder out) {
            for (RawSyntax child : children) {
                if (child != null) {
                    child.print(out);
                }
            }
        }

        @Override
        public void forEachToken(Consumer<Token> consumer) {
            for (RawSyntax child : children) {
                if (child != null) {
                    child.forEachToken(consumer);
                }
            }
        }

        @Override
        public Token firstToken() {
            for (RawSyntax child : children) {
                if (child != null) {
                    Token token = child.firstToken();
                    if (token != null) {
                        return token;
                    }
                }
            }
            return null;
        }

        @Override
        public Token lastToken() {
            for (int i = children.size() - 1; i >= 0; i--) {
                RawSyntax child = children.get(i);
                if (child != null) {
                    Token token = child.lastToken();
                    if (token != null) {
                        return token;
                    }
                }
            }
            return null;
        }
    }
}
