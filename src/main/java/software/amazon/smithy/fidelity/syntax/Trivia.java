/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable, ordered sequence of {@link TriviaPiece}s attached before
 * (leading) or after (trailing) a token.
 */
public final class Trivia {
    public static final Trivia EMPTY = new Trivia(List.of());

    private final List<TriviaPiece> pieces;
    private final int width;

    private Trivia(List<TriviaPiece> pieces) {
        this.pieces = pieces;
        int sum = 0;
        for (TriviaPiece piece : pieces) {
            sum += piece.width();
        }
        this.width = sum;
    }

    /**
     * @param pieces Pieces in source order
     * @return Trivia made of {@code pieces}
     */
    public static Trivia of(List<TriviaPiece> pieces) {
        if (pieces.isEmpty()) {
            return EMPTY;
        }
        return new Trivia(List.copyOf(pieces));
    }

    /**
     * @param pieces Pieces in source order
     * @return Trivia made of {@code pieces}
     */
    public static Trivia of(TriviaPiece... pieces) {
        return of(List.of(pieces));
    }

    public List<TriviaPiece> pieces() {
        return pieces;
    }

    public int width() {
        return width;
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    /**
     * @param out Where to print this trivia
     */
    public void print(StringBuilder out) {
        for (TriviaPiece piece : pieces) {
            piece.print(out);
        }
    }

    /**
     * @return The text of this trivia
     */
    public String text() {
        StringBuilder builder = new StringBuilder(width);
        print(builder);
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Trivia other && pieces.equals(other.pieces);
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        return pieces.toString();
    }

    /**
     * Accumulates pieces, merging consecutive runs of the same counted kind.
     */
    static final class Builder {
        private final List<TriviaPiece> pieces = new ArrayList<>();

        void addCounted(TriviaKind kind) {
            int last = pieces.size() - 1;
            if (last >= 0 && pieces.get(last).kind() == kind) {
                pieces.set(last, TriviaPiece.counted(kind, pieces.get(last).count() + 1));
            } else {
                pieces.add(TriviaPiece.counted(kind, 1));
            }
        }

        void addText(TriviaKind kind, String text) {
            pieces.add(TriviaPiece.textual(kind, text));
        }

        Trivia build() {
            return Trivia.of(pieces);
        }
    }
}
