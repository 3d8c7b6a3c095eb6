/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.Objects;

/**
 * A single run of trivia, either {@code count} repetitions of a counted
 * kind or a comment/garbage piece with literal {@code text}.
 *
 * @param kind The kind of trivia
 * @param count The number of repetitions, {@code 1} for textual pieces
 * @param text The literal text, {@code null} for counted pieces
 */
public record TriviaPiece(TriviaKind kind, int count, String text) {
    public TriviaPiece {
        Objects.requireNonNull(kind);
        if (kind.isCounted()) {
            if (count < 1 || text != null) {
                throw new IllegalArgumentException(kind + " trivia needs a positive count, got " + count);
            }
        } else if (text == null || count != 1) {
            throw new IllegalArgumentException(kind + " trivia needs text");
        }
    }

    /**
     * @param kind A counted kind
     * @param count Number of repetitions
     * @return The created piece
     */
    public static TriviaPiece counted(TriviaKind kind, int count) {
        return new TriviaPiece(kind, count, null);
    }

    /**
     * @param kind A textual kind
     * @param text The text of the piece
     * @return The created piece
     */
    public static TriviaPiece textual(TriviaKind kind, String text) {
        return new TriviaPiece(kind, 1, text);
    }

    /**
     * @return The number of bytes this piece prints as
     */
    public int width() {
        return kind.isCounted() ? kind.spelling().length() * count : text.length();
    }

    /**
     * @param out Where to print this piece
     */
    public void print(StringBuilder out) {
        if (kind.isCounted()) {
            out.append(kind.spelling().repeat(count));
        } else {
            out.append(text);
        }
    }
}
