/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.List;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.ParsingCache;

/**
 * Checks that syntax built from a source prints back to exactly that source,
 * and that positions derived from it agree with the source.
 *
 * <p>Printing only looks at the tree, never at the source, so these checks
 * catch any byte the lexer or parser dropped, duplicated or moved.
 */
public final class RoundTrip {
    private RoundTrip() {
    }

    /**
     * @param source The source to lex
     * @param parser The parser to lex with
     * @return The tokens of {@code source}
     * @throws RoundTripMismatchException If the tokens don't print as {@code source}
     */
    public static List<RawSyntax.Token> verifyLex(SourceBuffer source, SyntaxParser parser) {
        List<RawSyntax.Token> tokens = parser.tokenize(source);
        StringBuilder printed = new StringBuilder(source.length());
        for (RawSyntax.Token token : tokens) {
            token.print(printed);
        }
        verifyPrinted(source, printed);
        return tokens;
    }

    /**
     * @param source The source to parse
     * @param parser The parser to parse with
     * @param cache The parsing cache to give the parser, or {@code null}
     * @return The tree for {@code source}
     * @throws RoundTripMismatchException If the tree doesn't print as {@code source}
     */
    public static RawSyntax verifyParse(SourceBuffer source, SyntaxParser parser, ParsingCache cache) {
        RawSyntax root = parser.parse(source, cache);
        verifyPrinted(source, root.print());
        return root;
    }

    /**
     * @param source The original source
     * @param printed Text printed from syntax built from {@code source}
     * @throws RoundTripMismatchException If {@code printed} differs from {@code source}
     */
    public static void verifyPrinted(SourceBuffer source, CharSequence printed) {
        String expected = source.text();
        int length = Math.min(expected.length(), printed.length());
        for (int i = 0; i < length; i++) {
            if (expected.charAt(i) != printed.charAt(i)) {
                throw mismatch(source, i);
            }
        }
        if (expected.length() != printed.length()) {
            throw new RoundTripMismatchException(String.format(
                    "Printed syntax is %d bytes long, but the source is %d bytes long",
                    printed.length(), expected.length()), length);
        }
    }

    /**
     * Checks the position of every token of {@code root} against the
     * position of the same offset in {@code source}.
     *
     * @param source The source {@code root} was built from
     * @param root The tree to check
     * @throws PositionMismatchException If any position disagrees
     * @throws RoundTripMismatchException If {@code root} isn't as wide as {@code source}
     */
    public static void verifyPositions(SourceBuffer source, RawSyntax root) {
        if (root.width() != source.length()) {
            throw new RoundTripMismatchException(String.format(
                    "Syntax tree is %d bytes wide, but the source is %d bytes long",
                    root.width(), source.length()), Math.min(root.width(), source.length()));
        }
        for (PositionedToken token : SyntaxPositions.tokens(root)) {
            verifyPosition(source, token.position());
            verifyPosition(source, token.textPosition());
        }
    }

    /**
     * @param source The source a position was derived for
     * @param position The derived position
     * @throws PositionMismatchException If {@code source} disagrees with {@code position}
     */
    public static void verifyPosition(SourceBuffer source, AbsolutePosition position) {
        AbsolutePosition expected = source.positionAtOffset(position.offset());
        if (!position.equals(expected)) {
            throw new PositionMismatchException(position, expected);
        }
    }

    private static RoundTripMismatchException mismatch(SourceBuffer source, int offset) {
        AbsolutePosition position = source.positionAtOffset(offset);
        return new RoundTripMismatchException("Printed syntax differs from the source at " + position, offset);
    }
}
