/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.utils.SimpleParser;

/**
 * Splits a {@link SourceBuffer} into {@link RawSyntax.Token}s with trivia.
 *
 * <p>Leading trivia takes every piece of whitespace and comment before a
 * token. Trailing trivia takes the same, but stops before the first line
 * break, so a line break always starts the leading trivia of the next token.
 * Whatever is left at the end of the file becomes the leading trivia of the
 * {@link SyntaxKind#EOF} token.
 *
 * <p>Lexing never fails. Input that doesn't start a valid token, including
 * an unterminated string, becomes a {@link SyntaxKind#UNKNOWN} token, and
 * an unterminated block comment runs to the end of the file. Each byte of
 * the input ends up in exactly one token.
 */
final class Lexer extends SimpleParser {
    private final SourceBuffer source;
    private final String text;

    Lexer(SourceBuffer source) {
        super(source.text());
        this.source = source;
        this.text = source.text();
    }

    /**
     * @param source Source to lex
     * @return Every token in {@code source}, ending with an eof token
     */
    static List<RawSyntax.Token> tokenize(SourceBuffer source) {
        Lexer lexer = new Lexer(source);
        List<RawSyntax.Token> tokens = new ArrayList<>();
        RawSyntax.Token token;
        do {
            token = lexer.lexToken();
            tokens.add(token);
        } while (token.kind() != SyntaxKind.EOF);
        return tokens;
    }

    /**
     * @return The next token, which is an eof token once the input is used up
     */
    RawSyntax.Token lexToken() {
        Trivia leading = trivia(false);
        if (eof()) {
            return new RawSyntax.Token(SyntaxKind.EOF, "", leading, Trivia.EMPTY);
        }

        int start = position();
        SyntaxKind kind = tokenKind();
        String tokenText = text.substring(start, position());
        if (kind == SyntaxKind.IDENTIFIER) {
            kind = SyntaxKind.keywordOrIdentifier(tokenText);
        }
        Trivia trailing = trivia(true);
        return new RawSyntax.Token(kind, tokenText, leading, trailing);
    }

    /**
     * Moves the lexer to {@code offset}, so the next token starts there.
     *
     * @param offset The offset to continue lexing from
     */
    void resetTo(int offset) {
        int line = source.lineOfOffset(offset);
        rewind(offset, line, offset - source.indexOfLine(line) + 1);
    }

    private SyntaxKind tokenKind() {
        char c = peek();
        if (isIdentifierStart(c)) {
            do {
                skip();
            } while (!eof() && isIdentifierPart(peek()));
            return SyntaxKind.IDENTIFIER;
        }

        if (isDecimalDigit(c)) {
            do {
                skip();
            } while (!eof() && (isDecimalDigit(peek()) || peek() == '_'));
            return SyntaxKind.INTEGER_LITERAL;
        }

        skip();
        switch (c) {
            case '"':
                return stringLiteral();
            case '(':
                return SyntaxKind.L_PAREN;
            case ')':
                return SyntaxKind.R_PAREN;
            case '+':
                return SyntaxKind.PLUS;
            case '-':
                return SyntaxKind.MINUS;
            case '*':
                return SyntaxKind.STAR;
            case '/':
                return SyntaxKind.SLASH;
            case '=':
                return SyntaxKind.EQUAL;
            case ';':
                return SyntaxKind.SEMICOLON;
            default:
                return SyntaxKind.UNKNOWN;
        }
    }

    // Opening quote has already been consumed
    private SyntaxKind stringLiteral() {
        while (!eof()) {
            char c = peek();
            if (c == '"') {
                skip();
                return SyntaxKind.STRING_LITERAL;
            } else if (isNewlineChar(c)) {
                break;
            } else if (c == '\\') {
                skip();
                if (!eof() && !isNewlineChar(peek())) {
                    skip();
                }
            } else {
                skip();
            }
        }
        return SyntaxKind.UNKNOWN;
    }

    private Trivia trivia(boolean trailing) {
        Trivia.Builder builder = new Trivia.Builder();
        if (!trailing && position() == 0 && peek() == '#' && peek(1) == '!') {
            builder.addText(TriviaKind.GARBAGE_TEXT, restOfLine());
        }

        while (!eof()) {
            char c = peek();
            switch (c) {
                case ' ':
                    builder.addCounted(TriviaKind.SPACE);
                    skip();
                    break;
                case '\t':
                    builder.addCounted(TriviaKind.TAB);
                    skip();
                    break;
                case '\u000B':
                    builder.addCounted(TriviaKind.VERTICAL_TAB);
                    skip();
                    break;
                case '\f':
                    builder.addCounted(TriviaKind.FORMFEED);
                    skip();
                    break;
                case '\n':
                    if (trailing) {
                        return builder.build();
                    }
                    builder.addCounted(TriviaKind.NEWLINE);
                    skip();
                    break;
                case '\r':
                    if (trailing) {
                        return builder.build();
                    }
                    skip();
                    if (!eof() && peek() == '\n') {
                        skip();
                        builder.addCounted(TriviaKind.CARRIAGE_RETURN_LINE_FEED);
                    } else {
                        builder.addCounted(TriviaKind.CARRIAGE_RETURN);
                    }
                    break;
                case '/':
                    if (peek(1) == '/') {
                        TriviaKind kind = peek(2) == '/' ? TriviaKind.DOC_LINE_COMMENT : TriviaKind.LINE_COMMENT;
                        builder.addText(kind, restOfLine());
                    } else if (peek(1) == '*') {
                        blockComment(builder);
                    } else {
                        return builder.build();
                    }
                    break;
                default:
                    return builder.build();
            }
        }
        return builder.build();
    }

    private void blockComment(Trivia.Builder builder) {
        int start = position();
        boolean doc = peek(2) == '*' && peek(3) != '/';
        skip(); // '/'
        skip(); // '*'
        while (!eof()) {
            if (peek() == '*' && peek(1) == '/') {
                skip();
                skip();
                break;
            }
            skip();
        }
        builder.addText(doc ? TriviaKind.DOC_BLOCK_COMMENT : TriviaKind.BLOCK_COMMENT, text.substring(start, position()));
    }

    private String restOfLine() {
        int start = position();
        while (!eof() && !isNewlineChar(peek())) {
            skip();
        }
        return text.substring(start, position());
    }

    private static boolean isNewlineChar(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isDecimalDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDecimalDigit(c);
    }
}
