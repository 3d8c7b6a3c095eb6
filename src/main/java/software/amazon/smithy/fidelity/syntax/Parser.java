/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.MalformedEditException;
import software.amazon.smithy.fidelity.incremental.ParsingCache;

/**
 * Recursive descent parser producing a {@link RawSyntax} tree. See
 * {@link Syntax} for the grammar.
 *
 * <p>The parser never fails. A construct that is cut short gets
 * {@code null} children where its missing parts would be, and a token that
 * can't start a statement is wrapped in its own
 * {@link SyntaxKind#UNKNOWN_STMT}.
 *
 * <p>When given a {@link ParsingCache}, the parser asks it for a reusable
 * old statement at each statement boundary, and skips over the statement's
 * text if it gets one.
 */
final class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());
    private static final Set<SyntaxKind> STATEMENT_KINDS = EnumSet.of(
            SyntaxKind.LET_DECL,
            SyntaxKind.EXPR_STMT,
            SyntaxKind.UNKNOWN_STMT);

    final List<RawSyntax> reusedNodes = new ArrayList<>();
    private final SourceBuffer source;
    private final Lexer lexer;
    private final ParsingCache cache;
    private RawSyntax.Token current;
    private int currentStart;

    Parser(SourceBuffer source, ParsingCache cache) {
        this.source = source;
        this.lexer = new Lexer(source);
        this.cache = usableCache(cache);
        advance();
    }

    private static ParsingCache usableCache(ParsingCache cache) {
        if (cache == null) {
            return null;
        }
        try {
            cache.checkEdits();
            return cache;
        } catch (MalformedEditException e) {
            LOGGER.warning("Ignoring parsing cache, falling back to a full parse: " + e.getMessage());
            return null;
        }
    }

    RawSyntax.Layout parseSourceFile() {
        List<RawSyntax> statements = new ArrayList<>();
        while (current.kind() != SyntaxKind.EOF) {
            RawSyntax reused = reuseStatement();
            statements.add(reused != null ? reused : statement());
        }
        RawSyntax.Layout items = new RawSyntax.Layout(SyntaxKind.CODE_BLOCK_ITEM_LIST, statements);
        return RawSyntax.Layout.of(SyntaxKind.SOURCE_FILE, items, current);
    }

    private RawSyntax reuseStatement() {
        if (cache == null) {
            return null;
        }

        RawSyntax node = cache.lookUp(currentStart, STATEMENT_KINDS);
        if (node == null) {
            return null;
        }

        int end = currentStart + node.width();
        String text = source.copySpan(currentStart, end);
        if (text == null || !text.equals(node.print())) {
            // The edits given to the cache don't describe this source
            LOGGER.fine(() -> "Not reusing " + node + " at " + currentStart + ", text differs");
            return null;
        }

        reusedNodes.add(node);
        lexer.resetTo(end);
        advance();
        return node;
    }

    private RawSyntax statement() {
        if (current.kind() == SyntaxKind.KW_LET) {
            return letDecl();
        } else if (startsExpression()) {
            return RawSyntax.Layout.of(SyntaxKind.EXPR_STMT, expr(), consumeIf(SyntaxKind.SEMICOLON));
        } else {
            return RawSyntax.Layout.of(SyntaxKind.UNKNOWN_STMT, consume());
        }
    }

    private RawSyntax letDecl() {
        RawSyntax.Token let = consume();
        RawSyntax.Token name = consumeIf(SyntaxKind.IDENTIFIER);
        RawSyntax.Token equal = consumeIf(SyntaxKind.EQUAL);
        RawSyntax value = startsExpression() ? expr() : null;
        RawSyntax.Token semicolon = consumeIf(SyntaxKind.SEMICOLON);
        return RawSyntax.Layout.of(SyntaxKind.LET_DECL, let, name, equal, value, semicolon);
    }

    private RawSyntax expr() {
        RawSyntax left = term();
        while (current.kind() == SyntaxKind.PLUS || current.kind() == SyntaxKind.MINUS) {
            RawSyntax.Token operator = consume();
            RawSyntax right = startsExpression() ? term() : null;
            left = RawSyntax.Layout.of(SyntaxKind.BINARY_EXPR, left, operator, right);
        }
        return left;
    }

    private RawSyntax term() {
        RawSyntax left = prefix();
        while (current.kind() == SyntaxKind.STAR || current.kind() == SyntaxKind.SLASH) {
            RawSyntax.Token operator = consume();
            RawSyntax right = startsExpression() ? prefix() : null;
            left = RawSyntax.Layout.of(SyntaxKind.BINARY_EXPR, left, operator, right);
        }
        return left;
    }

    private RawSyntax prefix() {
        if (current.kind() == SyntaxKind.MINUS) {
            RawSyntax.Token operator = consume();
            RawSyntax operand = startsExpression() ? prefix() : null;
            return RawSyntax.Layout.of(SyntaxKind.PREFIX_EXPR, operator, operand);
        }
        return primary();
    }

    private RawSyntax primary() {
        switch (current.kind()) {
            case IDENTIFIER:
                return RawSyntax.Layout.of(SyntaxKind.IDENTIFIER_EXPR, consume());
            case INTEGER_LITERAL:
                return RawSyntax.Layout.of(SyntaxKind.INTEGER_LITERAL_EXPR, consume());
            case STRING_LITERAL:
                return RawSyntax.Layout.of(SyntaxKind.STRING_LITERAL_EXPR, consume());
            case L_PAREN:
                RawSyntax.Token open = consume();
                RawSyntax inner = startsExpression() ? expr() : null;
                RawSyntax.Token close = consumeIf(SyntaxKind.R_PAREN);
                return RawSyntax.Layout.of(SyntaxKind.PAREN_EXPR, open, inner, close);
            default:
                throw new IllegalStateException("Expression can't start with " + current.kind());
        }
    }

    private boolean startsExpression() {
        switch (current.kind()) {
            case IDENTIFIER:
            case INTEGER_LITERAL:
            case STRING_LITERAL:
            case L_PAREN:
            case MINUS:
                return true;
            default:
                return false;
        }
    }

    private RawSyntax.Token consume() {
        RawSyntax.Token token = current;
        advance();
        return token;
    }

    private RawSyntax.Token consumeIf(SyntaxKind kind) {
        return current.kind() == kind ? consume() : null;
    }

    private void advance() {
        currentStart = lexer.position();
        current = lexer.lexToken();
    }
}
