/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.List;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.ParsingCache;

/**
 * Entry point for lexing and parsing the sample expression language into
 * {@link RawSyntax} trees.
 *
 * <p>The grammar is:
 * <pre>
 *     sourceFile := statement* eof
 *     statement  := letDecl | exprStmt | unknownStmt
 *     letDecl    := 'let' identifier '=' expr ';'?
 *     exprStmt   := expr ';'?
 *     expr       := term (('+' | '-') term)*
 *     term       := prefix (('*' | '/') prefix)*
 *     prefix     := '-' prefix | primary
 *     primary    := integer | string | identifier | '(' expr ')'
 * </pre>
 *
 * <p>Each production is a {@link RawSyntax.Layout} with a fixed number of
 * children, except for the statement list. Optional or missing parts are
 * {@code null} children, for example {@code let x} produces a
 * {@link SyntaxKind#LET_DECL} with a missing {@code =}, value and
 * {@code ;}. Binary expressions are left-associative, and the statement
 * list is {@link SyntaxKind#CODE_BLOCK_ITEM_LIST}, followed by the eof
 * token which holds any trailing trivia of the file.
 */
public final class Syntax {
    private static final SyntaxParser PARSER = new SyntaxParser() {
        @Override
        public List<RawSyntax.Token> tokenize(SourceBuffer source) {
            return Syntax.tokenize(source);
        }

        @Override
        public RawSyntax parse(SourceBuffer source, ParsingCache cache) {
            return Syntax.parse(source, cache).root();
        }
    };

    private Syntax() {
    }

    /**
     * @return The sample language as a {@link SyntaxParser}
     */
    public static SyntaxParser parser() {
        return PARSER;
    }

    /**
     * The result of a parse.
     *
     * @param root The {@link SyntaxKind#SOURCE_FILE} node
     * @param reusedNodes Old nodes from the parsing cache that were put
     *                    into the tree as-is, in order
     */
    public record ParseResult(RawSyntax.Layout root, List<RawSyntax> reusedNodes) {}

    /**
     * @param source The source to lex
     * @return The tokens of the source, ending with an eof token
     */
    public static List<RawSyntax.Token> tokenize(SourceBuffer source) {
        return Lexer.tokenize(source);
    }

    /**
     * @param source The source to parse
     * @return The parse result
     */
    public static ParseResult parse(SourceBuffer source) {
        return parse(source, null);
    }

    /**
     * @param source The source to parse
     * @param cache The parsing cache to reuse nodes from, or {@code null}
     * @return The parse result
     */
    public static ParseResult parse(SourceBuffer source, ParsingCache cache) {
        Parser parser = new Parser(source, cache);
        RawSyntax.Layout root = parser.parseSourceFile();
        return new ParseResult(root, List.copyOf(parser.reusedNodes));
    }
}
