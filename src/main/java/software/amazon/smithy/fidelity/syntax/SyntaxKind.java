/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * Every kind a {@link RawSyntax} can have. Token kinds come first, followed
 * by the layout kinds produced by the grammar.
 */
public enum SyntaxKind {
    // Tokens
    KW_LET("kw_let", Category.TOKEN, "let"),
    IDENTIFIER("identifier", Category.TOKEN, null),
    INTEGER_LITERAL("integer_literal", Category.TOKEN, null),
    STRING_LITERAL("string_literal", Category.TOKEN, null),
    L_PAREN("l_paren", Category.TOKEN, "("),
    R_PAREN("r_paren", Category.TOKEN, ")"),
    PLUS("plus", Category.TOKEN, "+"),
    MINUS("minus", Category.TOKEN, "-"),
    STAR("star", Category.TOKEN, "*"),
    SLASH("slash", Category.TOKEN, "/"),
    EQUAL("equal", Category.TOKEN, "="),
    SEMICOLON("semicolon", Category.TOKEN, ";"),
    UNKNOWN("unknown", Category.TOKEN, null),
    EOF("eof", Category.TOKEN, ""),

    // Layouts
    SOURCE_FILE("SourceFile", Category.LAYOUT, 2),
    CODE_BLOCK_ITEM_LIST("CodeBlockItemList", Category.TRIVIAL_LAYOUT, -1),
    LET_DECL("LetDecl", Category.LAYOUT, 5),
    EXPR_STMT("ExprStmt", Category.LAYOUT, 2),
    UNKNOWN_STMT("UnknownStmt", Category.LAYOUT, 1),
    BINARY_EXPR("BinaryExpr", Category.LAYOUT, 3),
    PREFIX_EXPR("PrefixExpr", Category.LAYOUT, 2),
    PAREN_EXPR("ParenExpr", Category.LAYOUT, 3),
    IDENTIFIER_EXPR("IdentifierExpr", Category.LAYOUT, 1),
    INTEGER_LITERAL_EXPR("IntegerLiteralExpr", Category.LAYOUT, 1),
    STRING_LITERAL_EXPR("StringLiteralExpr", Category.LAYOUT, 1);

    private static final Map<String, SyntaxKind> BY_NAME = new HashMap<>();

    static {
        for (SyntaxKind kind : values()) {
            BY_NAME.put(kind.serializedName, kind);
        }
    }

    private enum Category {
        TOKEN,
        LAYOUT,
        TRIVIAL_LAYOUT
    }

    private final String serializedName;
    private final Category category;
    private final String spelling;
    private final int childCount;

    SyntaxKind(String serializedName, Category category, String spelling) {
        this.serializedName = serializedName;
        this.category = category;
        this.spelling = spelling;
        this.childCount = 0;
    }

    SyntaxKind(String serializedName, Category category, int childCount) {
        this.serializedName = serializedName;
        this.category = category;
        this.spelling = null;
        this.childCount = childCount;
    }

    /**
     * @return The name used for this kind in interchange documents and kind tags
     */
    public String serializedName() {
        return serializedName;
    }

    public boolean isToken() {
        return category == Category.TOKEN;
    }

    public boolean isLayout() {
        return category != Category.TOKEN;
    }

    /**
     * @return Whether this kind is only shown by printers that ask for
     *  trivial kinds, like list kinds
     */
    public boolean isTrivial() {
        return category == Category.TRIVIAL_LAYOUT;
    }

    /**
     * @return The only text a token of this kind can have, or {@code null}
     *  if it varies
     */
    public String spelling() {
        return spelling;
    }

    /**
     * @return The number of children, present or missing, a layout of this
     *  kind has, -1 for lists, or 0 for tokens
     */
    public int childCount() {
        return childCount;
    }

    public boolean hasFixedChildCount() {
        return childCount >= 0;
    }

    /**
     * @param text An identifier
     * @return The keyword kind spelled {@code text}, or {@link #IDENTIFIER}
     */
    public static SyntaxKind keywordOrIdentifier(String text) {
        return KW_LET.spelling.equals(text) ? KW_LET : IDENTIFIER;
    }

    /**
     * @param name The serialized name of a kind
     * @return The matching kind, or {@code null} if there isn't one
     */
    public static SyntaxKind fromSerializedName(String name) {
        return BY_NAME.get(name);
    }
}
