/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * The kinds of {@link TriviaPiece}. A kind either repeats a fixed spelling
 * some number of times, or carries literal text.
 */
public enum TriviaKind {
    SPACE("Space", " "),
    TAB("Tab", "\t"),
    VERTICAL_TAB("VerticalTab", "\u000B"),
    FORMFEED("Formfeed", "\f"),
    NEWLINE("Newline", "\n"),
    CARRIAGE_RETURN("CarriageReturn", "\r"),
    CARRIAGE_RETURN_LINE_FEED("CarriageReturnLineFeed", "\r\n"),
    LINE_COMMENT("LineComment", null),
    BLOCK_COMMENT("BlockComment", null),
    DOC_LINE_COMMENT("DocLineComment", null),
    DOC_BLOCK_COMMENT("DocBlockComment", null),
    GARBAGE_TEXT("GarbageText", null);

    private final String serializedName;
    private final String spelling;

    TriviaKind(String serializedName, String spelling) {
        this.serializedName = serializedName;
        this.spelling = spelling;
    }

    /**
     * @return The name used for this kind in interchange documents
     */
    public String serializedName() {
        return serializedName;
    }

    /**
     * @return The text a single repetition of this kind prints as, or
     *  {@code null} if pieces of this kind carry their own text
     */
    public String spelling() {
        return spelling;
    }

    /**
     * @return Whether pieces of this kind are a repeat count of {@link #spelling()}
     */
    public boolean isCounted() {
        return spelling != null;
    }

    /**
     * @param name The serialized name of a kind
     * @return The matching kind, or {@code null} if there isn't one
     */
    public static TriviaKind fromSerializedName(String name) {
        for (TriviaKind kind : values()) {
            if (kind.serializedName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
