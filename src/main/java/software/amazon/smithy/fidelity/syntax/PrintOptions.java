/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

/**
 * Options controlling how {@link SyntaxPrinter} prints a tree. The default
 * options print the exact source text.
 */
public final class PrintOptions {
    public static final PrintOptions DEFAULT = builder().build();

    private final boolean showKindTags;
    private final boolean visual;
    private final boolean showTrivialKinds;

    private PrintOptions(Builder builder) {
        this.showKindTags = builder.showKindTags;
        this.visual = builder.visual;
        this.showTrivialKinds = builder.showTrivialKinds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return Whether nodes are wrapped in {@code <Kind>...</Kind>} tags
     */
    public boolean showKindTags() {
        return showKindTags;
    }

    /**
     * @return Whether kind tags are highlighted with color
     */
    public boolean visual() {
        return visual;
    }

    /**
     * @return Whether trivial kinds, like lists, get kind tags too
     */
    public boolean showTrivialKinds() {
        return showTrivialKinds;
    }

    /**
     * @return Whether printing with these options produces the exact source
     */
    public boolean isVerbatim() {
        return !showKindTags;
    }

    public static final class Builder {
        private boolean showKindTags = false;
        private boolean visual = false;
        private boolean showTrivialKinds = false;

        private Builder() {
        }

        public Builder showKindTags(boolean showKindTags) {
            this.showKindTags = showKindTags;
            return this;
        }

        public Builder visual(boolean visual) {
            this.visual = visual;
            return this;
        }

        public Builder showTrivialKinds(boolean showTrivialKinds) {
            this.showTrivialKinds = showTrivialKinds;
            return this;
        }

        public PrintOptions build() {
            return new PrintOptions(this);
        }
    }
}
