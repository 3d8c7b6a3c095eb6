/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.cli.ColorFormatter;
import software.amazon.smithy.cli.Style;

/**
 * Prints a {@link RawSyntax} according to some {@link PrintOptions}.
 *
 * <p>Only layouts get kind tags. Tokens always print as their trivia and
 * text, so removing the tags from the output gives back the source.
 */
public final class SyntaxPrinter {
    private final PrintOptions options;
    private final ColorFormatter colors;

    private SyntaxPrinter(PrintOptions options, ColorFormatter colors) {
        this.options = options;
        this.colors = colors;
    }

    /**
     * @param options Options to print with
     * @return A printer for {@code options}, which colors kind tags when the
     *  options are visual
     */
    public static SyntaxPrinter create(PrintOptions options) {
        return new SyntaxPrinter(options, options.visual() ? AnsiColorFormatter.FORCE_COLOR : AnsiColorFormatter.NO_COLOR);
    }

    /**
     * @param node Node to print
     * @return The printed node
     */
    public String print(RawSyntax node) {
        if (options.isVerbatim()) {
            return node.print();
        }
        StringBuilder builder = new StringBuilder(node.width());
        print(node, builder);
        return builder.toString();
    }

    private void print(RawSyntax node, StringBuilder out) {
        if (node instanceof RawSyntax.Layout layout) {
            boolean tagged = options.showKindTags() && (options.showTrivialKinds() || !layout.kind().isTrivial());
            if (tagged) {
                out.append(tag("<" + layout.kind().serializedName() + ">"));
            }
            for (RawSyntax child : layout.children()) {
                if (child != null) {
                    print(child, out);
                }
            }
            if (tagged) {
                out.append(tag("</" + layout.kind().serializedName() + ">"));
            }
        } else {
            node.print(out);
        }
    }

    private String tag(String text) {
        if (!colors.isColorEnabled()) {
            return text;
        }
        return colors.style(text, Style.GREEN);
    }
}
