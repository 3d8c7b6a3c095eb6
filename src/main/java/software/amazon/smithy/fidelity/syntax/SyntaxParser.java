/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.syntax;

import java.util.List;
import software.amazon.smithy.fidelity.document.SourceBuffer;
import software.amazon.smithy.fidelity.incremental.ParsingCache;

/**
 * A grammar that builds full-fidelity trees.
 *
 * <p>Implementations must cover every byte of the source: the tokens
 * returned by {@link #tokenize}, and the tokens of the tree returned by
 * {@link #parse}, print back to exactly the source.
 */
public interface SyntaxParser {
    /**
     * @param source The source to lex
     * @return The tokens of {@code source}, in order
     */
    List<RawSyntax.Token> tokenize(SourceBuffer source);

    /**
     * @param source The source to parse
     * @param cache An old tree and the edits since, to reuse parts of the
     *              old tree from. May be {@code null}, and implementations
     *              are free to ignore it.
     * @return The root of the tree for {@code source}
     */
    RawSyntax parse(SourceBuffer source, ParsingCache cache);
}
