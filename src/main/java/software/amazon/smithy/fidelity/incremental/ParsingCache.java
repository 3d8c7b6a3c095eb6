/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.fidelity.incremental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import software.amazon.smithy.fidelity.syntax.RawSyntax;
import software.amazon.smithy.fidelity.syntax.SyntaxKind;

/**
 * An old syntax tree and the edits that turn its source into a new source,
 * used to find the parts of the old tree that can be reused when parsing
 * the new source.
 *
 * <p>Edits are given in old source coordinates, in increasing order of
 * offset, and must not overlap. The cache is owned by a single parse and is
 * not thread safe.
 *
 * <p>Two queries are available:
 * <ul>
 *     <li>{@link #computeReuseRanges()} walks the old tree and reports every
 *     span of the new source covered by an old node no edit touched, using
 *     the coarsest node possible.</li>
 *     <li>{@link #lookUp(int, Set)} is used by parsers while parsing the new
 *     source. It is stricter, and also refuses nodes that are directly
 *     adjacent to an edit or followed by an edited token, since those can
 *     lex differently in the new source.</li>
 * </ul>
 */
public final class ParsingCache {
    private static final Logger LOGGER = Logger.getLogger(ParsingCache.class.getName());

    private final RawSyntax oldTree;
    private final List<SourceEdit> edits = new ArrayList<>();
    // Whether checkEdits has passed since the last edit was added
    private boolean editsChecked = true;

    /**
     * @param oldTree The tree of the old source
     */
    public ParsingCache(RawSyntax oldTree) {
        this.oldTree = Objects.requireNonNull(oldTree);
    }

    public RawSyntax oldTree() {
        return oldTree;
    }

    /**
     * @return The edits added so far, in the order they were added
     */
    public List<SourceEdit> edits() {
        return Collections.unmodifiableList(edits);
    }

    /**
     * @param start Start offset of the edit in the old source
     * @param end End offset of the edit in the old source, exclusive
     * @param replacementLength Length of the replacement text
     * @throws MalformedEditException If the edit is out of bounds of the old source
     */
    public void addEdit(int start, int end, int replacementLength) {
        if (start < 0 || end < start || end > oldTree.width() || replacementLength < 0) {
            throw new MalformedEditException(String.format(
                    "Edit [%d, %d) with replacement length %d doesn't fit a source of length %d",
                    start, end, replacementLength, oldTree.width()));
        }
        edits.add(new SourceEdit(start, end, replacementLength));
        editsChecked = false;
    }

    /**
     * @param edit The edit to add
     * @throws MalformedEditException If the edit is out of bounds of the old source
     */
    public void addEdit(SourceEdit edit) {
        addEdit(edit.start(), edit.end(), edit.replacementLength());
    }

    /**
     * @throws MalformedEditException If the edits are out of order or overlap
     */
    public void checkEdits() {
        if (editsChecked) {
            return;
        }
        for (int i = 1; i < edits.size(); i++) {
            SourceEdit previous = edits.get(i - 1);
            SourceEdit current = edits.get(i);
            if (current.start() < previous.end()) {
                throw new MalformedEditException(String.format(
                        "Edit [%d, %d) overlaps or comes before the previous edit [%d, %d)",
                        current.start(), current.end(), previous.start(), previous.end()));
            }
        }
        editsChecked = true;
    }

    /**
     * @return The coarsest old nodes untouched by any edit, in order
     * @throws MalformedEditException If the edits are out of order or overlap
     */
    public List<ReusedNode> reusableNodes() {
        checkEdits();
        List<ReusedNode> reusable = new ArrayList<>();
        collectReusable(oldTree, 0, reusable);
        return reusable;
    }

    /**
     * @return Sorted, non-overlapping, non-empty spans of the new source
     *  covered by untouched old nodes. Neighboring spans are merged when they
     *  are also neighbors in the old source.
     * @throws MalformedEditException If the edits are out of order or overlap
     */
    public List<ReuseRange> computeReuseRanges() {
        List<ReuseRange> ranges = new ArrayList<>();
        ReusedNode previous = null;
        int start = -1;
        for (ReusedNode reused : reusableNodes()) {
            if (previous != null
                    && previous.newEnd() == reused.newStart()
                    && previous.oldEnd() == reused.oldStart()) {
                previous = reused;
                continue;
            }
            if (previous != null) {
                ranges.add(new ReuseRange(start, previous.newEnd()));
            }
            start = reused.newStart();
            previous = reused;
        }
        if (previous != null) {
            ranges.add(new ReuseRange(start, previous.newEnd()));
        }
        LOGGER.fine(() -> "Computed " + ranges.size() + " reuse ranges for " + edits.size() + " edits");
        return ranges;
    }

    /**
     * Finds an old node that can be used verbatim at {@code newOffset} of
     * the new source.
     *
     * @param newOffset Offset in the new source the node would start at
     * @param kinds The kinds of node that are acceptable
     * @return The outermost old node of one of {@code kinds} that starts at
     *  the old offset corresponding to {@code newOffset} and is safe to reuse,
     *  or {@code null} if there isn't one
     * @throws MalformedEditException If the edits are out of order or overlap
     */
    public RawSyntax lookUp(int newOffset, Set<SyntaxKind> kinds) {
        checkEdits();
        int oldOffset = toOldOffset(newOffset);
        if (oldOffset < 0) {
            return null;
        }

        RawSyntax candidate = findStartingAt(oldTree, 0, oldOffset, kinds);
        if (candidate == null) {
            return null;
        }

        int oldEnd = oldOffset + candidate.width();
        int nextTokenWidth = tokenWidthAt(oldTree, 0, oldEnd);
        for (SourceEdit edit : edits) {
            if (edit.intersectsOrTouches(oldOffset, oldEnd + nextTokenWidth)) {
                return null;
            }
        }
        return candidate;
    }

    /**
     * @param newOffset An offset in the new source
     * @return The matching offset in the old source, or {@code -1} if
     *  {@code newOffset} is within replacement text
     */
    int toOldOffset(int newOffset) {
        int delta = 0;
        for (SourceEdit edit : edits) {
            int newStart = edit.start() + delta;
            int newEnd = newStart + edit.replacementLength();
            if (newOffset < newStart) {
                break;
            }
            if (newOffset < newEnd) {
                return -1;
            }
            delta += edit.delta();
        }
        return newOffset - delta;
    }

    private void collectReusable(RawSyntax node, int start, List<ReusedNode> reusable) {
        int width = node.width();
        if (width == 0) {
            return;
        }

        int end = start + width;
        if (!isTouched(start, end)) {
            reusable.add(new ReusedNode(node, start, start + deltaBefore(start)));
        } else if (node instanceof RawSyntax.Layout layout) {
            int offset = start;
            for (RawSyntax child : layout.children()) {
                if (child != null) {
                    collectReusable(child, offset, reusable);
                    offset += child.width();
                }
            }
        }
    }

    private boolean isTouched(int start, int end) {
        for (SourceEdit edit : edits) {
            if (edit.touches(start, end)) {
                return true;
            }
        }
        return false;
    }

    private int deltaBefore(int oldOffset) {
        int delta = 0;
        for (SourceEdit edit : edits) {
            if (edit.end() > oldOffset) {
                break;
            }
            delta += edit.delta();
        }
        return delta;
    }

    private static RawSyntax findStartingAt(RawSyntax node, int start, int offset, Set<SyntaxKind> kinds) {
        if (!(node instanceof RawSyntax.Layout layout)) {
            return null;
        }
        int childStart = start;
        for (RawSyntax child : layout.children()) {
            if (child == null) {
                continue;
            }
            int childEnd = childStart + child.width();
            if (childStart <= offset && offset < childEnd) {
                if (childStart == offset && kinds.contains(child.kind())) {
                    return child;
                }
                return findStartingAt(child, childStart, offset, kinds);
            }
            childStart = childEnd;
        }
        return null;
    }

    // Width of the token starting exactly at offset, or 0 if none does
    private static int tokenWidthAt(RawSyntax node, int start, int offset) {
        if (node instanceof RawSyntax.Token) {
            return start == offset ? node.width() : 0;
        }
        int childStart = start;
        for (RawSyntax child : ((RawSyntax.Layout) node).children()) {
            if (child == null) {
                continue;
            }
            int childEnd = childStart + child.width();
            if (childStart <= offset && offset < childEnd) {
                return tokenWidthAt(child, childStart, offset);
            }
            childStart = childEnd;
        }
        return 0;
    }

    /**
     * An old node that no edit touched, and where it is in both sources.
     *
     * @param node The old node
     * @param oldStart Offset of the node in the old source
     * @param newStart Offset of the node in the new source
     */
    public record ReusedNode(RawSyntax node, int oldStart, int newStart) {
        public int oldEnd() {
            return oldStart + node.width();
        }

        public int newEnd() {
            return newStart + node.width();
        }
    }
}
