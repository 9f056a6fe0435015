package com.pyformat.blanklines;

import com.pyformat.model.SyntaxNode;
import com.pyformat.style.StyleConfig;
import com.pyformat.style.StyleOption;
import com.pyformat.tree.SyntaxTrees;

/**
 * Decides how many newlines a node needs from the traversal state alone.
 * Holds no state of its own; the style is read-only.
 */
public class BlankLineRules {

    public static final int NO_BLANK_LINES = 1;
    public static final int ONE_BLANK_LINE = 2;
    public static final int TWO_BLANK_LINES = 3;

    private final StyleConfig style;

    public BlankLineRules(StyleConfig style) {
        if (style == null) {
            throw new IllegalArgumentException("Style configuration is required");
        }
        this.style = style;
    }

    /**
     * Generic rule, in priority order:
     * 1. right after a decorator: hug it
     * 2. top-level definition starting in column 0: one blank line plus the configured
     *    top-level blank lines
     * 3. next method of the same class as the previous statement: one blank line plus
     *    the configured count, never fewer than one
     * 4. otherwise no blank line
     */
    public int requiredNewlines(TraversalState state, SyntaxNode node) {
        if (state.isLastWasDecorator()) {
            return NO_BLANK_LINES;
        }
        if (isTopLevel(state, node)) {
            return ONE_BLANK_LINE + style.get(StyleOption.BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION);
        }
        if (state.getPreviousStatement() != null
                && SyntaxTrees.methodsInSameClass(state.getPreviousStatement(), node)) {
            return sameClassNewlines();
        }
        return NO_BLANK_LINES;
    }

    /**
     * Newlines between consecutive methods of one class. The configured count is
     * added to one blank line and the result never drops below one blank line.
     */
    public int sameClassNewlines() {
        return Math.max(ONE_BLANK_LINE, ONE_BLANK_LINE + style.get(StyleOption.BLANK_LINES_BETWEEN_CLASS_DEFS));
    }

    boolean isTopLevel(TraversalState state, SyntaxNode node) {
        return !state.isNested() && SyntaxTrees.startsInZerothColumn(node);
    }

    public StyleConfig getStyle() {
        return style;
    }
}
