package com.pyformat.model;

import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Base class for all syntax tree nodes.
 *
 * The shape of the tree is fixed once built: a node receives its parent when it
 * is added to a branch and keeps it for its whole life. The only mutable part
 * is the {@code newlines} annotation, written by the blank-line calculator and
 * read by the renderer.
 */
@Getter
public abstract class SyntaxNode {

    private BranchNode parent;

    /**
     * Required newlines before this node: 1 = no blank line, 2 = one blank
     * line, 3 = two blank lines. {@code null} keeps the original spacing.
     */
    @Setter
    private Integer newlines;

    void attachTo(BranchNode newParent) {
        if (parent != null) {
            throw new IllegalStateException(
                    "Node " + getTypeName() + " at line " + getLine() + " already has a parent");
        }
        this.parent = newParent;
    }

    public abstract int getLine();

    public abstract int getColumn();

    public abstract boolean isLeaf();

    /**
     * Name of the grammar symbol or token type, as used in tree dumps.
     */
    public abstract String getTypeName();

    public SyntaxNode getPrevSibling() {
        if (parent == null) {
            return null;
        }
        List<SyntaxNode> siblings = parent.getChildren();
        int index = indexIn(siblings);
        return index > 0 ? siblings.get(index - 1) : null;
    }

    // identity lookup, siblings may be structurally equal
    private int indexIn(List<SyntaxNode> siblings) {
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        return -1;
    }
}
