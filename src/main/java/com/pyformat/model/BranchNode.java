package com.pyformat.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A composite node of the syntax tree. Owns its children; a branch's position
 * is the position of its first leaf.
 */
public class BranchNode extends SyntaxNode {
    @Getter
    private final NodeKind kind;
    private final List<SyntaxNode> children = new ArrayList<>();

    public BranchNode(NodeKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Branch kind is required");
        }
        this.kind = kind;
    }

    public static BranchNode of(NodeKind kind, SyntaxNode... children) {
        BranchNode node = new BranchNode(kind);
        for (SyntaxNode child : children) {
            node.addChild(child);
        }
        return node;
    }

    public BranchNode addChild(SyntaxNode child) {
        child.attachTo(this);
        children.add(child);
        return this;
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    /**
     * @return the left-most leaf below this node, or {@code null} for an empty branch
     */
    public LeafNode firstLeaf() {
        SyntaxNode current = this;
        while (current instanceof BranchNode branch) {
            if (branch.children.isEmpty()) {
                return null;
            }
            current = branch.children.get(0);
        }
        return (LeafNode) current;
    }

    @Override
    public int getLine() {
        LeafNode leaf = firstLeaf();
        return leaf != null ? leaf.getLine() : 0;
    }

    @Override
    public int getColumn() {
        LeafNode leaf = firstLeaf();
        return leaf != null ? leaf.getColumn() : 0;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public String getTypeName() {
        return kind.getSymbol();
    }

    @Override
    public String toString() {
        return kind.getSymbol() + "[" + children.size() + " children, line " + getLine() + "]";
    }
}
