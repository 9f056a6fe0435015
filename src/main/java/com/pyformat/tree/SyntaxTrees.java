package com.pyformat.tree;

import java.util.EnumSet;
import java.util.Set;

import com.pyformat.model.BranchNode;
import com.pyformat.model.LeafNode;
import com.pyformat.model.NodeKind;
import com.pyformat.model.SyntaxNode;
import com.pyformat.model.TokenType;

/**
 * Classification and ancestor queries over syntax trees.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
        // Utility class
    }

    public static LeafNode firstLeaf(SyntaxNode node) {
        if (node instanceof LeafNode leaf) {
            return leaf;
        }
        LeafNode leaf = ((BranchNode) node).firstLeaf();
        if (leaf == null) {
            throw new MalformedTreeException("Branch has no leaves", node);
        }
        return leaf;
    }

    /**
     * Last source line covered by a node. A comment token may span several lines
     * when consecutive comment lines were merged into one block.
     */
    public static int lastLine(SyntaxNode node) {
        if (node instanceof LeafNode leaf) {
            return leaf.getLine() + (int) leaf.getValue().chars().filter(c -> c == '\n').count();
        }
        return node.getLine();
    }

    public static boolean isKind(SyntaxNode node, NodeKind kind) {
        return node instanceof BranchNode branch && branch.is(kind);
    }

    public static boolean isToken(SyntaxNode node, TokenType token) {
        return node instanceof LeafNode leaf && leaf.getToken() == token;
    }

    /**
     * A standalone comment is wrapped in a simple_stmt whose first child is the
     * comment token.
     */
    public static boolean isCommentStatement(SyntaxNode node) {
        return node instanceof BranchNode branch
                && branch.is(NodeKind.SIMPLE_STMT)
                && branch.childCount() > 0
                && isToken(branch.getChild(0), TokenType.COMMENT);
    }

    public static boolean isFuncDef(SyntaxNode node) {
        return isKind(node, NodeKind.FUNCDEF);
    }

    /**
     * A function is async when the {@code async} keyword is its previous sibling.
     */
    public static boolean isAsyncFunction(SyntaxNode node) {
        return isToken(node.getPrevSibling(), TokenType.ASYNC);
    }

    /**
     * @return the unit grouping the {@code async} keyword and the function it marks
     */
    public static BranchNode asyncUnit(SyntaxNode funcdef) {
        SyntaxNode marker = funcdef.getPrevSibling();
        if (!isToken(marker, TokenType.ASYNC)) {
            throw new MalformedTreeException("Function is not preceded by an async marker", funcdef);
        }
        return marker.getParent();
    }

    /**
     * An {@code async} keyword grouped with the function definition it marks.
     */
    public static boolean isAsyncUnit(SyntaxNode node) {
        if (!(node instanceof BranchNode branch) || branch.childCount() < 2) {
            return false;
        }
        if (!branch.is(NodeKind.ASYNC_STMT) && !branch.is(NodeKind.ASYNC_FUNCDEF)) {
            return false;
        }
        return isToken(branch.getChild(0), TokenType.ASYNC) && isFuncDef(branch.getChild(branch.childCount() - 1));
    }

    public static boolean startsInZerothColumn(SyntaxNode node) {
        return firstLeaf(node).getColumn() == 0
                || (isAsyncFunction(node) && node.getPrevSibling().getColumn() == 0);
    }

    /**
     * Nearest class or function definition containing the node, the node itself
     * included. An async unit stands for the function it wraps.
     */
    public static BranchNode enclosingBlock(SyntaxNode node) {
        if (isAsyncUnit(node)) {
            return (BranchNode) lastChild((BranchNode) node);
        }
        SyntaxNode current = node;
        while (current != null) {
            if (current instanceof BranchNode branch && branch.getKind().isDefinition()) {
                return branch;
            }
            current = current.getParent();
        }
        return null;
    }

    /**
     * Nearest class definition containing the node, the node itself included.
     */
    public static BranchNode enclosingClass(SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null) {
            if (isKind(current, NodeKind.CLASSDEF)) {
                return (BranchNode) current;
            }
            current = current.getParent();
        }
        return null;
    }

    /**
     * True only when both nodes sit directly in methods (their nearest block is a
     * function) and those methods belong to the very same class node.
     */
    public static boolean methodsInSameClass(SyntaxNode previous, SyntaxNode current) {
        BranchNode previousFunc = enclosingBlock(previous);
        BranchNode currentFunc = enclosingBlock(current);
        if (!isFuncDef(previousFunc) || !isFuncDef(currentFunc)) {
            return false;
        }
        BranchNode previousClass = enclosingClass(previousFunc.getParent());
        BranchNode currentClass = enclosingClass(currentFunc.getParent());
        return previousClass != null && previousClass == currentClass;
    }

    /**
     * Resolves the definition a decorator applies to.
     *
     * @return the target when its kind is one of {@code kinds}, otherwise {@code null}
     * @throws MalformedTreeException when the decorator is not part of a decorated construct
     */
    public static BranchNode decoratedTarget(SyntaxNode decorator, Set<NodeKind> kinds) {
        SyntaxNode current = decorator.getParent();
        while (current != null && !isKind(current, NodeKind.DECORATED)) {
            current = current.getParent();
        }
        if (current == null) {
            throw new MalformedTreeException("Decorator has no decorated target", decorator);
        }
        SyntaxNode target = lastChild((BranchNode) current);
        if (isKind(target, NodeKind.ASYNC_FUNCDEF) || isKind(target, NodeKind.ASYNC_STMT)) {
            target = lastChild((BranchNode) target);
        }
        if (target instanceof BranchNode branch && kinds.contains(branch.getKind())) {
            return branch;
        }
        return null;
    }

    public static BranchNode decoratedFunction(SyntaxNode decorator) {
        return decoratedTarget(decorator, EnumSet.of(NodeKind.FUNCDEF));
    }

    private static SyntaxNode lastChild(BranchNode node) {
        if (node.childCount() == 0) {
            throw new MalformedTreeException("Construct has no children", node);
        }
        return node.getChild(node.childCount() - 1);
    }
}
