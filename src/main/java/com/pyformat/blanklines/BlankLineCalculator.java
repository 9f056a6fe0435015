package com.pyformat.blanklines;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pyformat.model.BranchNode;
import com.pyformat.model.LeafNode;
import com.pyformat.model.SyntaxNode;
import com.pyformat.model.TokenType;
import com.pyformat.style.StyleConfig;
import com.pyformat.tree.MalformedTreeException;
import com.pyformat.tree.SyntaxTrees;

/**
 * Calculates the number of blank lines between classes, functions, comments,
 * decorators and the statements that follow them.
 *
 * One pre-order walk over the tree; every decision is written to the
 * {@code newlines} annotation of the node that starts the logical unit
 * (definition keyword, decorator '@', comment token or first token of a
 * statement). Nodes without an annotation keep their original spacing.
 *
 * The calculator keeps no per-walk fields: each call to {@link #calculate}
 * threads its own {@link TraversalState}, so one instance may serve many trees.
 */
public class BlankLineCalculator {
    private static final Logger log = LoggerFactory.getLogger(BlankLineCalculator.class);

    private final BlankLineRules rules;

    public BlankLineCalculator(StyleConfig style) {
        this(new BlankLineRules(style));
    }

    public BlankLineCalculator(BlankLineRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Blank line rules are required");
        }
        this.rules = rules;
    }

    /**
     * Annotates the tree in place.
     *
     * @return the same tree, for chaining
     * @throws MalformedTreeException when the tree breaks parser guarantees
     */
    public SyntaxNode calculate(SyntaxNode tree) {
        if (tree == null) {
            throw new MalformedTreeException("Cannot calculate blank lines for a null tree");
        }
        TraversalState state = new TraversalState();
        visit(tree, state);
        log.debug("Blank line calculation finished for {}", tree.getTypeName());
        return tree;
    }

    private void visit(SyntaxNode node, TraversalState state) {
        if (node.isLeaf()) {
            return;
        }
        BranchNode branch = (BranchNode) node;
        switch (branch.getKind()) {
            case SIMPLE_STMT -> visitSimpleStatement(branch, state);
            case DECORATOR -> visitDecorator(branch, state);
            case CLASSDEF -> visitClassDef(branch, state);
            case FUNCDEF -> visitFuncDef(branch, state);
            default -> visitDefault(branch, state);
        }
    }

    private void visitSimpleStatement(BranchNode node, TraversalState state) {
        visitDefault(node, state);
        SyntaxNode first = node.getChild(0);
        if (SyntaxTrees.isToken(first, TokenType.COMMENT)) {
            state.setLastCommentLine(SyntaxTrees.lastLine(first));
        } else {
            // comment lines must not become the previous statement for adjacency checks
            state.setPreviousStatement(node);
        }
    }

    private void visitDecorator(BranchNode node, TraversalState state) {
        BranchNode func = SyntaxTrees.decoratedFunction(node);
        SyntaxNode at = node.getChild(0);

        int newlines;
        if (state.getLastCommentLine() != 0 && state.getLastCommentLine() == at.getLine() - 1) {
            newlines = BlankLineRules.NO_BLANK_LINES;
        } else if (state.isLastWasDecorator()) {
            newlines = BlankLineRules.NO_BLANK_LINES;
        } else if (func != null && state.getPreviousStatement() != null
                && SyntaxTrees.methodsInSameClass(state.getPreviousStatement(), func)) {
            newlines = rules.sameClassNewlines();
        } else {
            newlines = rules.requiredNewlines(state, node);
        }
        stamp(at, newlines);

        visitChildren(node, 0, state);
        state.setLastWasDecorator(true);
    }

    private void visitClassDef(BranchNode node, TraversalState state) {
        state.setLastWasClassOrFunction(false);
        int index = placeLeadingComments(node, state);
        state.setLastWasDecorator(false);

        state.enterClass();
        visitChildren(node, index, state);
        state.leaveClass();

        state.setLastWasClassOrFunction(true);
        state.setPreviousStatement(node);
    }

    private void visitFuncDef(BranchNode node, TraversalState state) {
        state.setLastWasClassOrFunction(false);
        int index;
        if (SyntaxTrees.isAsyncFunction(node)) {
            // 'async def' is placed as one unit; the def keyword carries no decision
            placeLeadingComments(SyntaxTrees.asyncUnit(node), state);
            node.getChild(0).setNewlines(null);
            index = 0;
        } else {
            index = placeLeadingComments(node, state);
        }
        state.setLastWasDecorator(false);

        state.enterFunction();
        visitChildren(node, index, state);
        state.leaveFunction();

        state.setLastWasClassOrFunction(true);
        state.setPreviousStatement(node);
    }

    private void visitDefault(BranchNode node, TraversalState state) {
        if (state.isLastWasClassOrFunction() && node.getKind().isStatement()) {
            LeafNode leaf = SyntaxTrees.firstLeaf(node);
            stamp(leaf, rules.requiredNewlines(state, leaf));
        }
        state.setLastWasClassOrFunction(false);
        visitChildren(node, 0, state);
    }

    /**
     * Places the comments attached as leading children of a class or function
     * definition, then the definition keyword itself.
     *
     * @return index of the first child past the leading comments
     */
    private int placeLeadingComments(BranchNode node, TraversalState state) {
        int index = 0;
        while (index < node.childCount() && SyntaxTrees.isCommentStatement(node.getChild(index))) {
            SyntaxNode comment = ((BranchNode) node.getChild(index)).getChild(0);
            visit(comment, state);
            if (!state.isLastWasDecorator()) {
                stamp(comment, BlankLineRules.ONE_BLANK_LINE);
            }
            index++;
        }
        if (index == node.childCount()) {
            throw new MalformedTreeException("Definition consists only of comments", node);
        }

        SyntaxNode keyword = node.getChild(index);
        int newlines;
        if (index > 0 && keyword.getLine() - 1 == lastLineOfComment(node.getChild(index - 1))) {
            newlines = BlankLineRules.NO_BLANK_LINES;
        } else if (state.getLastCommentLine() + 1 == keyword.getLine()) {
            newlines = BlankLineRules.NO_BLANK_LINES;
        } else {
            newlines = rules.requiredNewlines(state, node);
        }
        stamp(keyword, newlines);
        return index;
    }

    private void visitChildren(BranchNode node, int from, TraversalState state) {
        for (int i = from; i < node.childCount(); i++) {
            visit(node.getChild(i), state);
        }
    }

    private static int lastLineOfComment(SyntaxNode commentStatement) {
        return SyntaxTrees.lastLine(((BranchNode) commentStatement).getChild(0));
    }

    private static void stamp(SyntaxNode node, int newlines) {
        node.setNewlines(newlines);
        if (log.isDebugEnabled()) {
            log.debug("newlines={} before {} at line {}:{}", newlines, node.getTypeName(),
                    node.getLine(), node.getColumn());
        }
    }
}
