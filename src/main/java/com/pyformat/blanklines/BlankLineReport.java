package com.pyformat.blanklines;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.pyformat.model.BranchNode;
import com.pyformat.model.LeafNode;
import com.pyformat.model.SyntaxNode;

/**
 * Flat, source-ordered list of every blank-line annotation in a tree.
 */
public class BlankLineReport {

    private final List<BlankLineDecision> decisions;

    private BlankLineReport(List<BlankLineDecision> decisions) {
        this.decisions = List.copyOf(decisions);
    }

    public static BlankLineReport of(SyntaxNode tree) {
        List<BlankLineDecision> decisions = new ArrayList<>();
        collect(tree, decisions);
        return new BlankLineReport(decisions);
    }

    private static void collect(SyntaxNode node, List<BlankLineDecision> decisions) {
        if (node.getNewlines() != null) {
            decisions.add(BlankLineDecision.builder()
                    .nodeType(node.getTypeName())
                    .value(node instanceof LeafNode leaf ? leaf.getValue() : "")
                    .line(node.getLine())
                    .column(node.getColumn())
                    .newlines(node.getNewlines())
                    .build());
        }
        if (node instanceof BranchNode branch) {
            for (SyntaxNode child : branch.getChildren()) {
                collect(child, decisions);
            }
        }
    }

    public List<BlankLineDecision> getDecisions() {
        return decisions;
    }

    public Optional<BlankLineDecision> atLine(int line) {
        return decisions.stream().filter(d -> d.getLine() == line).findFirst();
    }

    public int size() {
        return decisions.size();
    }
}
