package com.pyformat.tree;

import com.pyformat.model.BranchNode;
import com.pyformat.model.LeafNode;
import com.pyformat.model.SyntaxNode;

/**
 * Writes a syntax tree in the indented dump format read by
 * {@link com.pyformat.parser.SyntaxTreeReader}.
 *
 * <pre>
 * file_input
 *   funcdef
 *     NAME "def" 1:0 [newlines=3]
 * </pre>
 */
public class SyntaxTreeDumper {

    private static final String INDENT = "  ";

    private final boolean includeAnnotations;

    public SyntaxTreeDumper() {
        this(true);
    }

    public SyntaxTreeDumper(boolean includeAnnotations) {
        this.includeAnnotations = includeAnnotations;
    }

    public String dump(SyntaxNode tree) {
        StringBuilder sb = new StringBuilder();
        dump(tree, 0, sb);
        return sb.toString();
    }

    private void dump(SyntaxNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth));
        if (node instanceof LeafNode leaf) {
            sb.append(leaf.getToken().name())
                    .append(" \"").append(escape(leaf.getValue())).append("\" ")
                    .append(leaf.getLine()).append(':').append(leaf.getColumn());
        } else {
            sb.append(node.getTypeName());
        }
        if (includeAnnotations && node.getNewlines() != null) {
            sb.append(" [newlines=").append(node.getNewlines()).append(']');
        }
        sb.append('\n');

        if (node instanceof BranchNode branch) {
            for (SyntaxNode child : branch.getChildren()) {
                dump(child, depth + 1, sb);
            }
        }
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
