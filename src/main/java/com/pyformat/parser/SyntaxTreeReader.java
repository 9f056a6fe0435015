package com.pyformat.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pyformat.model.BranchNode;
import com.pyformat.model.LeafNode;
import com.pyformat.model.NodeKind;
import com.pyformat.model.SyntaxNode;
import com.pyformat.model.TokenType;

/**
 * Reads a syntax tree from its indented dump.
 *
 * Format:
 * - One node per line, two spaces of indentation per depth level
 * - Branch: grammar symbol, e.g. funcdef
 * - Leaf: TOKEN "escaped value" line:column, e.g. NAME "def" 3:0
 * - Optional trailing [newlines=N] restores an annotation
 * - Blank lines and lines starting with # are ignored
 */
public class SyntaxTreeReader {
    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeReader.class);

    private static final int INDENT_WIDTH = 2;

    private static final Pattern LEAF_PATTERN = Pattern.compile(
            "^([A-Za-z_]+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s+(\\d+):(\\d+)(?:\\s+\\[newlines=(\\d+)])?$"
    );

    private static final Pattern BRANCH_PATTERN = Pattern.compile(
            "^([a-z_]+)(?:\\s+\\[newlines=(\\d+)])?$"
    );

    public SyntaxNode read(Path dumpFile) throws IOException {
        log.debug("Reading syntax tree from {}", dumpFile);
        return read(Files.readAllLines(dumpFile));
    }

    public SyntaxNode read(String dump) {
        return read(dump.lines().toList());
    }

    public SyntaxNode read(List<String> lines) {
        Deque<BranchNode> nodeStack = new ArrayDeque<>();
        SyntaxNode root = null;
        int nodes = 0;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            int depth = depthOf(line, lineNum);
            if (root != null && depth == 0) {
                throw new TreeFormatException("Tree already has a root; found a second top-level node", lineNum);
            }
            if (root == null && depth != 0) {
                throw new TreeFormatException("First node must not be indented", lineNum);
            }
            adjustStackForDepth(nodeStack, depth, lineNum);

            SyntaxNode node = parseNode(trimmed, lineNum);
            nodes++;

            if (root == null) {
                root = node;
            } else {
                nodeStack.peek().addChild(node);
            }
            if (node instanceof BranchNode branch) {
                nodeStack.push(branch);
            }
        }

        if (root == null) {
            throw new TreeFormatException("Dump contains no nodes", Math.max(1, lineNum));
        }
        log.debug("Read {} nodes", nodes);
        return root;
    }

    private int depthOf(String line, int lineNum) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        if (spaces < line.length() && line.charAt(spaces) == '\t') {
            throw new TreeFormatException("Tabs are not allowed in indentation", lineNum);
        }
        if (spaces % INDENT_WIDTH != 0) {
            throw new TreeFormatException("Indentation must be a multiple of " + INDENT_WIDTH + " spaces", lineNum);
        }
        return spaces / INDENT_WIDTH;
    }

    /**
     * Pops the stack so that its top is the parent of a node at {@code depth}.
     */
    private void adjustStackForDepth(Deque<BranchNode> nodeStack, int depth, int lineNum) {
        if (depth > nodeStack.size()) {
            throw new TreeFormatException("Node is indented too deep, or its parent is a leaf", lineNum);
        }
        while (nodeStack.size() > depth) {
            nodeStack.pop();
        }
    }

    private SyntaxNode parseNode(String text, int lineNum) {
        Matcher leaf = LEAF_PATTERN.matcher(text);
        if (leaf.matches()) {
            TokenType token = TokenType.fromName(leaf.group(1));
            if (token == null) {
                throw new TreeFormatException("Unknown token type: " + leaf.group(1), lineNum);
            }
            LeafNode node = LeafNode.builder()
                    .token(token)
                    .value(unescape(leaf.group(2), lineNum))
                    .line(parseNumber(leaf.group(3), "line", lineNum))
                    .column(parseNumber(leaf.group(4), "column", lineNum))
                    .build();
            restoreAnnotation(node, leaf.group(5), lineNum);
            return node;
        }

        Matcher branch = BRANCH_PATTERN.matcher(text);
        if (branch.matches()) {
            NodeKind kind = NodeKind.fromSymbol(branch.group(1));
            if (kind == null) {
                throw new TreeFormatException("Unknown grammar symbol: " + branch.group(1), lineNum);
            }
            BranchNode node = new BranchNode(kind);
            restoreAnnotation(node, branch.group(2), lineNum);
            return node;
        }

        throw new TreeFormatException("Expected a grammar symbol or a TOKEN \"value\" line:column entry but found '"
                + text + "'", lineNum);
    }

    private static void restoreAnnotation(SyntaxNode node, String newlines, int lineNum) {
        if (newlines != null) {
            node.setNewlines(parseNumber(newlines, "newlines", lineNum));
        }
    }

    private static int parseNumber(String digits, String field, int lineNum) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new TreeFormatException("Value of " + field + " is out of range: " + digits, lineNum);
        }
    }

    private static String unescape(String value, int lineNum) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\', '"' -> sb.append(next);
                default -> throw new TreeFormatException("Unknown escape sequence: \\" + next, lineNum);
            }
        }
        return sb.toString();
    }
}
