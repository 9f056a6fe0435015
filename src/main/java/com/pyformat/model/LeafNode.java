package com.pyformat.model;

import lombok.Builder;
import lombok.Getter;

/**
 * A token of the syntax tree. Carries its source position.
 */
@Getter
public class LeafNode extends SyntaxNode {
    private final TokenType token;
    private final String value;
    private final int line;
    private final int column;

    @Builder
    public LeafNode(TokenType token, String value, int line, int column) {
        if (token == null) {
            throw new IllegalArgumentException("Leaf token type is required");
        }
        this.token = token;
        this.value = value != null ? value : "";
        this.line = line;
        this.column = column;
    }

    public static LeafNode of(TokenType token, String value, int line, int column) {
        return new LeafNode(token, value, line, column);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String getTypeName() {
        return token.name();
    }

    @Override
    public String toString() {
        return token + "('" + value + "', " + line + ":" + column + ")";
    }
}
