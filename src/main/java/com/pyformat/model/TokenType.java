package com.pyformat.model;

/**
 * Token types carried by leaf nodes of the syntax tree.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    AT,
    COMMENT,
    NEWLINE,
    INDENT,
    DEDENT,
    ASYNC,
    AWAIT,
    ENDMARKER;

    /**
     * Resolves a token name as written in a tree dump (case-insensitive).
     *
     * @return the token type, or {@code null} when the name is unknown
     */
    public static TokenType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (TokenType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }
}
