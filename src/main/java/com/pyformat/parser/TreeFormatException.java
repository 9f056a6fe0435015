package com.pyformat.parser;

/**
 * Syntax error in a tree dump.
 */
public class TreeFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int lineNumber;

    public TreeFormatException(String message, int lineNumber) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
