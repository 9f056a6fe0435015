package com.pyformat.tree;

import com.pyformat.model.SyntaxNode;

/**
 * Raised when a syntax tree violates the shape guarantees of the parser
 * (for example a decorator without a decorated target). These are defects of
 * the upstream stage and are never recovered from.
 */
public class MalformedTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, SyntaxNode node) {
        super(message + " (" + node.getTypeName() + " at line " + node.getLine() + ")");
    }
}
