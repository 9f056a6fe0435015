package com.pyformat.blanklines;

import com.pyformat.model.SyntaxNode;

import lombok.Data;

/**
 * Mutable record threaded through one walk of the blank-line calculator.
 * Created fresh for every walk and owned by it.
 */
@Data
public class TraversalState {
    private int classLevel;
    private int functionLevel;
    /** Last line of the most recent standalone comment, 0 when none was seen. */
    private int lastCommentLine;
    private boolean lastWasDecorator;
    private boolean lastWasClassOrFunction;
    /** Last visited statement or definition; comment lines never count. */
    private SyntaxNode previousStatement;

    public void enterClass() {
        classLevel++;
    }

    public void leaveClass() {
        if (classLevel == 0) {
            throw new IllegalStateException("Class nesting underflow");
        }
        classLevel--;
    }

    public void enterFunction() {
        functionLevel++;
    }

    public void leaveFunction() {
        if (functionLevel == 0) {
            throw new IllegalStateException("Function nesting underflow");
        }
        functionLevel--;
    }

    public boolean isNested() {
        return classLevel > 0 || functionLevel > 0;
    }
}
