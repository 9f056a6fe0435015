package com.pyformat.blanklines;

import lombok.Builder;
import lombok.Value;

/**
 * One annotated node, as seen by the renderer.
 */
@Value
@Builder
public class BlankLineDecision {
    String nodeType;
    String value;
    int line;
    int column;
    int newlines;

    public int getBlankLines() {
        return newlines - 1;
    }
}
