package com.pyformat.style;

import java.util.List;

/**
 * Every problem found while resolving one style source: a preset name, an
 * inline override or a style file.
 */
public class StyleConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String source;
    private final List<String> errors;

    public StyleConfigException(String source, List<String> errors) {
        super("Style " + source + ": " + String.join("; ", errors));
        this.source = source;
        this.errors = List.copyOf(errors);
    }

    /**
     * @return the style name, inline override text or file path that failed
     */
    public String getSource() {
        return source;
    }

    public List<String> getErrors() {
        return errors;
    }
}
