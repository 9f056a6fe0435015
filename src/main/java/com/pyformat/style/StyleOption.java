package com.pyformat.style;

import java.util.Locale;

/**
 * Numeric style knobs consulted by the blank-line calculator.
 */
public enum StyleOption {

    /** Blank lines around top-level definitions, on top of the one every definition gets. */
    BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION(1),

    /** Blank lines between methods of the same class, on top of the one they always keep. */
    BLANK_LINES_BETWEEN_CLASS_DEFS(0);

    private final int defaultValue;

    StyleOption(int defaultValue) {
        this.defaultValue = defaultValue;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    /**
     * Option names are matched case-insensitively; dashes count as underscores.
     *
     * @return the option, or {@code null} when the name is unknown
     */
    public static StyleOption fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (StyleOption option : values()) {
            if (option.name().equals(normalized)) {
                return option;
            }
        }
        return null;
    }
}
