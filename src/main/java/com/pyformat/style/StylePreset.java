package com.pyformat.style;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named base styles. They agree on the blank-line options and differ elsewhere
 * in the formatter, so the names are accepted for compatibility.
 */
public enum StylePreset {
    PEP8("pep8"),
    GOOGLE("google"),
    FACEBOOK("facebook"),
    YAPF("yapf");

    private final String styleName;

    StylePreset(String styleName) {
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }

    Map<StyleOption, Integer> optionValues() {
        Map<StyleOption, Integer> values = new EnumMap<>(StyleOption.class);
        for (StyleOption option : StyleOption.values()) {
            values.put(option, option.getDefaultValue());
        }
        return values;
    }

    /**
     * @return the preset, or {@code null} when the name is unknown
     */
    public static StylePreset fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StylePreset preset : values()) {
            if (preset.styleName.equals(normalized)) {
                return preset;
            }
        }
        return null;
    }
}
