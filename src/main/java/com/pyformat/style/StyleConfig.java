package com.pyformat.style;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only style lookup. Options not set explicitly fall back to their defaults.
 */
public final class StyleConfig {

    private final String baseStyle;
    private final Map<StyleOption, Integer> values;

    private StyleConfig(String baseStyle, Map<StyleOption, Integer> values) {
        this.baseStyle = baseStyle;
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static StyleConfig pep8() {
        return preset(StylePreset.PEP8);
    }

    public static StyleConfig preset(StylePreset preset) {
        return new StyleConfig(preset.getStyleName(), preset.optionValues());
    }

    public int get(StyleOption option) {
        Integer value = values.get(option);
        return value != null ? value : option.getDefaultValue();
    }

    public String getBaseStyle() {
        return baseStyle;
    }

    public Map<StyleOption, Integer> asMap() {
        Map<StyleOption, Integer> all = new EnumMap<>(StyleOption.class);
        for (StyleOption option : StyleOption.values()) {
            all.put(option, get(option));
        }
        return all;
    }

    /**
     * @return a copy of this style with one option replaced
     */
    public StyleConfig with(StyleOption option, int value) {
        Map<StyleOption, Integer> copy = new EnumMap<>(StyleOption.class);
        copy.putAll(values);
        copy.put(option, value);
        return new StyleConfig(baseStyle, copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{based_on_style: ").append(baseStyle);
        asMap().forEach((option, value) ->
                sb.append(", ").append(option.name().toLowerCase(Locale.ROOT)).append(": ").append(value));
        return sb.append('}').toString();
    }
}
