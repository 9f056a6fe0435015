package com.pyformat.style;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a style specification into a {@link StyleConfig}.
 *
 * Accepted forms:
 * - Preset name: pep8, google, facebook, yapf
 * - Inline overrides: {based_on_style: pep8, blank_lines_between_class_defs: 0}
 * - Path to a style file with a [style] section of "option = value" lines
 *
 * Every problem is collected and reported in one {@link StyleConfigException}.
 */
public class StyleParser {
    private static final Logger log = LoggerFactory.getLogger(StyleParser.class);

    private static final String BASED_ON_STYLE = "based_on_style";
    private static final String STYLE_SECTION = "style";

    // key: value or key = value
    private static final Pattern ENTRY_PATTERN = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_\\-]*)\\s*[:=]\\s*(.*)$"
    );

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[([^\\]]+)]$");

    public StyleConfig parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return StyleConfig.pep8();
        }

        String trimmed = spec.trim();
        if (trimmed.startsWith("{")) {
            return parseInline(trimmed);
        }

        StylePreset preset = StylePreset.fromName(trimmed);
        if (preset != null) {
            return StyleConfig.preset(preset);
        }

        Path path = Path.of(trimmed);
        if (Files.isRegularFile(path)) {
            return parseFile(path);
        }

        throw new StyleConfigException(trimmed, List.of("Unknown style: '" + trimmed
                + "'. Expected a preset name, an inline {option: value} list, or a style file."));
    }

    public StyleConfig parseFile(Path styleFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(styleFile);
        } catch (IOException e) {
            throw new StyleConfigException(styleFile.toString(),
                    List.of("Cannot read style file " + styleFile + ": " + e.getMessage()));
        }
        log.debug("Reading style from {}", styleFile);
        return parseLines(lines, styleFile.toString());
    }

    /**
     * Parses the [style] section of a style file. Lines outside that section are ignored.
     */
    public StyleConfig parseLines(List<String> lines, String sourceName) {
        List<String> errors = new ArrayList<>();
        List<String[]> entries = new ArrayList<>();
        boolean inStyleSection = false;
        boolean sawStyleSection = false;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            Matcher section = SECTION_PATTERN.matcher(trimmed);
            if (section.matches()) {
                inStyleSection = section.group(1).trim().equalsIgnoreCase(STYLE_SECTION);
                sawStyleSection |= inStyleSection;
                continue;
            }
            if (!inStyleSection) {
                continue;
            }

            Matcher entry = ENTRY_PATTERN.matcher(trimmed);
            if (entry.matches()) {
                entries.add(new String[] { entry.group(1), entry.group(2).trim(), "line " + lineNum });
            } else {
                errors.add(sourceName + " line " + lineNum + ": expected 'option = value' but found '" + trimmed + "'");
            }
        }

        if (!sawStyleSection) {
            errors.add(sourceName + ": no [" + STYLE_SECTION + "] section found");
        }

        return build(sourceName, entries, errors);
    }

    private StyleConfig parseInline(String spec) {
        List<String> errors = new ArrayList<>();
        if (!spec.endsWith("}")) {
            throw new StyleConfigException(spec, List.of("Unterminated style override: " + spec));
        }

        List<String[]> entries = new ArrayList<>();
        String body = spec.substring(1, spec.length() - 1);
        for (String part : body.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher entry = ENTRY_PATTERN.matcher(trimmed);
            if (entry.matches()) {
                entries.add(new String[] { entry.group(1), entry.group(2).trim(), "'" + trimmed + "'" });
            } else {
                errors.add("Expected 'option: value' but found '" + trimmed + "'");
            }
        }

        return build(spec, entries, errors);
    }

    private StyleConfig build(String source, List<String[]> entries, List<String> errors) {
        StylePreset base = StylePreset.PEP8;
        Map<StyleOption, Integer> overrides = new EnumMap<>(StyleOption.class);

        for (String[] entry : entries) {
            String key = entry[0];
            String value = unquote(entry[1]);
            String where = entry[2];

            if (key.equalsIgnoreCase(BASED_ON_STYLE)) {
                StylePreset preset = StylePreset.fromName(value);
                if (preset == null) {
                    errors.add("Unknown base style '" + value + "' at " + where);
                } else {
                    base = preset;
                }
                continue;
            }

            StyleOption option = StyleOption.fromName(key);
            if (option == null) {
                errors.add("Unknown style option '" + key.toLowerCase(Locale.ROOT) + "' at " + where);
                continue;
            }

            try {
                overrides.put(option, Integer.parseInt(value));
            } catch (NumberFormatException e) {
                errors.add("Option " + option.name().toLowerCase(Locale.ROOT)
                        + " expects an integer but got '" + value + "' at " + where);
            }
        }

        if (!errors.isEmpty()) {
            throw new StyleConfigException(source, errors);
        }

        StyleConfig config = StyleConfig.preset(base);
        for (Map.Entry<StyleOption, Integer> override : overrides.entrySet()) {
            config = config.with(override.getKey(), override.getValue());
        }
        log.debug("Resolved style {}", config);
        return config;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && (value.startsWith("'") && value.endsWith("'") || value.startsWith("\"") && value.endsWith("\""))) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
