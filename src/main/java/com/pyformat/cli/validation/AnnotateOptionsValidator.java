package com.pyformat.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.pyformat.cli.exception.OptionsValidationException;
import com.pyformat.cli.model.AnnotateOptions;
import com.pyformat.cli.model.ValidatedAnnotateOptions;
import com.pyformat.style.StyleConfig;
import com.pyformat.style.StyleConfigException;
import com.pyformat.style.StyleParser;

public class AnnotateOptionsValidator {

    private final StyleParser styleParser;

    public AnnotateOptionsValidator() {
        this(new StyleParser());
    }

    public AnnotateOptionsValidator(StyleParser styleParser) {
        this.styleParser = styleParser;
    }

    public ValidatedAnnotateOptions validate(AnnotateOptions o) {
        List<String> errors = new ArrayList<>();

        Path treeFile = null;
        if (o.getTreeFile() == null) {
            errors.add("A syntax tree dump is required (TREE_FILE).");
        } else {
            treeFile = o.getTreeFile().toAbsolutePath().normalize();
            if (!Files.exists(treeFile)) {
                errors.add("Tree file does not exist: " + treeFile);
            } else if (!Files.isRegularFile(treeFile)) {
                errors.add("Tree file is not a regular file: " + treeFile);
            }
        }

        StyleConfig style = resolveStyle(o.getStyle(), errors);

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedAnnotateOptions(treeFile, style);
    }

    public StyleConfig resolveStyle(String spec, List<String> errors) {
        try {
            return styleParser.parse(spec);
        } catch (StyleConfigException e) {
            for (String error : e.getErrors()) {
                errors.add("Invalid --style: " + error);
            }
            return null;
        }
    }
}
