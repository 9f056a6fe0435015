package com.pyformat.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.pyformat.cli.output.AnnotateResultsPrinter;
import com.pyformat.cli.validation.AnnotateOptionsValidator;
import com.pyformat.style.StyleConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints the blank-line options a style specification resolves to.
 */
@Command(
        name = "style",
        mixinStandardHelpOptions = true,
        description = "Shows the resolved blank-line style options."
)
public class StyleCommand implements Callable<Integer> {

    @Option(names = { "--style", "-s" }, defaultValue = "pep8",
            description = "Preset name, inline {option: value, ...} overrides, or a style file")
    private String style;

    private final AnnotateOptionsValidator validator = new AnnotateOptionsValidator();
    private final AnnotateResultsPrinter printer = new AnnotateResultsPrinter();

    @Override
    public Integer call() {
        List<String> errors = new ArrayList<>();
        StyleConfig config = validator.resolveStyle(style, errors);
        if (!errors.isEmpty()) {
            printer.printValidationErrors(errors);
            return 1;
        }
        printer.printStyle(config);
        return 0;
    }
}
