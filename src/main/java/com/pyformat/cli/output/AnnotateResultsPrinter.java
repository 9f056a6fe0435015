package com.pyformat.cli.output;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pyformat.blanklines.BlankLineDecision;
import com.pyformat.blanklines.BlankLineReport;
import com.pyformat.cli.model.ValidatedAnnotateOptions;
import com.pyformat.style.StyleConfig;

/**
 * Responsible only for printing CLI output for the "annotate" and "style" commands.
 * No validation, no execution.
 */
public class AnnotateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnnotateResultsPrinter.class);

    public void printBanner(ValidatedAnnotateOptions v) {
        log.info("=================================================");
        log.info("Blank Line Calculator");
        log.info("=================================================");
        log.info("Tree File: {}", v.getTreeFile());
        log.info("Style: {}", v.getStyle());
        log.info("=================================================");
    }

    public void printReport(BlankLineReport report) {
        log.info("");
        log.info("Decisions: {}", report.size());
        for (BlankLineDecision decision : report.getDecisions()) {
            log.info(String.format(Locale.ROOT, "  %5d:%-3d %-10s %-20s newlines=%d (%d blank)",
                    decision.getLine(), decision.getColumn(), decision.getNodeType(),
                    abbreviate(decision.getValue()), decision.getNewlines(), decision.getBlankLines()));
        }
    }

    public void printDump(String dump) {
        log.info("");
        log.info("Annotated tree:");
        dump.lines().forEach(log::info);
    }

    public void printStyle(StyleConfig style) {
        log.info("based_on_style = {}", style.getBaseStyle());
        style.asMap().forEach((option, value) ->
                log.info("{} = {}", option.name().toLowerCase(Locale.ROOT), value));
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(error -> log.error("  - {}", error));
    }

    public void printFailure(String message) {
        log.error("Blank line calculation failed: {}", message);
    }

    private static String abbreviate(String value) {
        String singleLine = value.replace('\n', ' ');
        return singleLine.length() > 20 ? singleLine.substring(0, 17) + "..." : singleLine;
    }
}
