package com.pyformat.cli.model;

import java.nio.file.Path;

import com.pyformat.style.StyleConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnnotateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnnotateOptions {
    Path treeFile;
    StyleConfig style;
}
