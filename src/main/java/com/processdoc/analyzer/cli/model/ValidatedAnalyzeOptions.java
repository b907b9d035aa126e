package com.processdoc.analyzer.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    Path normalizedInput;

    /**
     * Absolute output path, or null for standard output.
     */
    Path normalizedOutput;
}
