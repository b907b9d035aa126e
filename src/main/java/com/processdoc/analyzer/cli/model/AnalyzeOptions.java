package com.processdoc.analyzer.cli.model;

import java.nio.file.Path;

import com.processdoc.analyzer.config.OutputFormat;
import com.processdoc.analyzer.model.DescriptionMode;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "analyze" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

    @Option(names = { "--input", "-i" }, description = "Process step export (JSON form of Steps.xml)")
    private Path input;

    @Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
    private Path output;

    @Option(names = { "--mode", "-m" }, defaultValue = "TECHNICAL",
            description = "Description mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private DescriptionMode mode;

    @Option(names = { "--format", "-f" }, defaultValue = "JSON",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format;

    @Option(names = { "--force" }, description = "Overwrite an existing output file")
    private boolean force;
}
