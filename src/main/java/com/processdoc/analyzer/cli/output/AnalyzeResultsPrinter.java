package com.processdoc.analyzer.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.cli.model.AnalyzeOptions;
import com.processdoc.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.processdoc.analyzer.report.ReportResult;

/**
 * Responsible only for printing CLI output for the "analyze" command.
 * No validation, no execution.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    public void printBanner(AnalyzeOptions o, ValidatedAnalyzeOptions v) {
        log.info("=================================================");
        log.info("ETL Process Analyzer");
        log.info("=================================================");
        log.info("Input File: {}", v.getNormalizedInput());
        log.info("Output: {}", v.getNormalizedOutput() != null ? v.getNormalizedOutput() : "standard output");
        log.info("Mode: {}", o.getMode());
        log.info("Format: {}", o.getFormat());
        log.info("=================================================");
    }

    public void printSuccess(ReportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS SUCCESSFUL");
        log.info("=================================================");
        if (result.getOutputPath() != null) {
            log.info("Output Path: {}", result.getOutputPath());
        }
        log.info("Steps Read: {}", result.getStepsRead());
        log.info("Steps Described: {}", result.getNodesDescribed());
        log.info("Variables: {}", result.getVariableCount());
        log.info("Tables: {}", result.getTableCount());
        log.info("Step Outputs: {}", result.getStepOutputCount());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.warn("Warnings ({}):", result.getWarnings().size());
            result.getWarnings().forEach(warning -> log.warn("  {}", warning));
        }
        log.info("=================================================");
    }

    public void printFailure(ReportResult result) {
        log.error("Analysis failed: {}", result.getErrorMessage());
    }
}
