package com.processdoc.analyzer;

import com.processdoc.analyzer.cli.AnalyzeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the ETL Process Analyzer.
 * Reads a vendor process step export and writes its annotated execution model
 * as JSON, a plain-text outline or a Mermaid flowchart.
 */
public class AnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new AnalyzeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
