package com.processdoc.analyzer.config;

import java.nio.file.Path;

import com.processdoc.analyzer.model.DescriptionMode;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one analysis run.
 */
@Data
@Builder
public class AnalyzerConfig {
    private Path inputFile;

    /**
     * Target file, or null to write to standard output.
     */
    private Path outputFile;

    @Builder.Default
    private DescriptionMode mode = DescriptionMode.TECHNICAL;

    @Builder.Default
    private OutputFormat format = OutputFormat.JSON;

    private boolean force;

    public boolean writesToStandardOutput() {
        return outputFile == null;
    }
}
