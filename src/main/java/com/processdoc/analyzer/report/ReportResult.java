package com.processdoc.analyzer.report;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one analysis run.
 */
@Data
@Builder
public class ReportResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int stepsRead;
    private int nodesDescribed;
    private int variableCount;
    private int tableCount;
    private int stepOutputCount;

    @Builder.Default
    private List<String> warnings = List.of();

    public static ReportResult failure(String errorMessage) {
        return ReportResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
