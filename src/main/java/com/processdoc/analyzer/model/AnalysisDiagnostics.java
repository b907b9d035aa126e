package com.processdoc.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Warnings and notes accumulated while analyzing one process definition.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AnalysisDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
