package com.processdoc.analyzer.model;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of analyzing one process definition.
 *
 * {@code executionTree} and {@code executionFlow} share node instances: the flow is the
 * depth-first listing of the tree. All collections are unmodifiable views.
 */
@Value
@Builder
public class ExecutionModel {
    @NonNull
    DescriptionMode mode;
    @NonNull
    List<ExecutionNode> executionTree;
    @NonNull
    List<ExecutionNode> executionFlow;
    @NonNull
    List<VariableEntry> variables;
    @NonNull
    Set<String> variableSet;
    @NonNull
    Set<String> tableSet;
    @NonNull
    Set<String> stepOutputSet;
    @NonNull
    AnalysisDiagnostics diagnostics;
}
