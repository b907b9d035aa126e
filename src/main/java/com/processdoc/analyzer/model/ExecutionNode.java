package com.processdoc.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Annotated step in the reconstructed execution tree.
 *
 * The same instance is referenced from the tree (through its parent's {@link #children}) and
 * from the depth-first flow list, so it must be treated as read-only once analysis returns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionNode {
    private String id;
    private String stepId;
    private String rawType;
    private StepType type;
    private String name;
    private boolean active;
    private int depth;

    /**
     * Raw type, suffixed with {@code [DISABLED]} for inactive steps.
     */
    private String phase;
    private String context;
    private String flowLabel;
    private String smartDescription;
    private String description;

    @Builder.Default
    private List<String> inputs = new ArrayList<>();
    @Builder.Default
    private List<String> outputs = new ArrayList<>();
    private OutputDescriptor output;

    @Builder.Default
    private List<String> details = new ArrayList<>();
    @Builder.Default
    private List<String> filters = new ArrayList<>();
    @Builder.Default
    private List<String> existsLogic = new ArrayList<>();
    @Builder.Default
    private List<DataDictionaryEntry> dataDictionary = new ArrayList<>();

    private TableProjection table;

    /**
     * Rules of the step's principal conditional expression, if it has one.
     */
    private List<Rule> rules;

    @Builder.Default
    private List<ExecutionNode> children = new ArrayList<>();

    public void addChild(ExecutionNode child) {
        children.add(child);
    }
}
