package com.processdoc.analyzer.render;

import java.util.List;

import lombok.Value;

/**
 * Mermaid statements of one flowchart, grouped by section.
 */
@Value
public class FlowChart {
    /**
     * Inline subgraph styles, emitted after the class definitions.
     */
    List<String> styles;
    /**
     * Node declarations with their {@code subgraph ... end} wrappers, in traversal order.
     */
    List<String> steps;
    /**
     * Deduplicated edges.
     */
    List<String> links;

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
