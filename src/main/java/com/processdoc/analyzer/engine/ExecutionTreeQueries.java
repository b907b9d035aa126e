package com.processdoc.analyzer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import com.processdoc.analyzer.model.ExecutionNode;

import lombok.NoArgsConstructor;

/**
 * Traversal/query utilities for an analyzed execution tree.
 *
 * Stateless: callers provide the root nodes.
 */
@NoArgsConstructor
public class ExecutionTreeQueries {

    /**
     * All nodes in depth-first, pre-order traversal order.
     */
    public List<ExecutionNode> allNodes(List<ExecutionNode> roots) {
        List<ExecutionNode> nodes = new ArrayList<>();
        if (roots != null) {
            for (ExecutionNode root : roots) {
                collect(root, nodes);
            }
        }
        return nodes;
    }

    private void collect(ExecutionNode node, List<ExecutionNode> nodes) {
        nodes.add(node);
        for (ExecutionNode child : node.getChildren()) {
            collect(child, nodes);
        }
    }

    public int countNodes(List<ExecutionNode> roots) {
        return allNodes(roots).size();
    }

    /**
     * Find a node by step name (exact match).
     * Returns the first match encountered during traversal.
     */
    public Optional<ExecutionNode> findByName(List<ExecutionNode> roots, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return find(roots, node -> name.equals(node.getName()));
    }

    public Optional<ExecutionNode> findByStepId(List<ExecutionNode> roots, String stepId) {
        if (stepId == null || stepId.isBlank()) {
            return Optional.empty();
        }
        String needle = stepId.trim();
        return find(roots, node -> Objects.equals(needle, node.getStepId()));
    }

    private Optional<ExecutionNode> find(List<ExecutionNode> roots, Predicate<ExecutionNode> matcher) {
        return allNodes(roots).stream().filter(matcher).findFirst();
    }
}
