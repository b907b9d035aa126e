package com.processdoc.analyzer.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.engine.exception.StepCycleException;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.input.StepRecord;

/**
 * Rebuilds the parent/child forest from flat step records.
 *
 * Records may arrive in any order. Each one is indexed by id first, then linked to its parent;
 * steps whose parent is absent, {@code 0} or unknown become roots. Every level is ordered by
 * sequence number. Numeric ids match by value, so a parent reference {@code 010} or
 * {@code 10.0} finds step {@code 10}.
 */
public class StepNormalizer {
    private static final Logger log = LoggerFactory.getLogger(StepNormalizer.class);

    private static final Comparator<StepTreeNode> BY_SEQUENCE = Comparator.comparingInt(StepTreeNode::sortKey);

    private static final Pattern NUMERIC_ID = Pattern.compile("([+-]?\\d+)(?:\\.0*)?");

    public List<StepTreeNode> normalize(List<StepRecord> records, AnalysisDiagnostics diagnostics) {
        List<StepTreeNode> nodes = new ArrayList<>(records.size());
        Map<String, StepTreeNode> byId = new HashMap<>();

        for (StepRecord record : records) {
            StepTreeNode node = new StepTreeNode(record);
            nodes.add(node);
            String id = record.getStepId();
            if (id == null || id.isBlank()) {
                continue;
            }
            if (byId.put(idKey(id), node) != null) {
                String message = "Duplicate step id " + id + "; children link to the last occurrence";
                log.warn(message);
                diagnostics.warn(message);
            }
        }

        List<StepTreeNode> roots = new ArrayList<>();
        for (StepTreeNode node : nodes) {
            String parentId = node.getRecord().getParentStepId();
            if (isRootReference(parentId)) {
                roots.add(node);
                continue;
            }
            StepTreeNode parent = byId.get(idKey(parentId));
            if (parent == null) {
                String message = "Step " + describe(node) + " references missing parent " + parentId + "; promoted to root";
                log.debug(message);
                diagnostics.info(message);
                roots.add(node);
            } else {
                parent.addChild(node);
            }
        }

        ensureAcyclic(nodes, roots);
        sortRecursively(roots);
        return roots;
    }

    private static boolean isRootReference(String parentId) {
        return parentId == null || parentId.isBlank() || "0".equals(idKey(parentId));
    }

    /**
     * Lookup key of a step id: integral numbers in canonical form, anything else trimmed.
     */
    static String idKey(String id) {
        String trimmed = id.trim();
        Matcher matcher = NUMERIC_ID.matcher(trimmed);
        if (matcher.matches()) {
            return new BigInteger(matcher.group(1)).toString();
        }
        return trimmed;
    }

    /**
     * Every linked node must be reachable from a root; the rest hang off a parent loop.
     */
    private void ensureAcyclic(List<StepTreeNode> nodes, List<StepTreeNode> roots) {
        Set<StepTreeNode> reached = Collections.newSetFromMap(new IdentityHashMap<>());
        List<StepTreeNode> pending = new ArrayList<>(roots);
        while (!pending.isEmpty()) {
            StepTreeNode current = pending.remove(pending.size() - 1);
            if (reached.add(current)) {
                pending.addAll(current.getChildren());
            }
        }
        if (reached.size() == nodes.size()) {
            return;
        }
        List<String> cycle = new ArrayList<>();
        for (StepTreeNode node : nodes) {
            if (!reached.contains(node)) {
                cycle.add(describe(node));
            }
        }
        throw new StepCycleException(cycle);
    }

    private void sortRecursively(List<StepTreeNode> level) {
        level.sort(BY_SEQUENCE);
        for (StepTreeNode node : level) {
            sortRecursively(node.getChildren());
        }
    }

    private static String describe(StepTreeNode node) {
        String id = node.getRecord().getStepId();
        return id == null || id.isBlank() ? "'" + node.getRecord().getDisplayName() + "'" : id;
    }
}
