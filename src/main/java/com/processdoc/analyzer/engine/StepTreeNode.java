package com.processdoc.analyzer.engine;

import java.util.ArrayList;
import java.util.List;

import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.input.StepRecord;

import lombok.Getter;

/**
 * Working copy of a step record that accrues its children while the tree is linked.
 */
@Getter
public class StepTreeNode {
    private final StepRecord record;
    private final StepType type;
    private final List<StepTreeNode> children = new ArrayList<>();

    public StepTreeNode(StepRecord record) {
        this.record = record;
        this.type = StepType.fromTag(record.getStepType());
    }

    void addChild(StepTreeNode child) {
        children.add(child);
    }

    /**
     * Sequence number used for ordering; missing or non-numeric values sort last.
     */
    public int sortKey() {
        String sequence = record.getSequence();
        if (sequence == null || sequence.isBlank()) {
            return Integer.MAX_VALUE;
        }
        try {
            return Integer.parseInt(sequence.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
