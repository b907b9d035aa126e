package com.processdoc.analyzer.describe;

import java.util.List;
import java.util.stream.Collectors;

import com.processdoc.analyzer.engine.ProcessRegistry;
import com.processdoc.analyzer.engine.StepTreeNode;
import com.processdoc.analyzer.model.DescriptionMode;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.input.ParameterBag;
import com.processdoc.analyzer.model.input.StepRecord;

import lombok.Getter;

/**
 * Everything a descriptor arm may look at for one step: the record, its resolved type, the
 * mode and the run's registry.
 */
@Getter
public class StepContext {

    static final String DEFAULT_SOURCE = "dataset";
    static final String DEFAULT_TARGET = "target";

    private final StepTreeNode node;
    private final StepRecord record;
    private final StepType type;
    private final ParameterBag storage;
    private final DescriptionMode mode;
    private final ProcessRegistry registry;
    private final boolean active;

    public StepContext(StepTreeNode node, DescriptionMode mode, ProcessRegistry registry) {
        this.node = node;
        this.record = node.getRecord();
        this.type = node.getType();
        this.storage = record.getStorage();
        this.mode = mode;
        this.registry = registry;
        this.active = record.isActive() || type.isAlwaysActive();
    }

    public boolean isBusiness() {
        return mode == DescriptionMode.BUSINESS;
    }

    public String getName() {
        return record.getDisplayName();
    }

    /**
     * Raw tag as written in the export, falling back to the enum tag.
     */
    public String getRawType() {
        String raw = record.getStepType();
        if (raw != null && !raw.isBlank()) {
            return raw;
        }
        return type.getTag();
    }

    /**
     * Table the step reads from, or {@value #DEFAULT_SOURCE}.
     */
    public String sourceTable() {
        String source = storage.firstText("TableName", "InputTableName");
        return source.isBlank() ? DEFAULT_SOURCE : source;
    }

    /**
     * Table the step writes to, or {@value #DEFAULT_TARGET}.
     */
    public String targetTable() {
        String target = storage.firstText("OutputTableName", "TableName");
        return target.isBlank() ? DEFAULT_TARGET : target;
    }

    public String text(String key) {
        return storage.text(key);
    }

    public String firstText(String... keys) {
        return storage.firstText(keys);
    }

    public String textOr(String key, String fallback) {
        return storage.textOr(key, fallback);
    }

    public List<StepType> childTypes() {
        return node.getChildren().stream()
                .map(StepTreeNode::getType)
                .collect(Collectors.toList());
    }
}
