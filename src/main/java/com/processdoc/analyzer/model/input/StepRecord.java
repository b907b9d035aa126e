package com.processdoc.analyzer.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One step of a vendor process definition, as delivered by the ingestion layer.
 * Never mutated once read.
 */
@Value
@Builder
public class StepRecord {
    String stepId;
    String parentStepId;
    String stepType;
    String sequence;
    @Builder.Default
    boolean active = true;
    String name;
    String description;
    String narration;
    String comments;
    String outputTableName;

    @NonNull
    @Builder.Default
    ParameterBag storage = ParameterBag.empty();

    @NonNull
    @Builder.Default
    ParameterBag outputTableDefinition = ParameterBag.empty();

    /**
     * Display name, empty when the record carries none.
     */
    public String getDisplayName() {
        return name != null ? name : "";
    }
}
