package com.processdoc.analyzer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Variable or loop iterator discovered in a process, with the steps that mention it.
 */
@Getter
@ToString
@EqualsAndHashCode
public class VariableEntry {

    public enum Kind {
        VARIABLE,
        ITERATOR
    }

    public static final String NO_VALUE = "N/A";
    public static final String LOOP_CONDITION = "Loop Condition";

    private final String name;
    private final Kind kind;
    private final String value;
    private final String declaringStep;

    @Getter(AccessLevel.NONE)
    private final Set<String> usageSet = new LinkedHashSet<>();

    public VariableEntry(String name, Kind kind, String value, String declaringStep) {
        this.name = name;
        this.kind = kind;
        this.value = value != null && !value.isBlank() ? value : NO_VALUE;
        this.declaringStep = declaringStep;
    }

    /**
     * Records a referencing step; repeated names are ignored, first-seen order is kept.
     */
    public void addUsage(String stepName) {
        usageSet.add(stepName);
    }

    public List<String> getUsages() {
        return new ArrayList<>(usageSet);
    }
}
