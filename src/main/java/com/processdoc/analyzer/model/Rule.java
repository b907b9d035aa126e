package com.processdoc.analyzer.model;

import lombok.Value;

/**
 * One row of a flattened conditional: when {@code condition} holds, the result is {@code outcome}.
 */
@Value
public class Rule {
    public static final String DEFAULT_CONDITION = "Default - When nothing fits the above cases";
    public static final String ELSE_CONDITION = "ELSE";

    String condition;
    String outcome;

    public static Rule of(String condition, String outcome) {
        return new Rule(condition, outcome);
    }

    public static Rule otherwise(String outcome) {
        return new Rule(DEFAULT_CONDITION, outcome);
    }

    public boolean coversRemainingCases() {
        return DEFAULT_CONDITION.equals(condition) || ELSE_CONDITION.equals(condition);
    }
}
