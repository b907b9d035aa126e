package com.processdoc.analyzer.model;

import lombok.Value;

/**
 * What a step explicitly produces.
 */
@Value
public class OutputDescriptor {
    OutputKind kind;
    String name;

    public enum OutputKind {
        WAREHOUSE,
        TABLE,
        VAR,
        ITERATOR
    }
}
