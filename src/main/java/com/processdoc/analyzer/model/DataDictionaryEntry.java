package com.processdoc.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Field definition declared by a step (dynamic field or output column).
 */
@Value
@Builder
public class DataDictionaryEntry {
    String name;
    String type;
    String length;
    String description;
}
