package com.processdoc.analyzer.model;

/**
 * Output profile for step descriptions.
 */
public enum DescriptionMode {
    /**
     * Plain-language sentences; housekeeping and disabled steps are left out.
     */
    BUSINESS,

    /**
     * Every step, with source-level detail such as SQL previews.
     */
    TECHNICAL;

    public static DescriptionMode orDefault(DescriptionMode mode) {
        return mode != null ? mode : TECHNICAL;
    }
}
