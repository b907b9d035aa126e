package com.processdoc.analyzer.config;

/**
 * Serialized form of an analysis written by the CLI.
 */
public enum OutputFormat {
    JSON,
    OUTLINE,
    /**
     * Mermaid flowchart source of the execution tree.
     */
    MERMAID
}
