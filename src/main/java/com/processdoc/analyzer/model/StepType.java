package com.processdoc.analyzer.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.Getter;

/**
 * Known step operation tags. Any other tag resolves to {@link #UNKNOWN}.
 */
@Getter
public enum StepType {
    RUN_DIRECT_QUERY("RunDirectQuery"),
    RUN_TABLE_QUERY("RunTableQuery"),
    RUN_DATASOURCE_QUERY("RunDatasourceQuery"),
    RUN_SIMPLE_QUERY("RunSimpleQuery"),
    ADD_COLUMN("AddColumn"),
    UPDATE_COLUMN("UpdateColumn"),
    IMPORT_WAREHOUSE_DATA("ImportWarehouseData"),
    DELETE_WAREHOUSE_DATA("DeleteWarehouseData"),
    JOIN_TABLE("JoinTable"),
    APPEND_TABLE("AppendTable"),
    CREATE_TABLE("CreateTable"),
    PURGE_TABLE("PurgeTable"),
    DELETE_TABLE("DeleteTable"),
    FILTER_TABLE("FilterTable"),
    SORT_TABLE("SortTable"),
    SET_VARIABLE("SetVariable"),
    CALCULATE_VARIABLE("CalculateVariable"),
    LOOP("Loop"),
    GROUP("Group"),
    DECISION("Decision"),
    BRANCH("Branch"),
    EXPORT_TO_EXCEL("ExportToExcel"),
    SEND_EMAIL("SendEmail"),
    LOAD_TEXT_FILE("LoadTextFile"),
    SAVE_TEXT("SaveText"),
    SAVE_TEXT_FILE("SaveTextfile"),
    RUN_SQL_STATEMENT("RunSqlStatement"),
    RUN_SCRIPT("RunScript"),
    COPY_FILE("CopyFile"),
    DELETE_FILE("DeleteFile"),
    RUN_PROCESS("RunProcess"),
    UNKNOWN("");

    private static final Map<String, StepType> BY_TAG = Stream.of(values())
            .filter(t -> t != UNKNOWN)
            .collect(Collectors.toMap(t -> t.tag.toLowerCase(Locale.ROOT), Function.identity()));

    private static final Set<StepType> HOUSEKEEPING = EnumSet.of(PURGE_TABLE, CREATE_TABLE, DELETE_TABLE);

    private static final Set<StepType> STRUCTURAL = EnumSet.of(LOOP, GROUP, DECISION, BRANCH);

    private final String tag;

    StepType(String tag) {
        this.tag = tag;
    }

    public static StepType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        return BY_TAG.getOrDefault(tag.trim().toLowerCase(Locale.ROOT), UNKNOWN);
    }

    /**
     * Table maintenance steps hidden from business readers.
     */
    public boolean isHousekeeping() {
        return HOUSEKEEPING.contains(this);
    }

    /**
     * Control-flow steps, always kept in business mode.
     */
    public boolean isStructural() {
        return STRUCTURAL.contains(this);
    }

    /**
     * Decision and branch steps count as active whatever their stored flag says.
     */
    public boolean isAlwaysActive() {
        return this == DECISION || this == BRANCH;
    }

    public boolean isQuery() {
        return this == RUN_DIRECT_QUERY || this == RUN_TABLE_QUERY
                || this == RUN_DATASOURCE_QUERY || this == RUN_SIMPLE_QUERY;
    }

    public boolean isVariableDefinition() {
        return this == SET_VARIABLE || this == CALCULATE_VARIABLE;
    }

    public boolean isTextFile() {
        return this == LOAD_TEXT_FILE || this == SAVE_TEXT || this == SAVE_TEXT_FILE;
    }
}
