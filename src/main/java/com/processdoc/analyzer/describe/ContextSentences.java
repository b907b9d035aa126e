package com.processdoc.analyzer.describe;

import com.processdoc.analyzer.util.StepText;

/**
 * One-sentence summary of what a step does, phrased for the active mode.
 */
public class ContextSentences {

    public String sentence(StepContext step) {
        return step.isBusiness() ? business(step) : technical(step);
    }

    private String business(StepContext step) {
        String table = step.sourceTable();
        String target = step.targetTable();
        return switch (step.getType()) {
            case RUN_DIRECT_QUERY -> "Get data from " + table;
            case RUN_TABLE_QUERY -> "Use data from " + table;
            case RUN_DATASOURCE_QUERY, RUN_SIMPLE_QUERY -> "Get data from " + datasource(step);
            case ADD_COLUMN -> "Calculate fields";
            case UPDATE_COLUMN -> "Update fields";
            case IMPORT_WAREHOUSE_DATA -> "Save to " + target;
            case DELETE_WAREHOUSE_DATA -> "Remove data from " + target;
            case JOIN_TABLE -> "Combine with " + step.text("JoinTable2");
            case APPEND_TABLE -> "Add records to " + step.textOr("AppendToTableName", "a table");
            case FILTER_TABLE -> "Keep only matching rows of " + step.textOr("FilterTableName", table);
            case SORT_TABLE -> "Sort " + table;
            case SET_VARIABLE, CALCULATE_VARIABLE -> "Work out " + step.text("VariableName");
            case LOOP -> "Repeat for " + step.text("InputVariable");
            case GROUP -> "Group of related steps";
            case DECISION -> "Check " + step.textOr("InputTableName", "the data");
            case BRANCH -> "When " + step.text("Expression");
            case EXPORT_TO_EXCEL -> "Export results to Excel";
            case SEND_EMAIL -> "Email " + step.textOr("SendTo", "recipients");
            case LOAD_TEXT_FILE -> "Read file " + fileName(step);
            case SAVE_TEXT, SAVE_TEXT_FILE -> "Write file " + fileName(step);
            case RUN_SQL_STATEMENT -> "Run a database command";
            case RUN_SCRIPT -> "Run a script";
            case COPY_FILE -> "Copy file " + StepText.baseName(step.firstText("SourceFileName", "FileName"));
            case DELETE_FILE -> "Delete file " + fileName(step);
            case RUN_PROCESS -> "Run process " + step.text("ProcessName");
            default -> step.getRawType();
        };
    }

    private String technical(StepContext step) {
        String table = step.sourceTable();
        String target = step.targetTable();
        return switch (step.getType()) {
            case RUN_DIRECT_QUERY -> "Connects to source to pull " + table;
            case RUN_TABLE_QUERY -> "Reads internal " + table;
            case RUN_DATASOURCE_QUERY, RUN_SIMPLE_QUERY ->
                    step.textOr("DatasourceName", "Datasource") + " ➔ " + target;
            case ADD_COLUMN -> "Calculates fields in " + table;
            case UPDATE_COLUMN -> "Updates values in " + table;
            case IMPORT_WAREHOUSE_DATA -> "Publishes to " + target;
            case DELETE_WAREHOUSE_DATA -> "Deletes warehouse rows from " + target;
            case JOIN_TABLE -> "Joins " + step.text("JoinTable1") + " with " + step.text("JoinTable2");
            case APPEND_TABLE -> "Appends " + table + " to " + step.textOr("AppendToTableName", "Table");
            case CREATE_TABLE -> "Creates table " + createdTable(step);
            case PURGE_TABLE -> "Purges " + step.firstText("TableToPurge", "TableName");
            case DELETE_TABLE -> "Drops " + table;
            case FILTER_TABLE -> "Filters " + step.textOr("FilterTableName", table);
            case SORT_TABLE -> "Sorts " + table;
            case SET_VARIABLE -> "Assigns " + step.text("VariableName");
            case CALCULATE_VARIABLE -> "Calculates " + step.text("VariableName");
            case LOOP -> "Iterates over " + step.text("InputVariable");
            case GROUP -> "Groups child steps";
            case EXPORT_TO_EXCEL -> "Export " + step.textOr("ExportMemoryTableName", table) + " to Excel";
            case SEND_EMAIL -> "Send Email to " + step.text("SendTo");
            case LOAD_TEXT_FILE -> "Load Text File into " + step.textOr("MemoryTableName", table);
            case SAVE_TEXT, SAVE_TEXT_FILE ->
                    "Save " + step.textOr("MemoryTableName", table) + " to " + step.textOr("FileName", "Text File");
            case DECISION -> "Decision on " + step.textOr("InputTableName", "Table");
            case BRANCH -> "If " + step.text("Expression");
            case RUN_SQL_STATEMENT -> "Executes SQL against " + step.textOr("DatasourceName", "database");
            case RUN_SCRIPT -> "Runs " + step.textOr("ScriptLanguage", "script");
            case COPY_FILE -> "Copies " + step.firstText("SourceFileName", "FileName")
                    + " to " + step.text("DestinationFileName");
            case DELETE_FILE -> "Deletes " + step.text("FileName");
            case RUN_PROCESS -> "Runs process " + step.text("ProcessName");
            default -> step.getRawType();
        };
    }

    static String datasource(StepContext step) {
        String description = step.getStorage().get("DataSource").firstText("@_Description", "Description");
        if (!description.isBlank()) {
            return description;
        }
        return step.textOr("DatasourceName", "Datasource");
    }

    static String createdTable(StepContext step) {
        String name = step.getRecord().getOutputTableDefinition().text("TableName");
        if (!name.isBlank()) {
            return name;
        }
        return step.textOr("TableName", "New Table");
    }

    private static String fileName(StepContext step) {
        return StepText.baseName(step.text("FileName"));
    }
}
