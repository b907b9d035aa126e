package com.processdoc.analyzer.describe;

import com.processdoc.analyzer.util.StepText;

/**
 * Short label shown on the step's box in a flow diagram.
 */
public class FlowLabels {

    static final int BUSINESS_VALUE_LENGTH = 40;
    static final int SUBJECT_LENGTH = 20;

    private final ContextSentences sentences;

    public FlowLabels(ContextSentences sentences) {
        this.sentences = sentences;
    }

    public String label(StepContext step) {
        return switch (step.getType()) {
            case SET_VARIABLE, CALCULATE_VARIABLE -> assignment(step);
            case DECISION, BRANCH -> condition(step);
            case EXPORT_TO_EXCEL -> "Export to Excel: " + fileOr(step, "File");
            case SEND_EMAIL -> email(step);
            case LOAD_TEXT_FILE -> "Load Text: " + fileOr(step, "File");
            case SAVE_TEXT, SAVE_TEXT_FILE -> "Save Text: " + fileOr(step, "File");
            case RUN_DIRECT_QUERY, RUN_DATASOURCE_QUERY, RUN_SIMPLE_QUERY -> query(step);
            case IMPORT_WAREHOUSE_DATA -> "Save to Warehouse: " + step.targetTable();
            case PURGE_TABLE -> "Purge: " + orDefault(step.firstText("TableToPurge", "TableName"), "Table");
            case DELETE_WAREHOUSE_DATA -> "Delete Warehouse Data: " + step.targetTable();
            case CREATE_TABLE -> "Create Table: " + ContextSentences.createdTable(step);
            case APPEND_TABLE -> "Append to: " + step.textOr("AppendToTableName", "Table");
            case JOIN_TABLE -> "Join: " + step.text("JoinTable1") + " + " + step.text("JoinTable2");
            case FILTER_TABLE -> "Filter: " + step.textOr("FilterTableName", step.sourceTable());
            case SORT_TABLE -> "Sort: " + step.sourceTable();
            case LOOP -> "For each " + orDefault(step.text("InputVariable"), "item");
            case RUN_SQL_STATEMENT -> "SQL: " + step.textOr("DatasourceName", "database");
            case RUN_SCRIPT -> "Script: " + step.textOr("ScriptLanguage", "script");
            case COPY_FILE -> "Copy: " + StepText.baseName(step.firstText("SourceFileName", "FileName"))
                    + " ➔ " + StepText.baseName(step.text("DestinationFileName"));
            case DELETE_FILE -> "Delete File: " + fileOr(step, "File");
            case RUN_PROCESS -> "Run Process: " + step.textOr("ProcessName", "Process");
            default -> sentences.sentence(step);
        };
    }

    private String assignment(StepContext step) {
        String value = step.firstText("VariableValue", "Expression");
        if (step.isBusiness()) {
            value = StepText.truncate(value, BUSINESS_VALUE_LENGTH);
        }
        return step.text("VariableName") + " = " + value;
    }

    private String condition(StepContext step) {
        String expression = step.text("Expression");
        if (!expression.isBlank()) {
            return "If " + expression;
        }
        return "Decision on " + step.sourceTable();
    }

    private String email(StepContext step) {
        String subject = step.text("SubjectLine");
        String label = subject.isBlank()
                ? "Email: \"No Subject\""
                : "Email: \"" + subject.substring(0, Math.min(subject.length(), SUBJECT_LENGTH)) + "...\"";
        int attachments = step.getStorage()
                .listAt("SendEmailAttachmentConfigItems", "SendEmailAttachmentConfigItem").size();
        if (attachments > 0) {
            label += " (+" + attachments + " att)";
        }
        return label;
    }

    private String query(StepContext step) {
        if (step.isBusiness()) {
            return sentences.sentence(step);
        }
        String source = switch (step.getType()) {
            case RUN_DIRECT_QUERY -> "Query: " + step.sourceTable();
            case RUN_DATASOURCE_QUERY -> ContextSentences.datasource(step);
            default -> step.sourceTable();
        };
        return source + " ➔ " + step.targetTable();
    }

    private static String fileOr(StepContext step, String fallback) {
        return orDefault(StepText.baseName(step.text("FileName")), fallback);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
