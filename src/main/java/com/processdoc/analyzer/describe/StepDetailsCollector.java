package com.processdoc.analyzer.describe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.processdoc.analyzer.expression.CriteriaFlattener;
import com.processdoc.analyzer.model.DataDictionaryEntry;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.input.ParameterBag;
import com.processdoc.analyzer.util.StepText;

/**
 * Collects the free-form detail lines, filters, exists-logic and data dictionary of a step.
 */
public class StepDetailsCollector {

    static final Map<String, String> IMPORT_MODES = Map.of(
            "IU", "Insert or Update",
            "I", "Insert Only",
            "U", "Update Only",
            "D", "Delete",
            "R", "Replace");

    static final int LONG_CONDITION = 50;

    private final CriteriaFlattener criteriaFlattener;

    public StepDetailsCollector(CriteriaFlattener criteriaFlattener) {
        this.criteriaFlattener = criteriaFlattener;
    }

    /**
     * Detail lines in display order. Criteria are appended last as {@code Filter: ...} lines.
     */
    public List<String> details(StepContext step, List<String> filters) {
        List<String> details = new ArrayList<>();
        ParameterBag storage = step.getStorage();

        addIfPresent(details, "Join Type: ", step.text("JoinType"));

        List<ParameterBag> sortColumns = storage.listAt("SortColumns", "SortColumnItem");
        if (!sortColumns.isEmpty()) {
            details.add("Sort Order: " + sortColumns.stream()
                    .map(column -> column.text("ColumnName"))
                    .collect(Collectors.joining(", ")));
        }

        addTypeDetails(step, details);

        addIfPresent(details, "Extended Criteria: ", step.text("ExtendedWhere"));

        if (step.getType() == StepType.IMPORT_WAREHOUSE_DATA) {
            String code = step.text("ImportOption").trim();
            addIfPresent(details, "Mode: ", IMPORT_MODES.getOrDefault(code, code));
        }

        for (String filter : filters) {
            details.add("Filter: " + filter);
        }
        return details;
    }

    private void addTypeDetails(StepContext step, List<String> details) {
        ParameterBag storage = step.getStorage();
        switch (step.getType()) {
            case RUN_DIRECT_QUERY, RUN_TABLE_QUERY -> details.add("Source Table: " + step.sourceTable());
            case RUN_DATASOURCE_QUERY, RUN_SIMPLE_QUERY -> {
                details.add("Source: " + ContextSentences.datasource(step));
                for (ParameterBag parameter : storage.listAt("DataSourceParameters", "DataSourceParameterItem")) {
                    details.add("Param: " + parameter.text("DataSourceParameterName")
                            + " = " + parameter.text("DataSourceParameterValue"));
                }
            }
            case SEND_EMAIL -> {
                details.add("Subject: " + step.text("SubjectLine"));
                details.add("To: " + step.text("SendTo"));
                for (ParameterBag attachment : storage.listAt("SendEmailAttachmentConfigItems",
                        "SendEmailAttachmentConfigItem")) {
                    details.add("Attachment: " + attachment.text("FileMask"));
                }
            }
            case EXPORT_TO_EXCEL -> {
                String file = step.text("FileName");
                if (!file.isBlank()) {
                    String location = step.text("FileLocation");
                    details.add("File: " + file + (location.isBlank() ? "" : " (" + location + ")"));
                }
                addIfPresent(details, "Sheet: ", step.text("SheetName"));
                if ("true".equalsIgnoreCase(step.text("UpdateExistingSheet").trim())) {
                    details.add("Mode: Append to Sheet");
                }
            }
            case LOAD_TEXT_FILE -> {
                addIfPresent(details, "File: ", step.text("FileName"));
                addIfPresent(details, "Encoding: ", step.text("FileEncoding"));
                addIfPresent(details, "Start When: ", step.text("StartCondition"));
                addIfPresent(details, "Stop When: ", step.text("StopCondition"));
            }
            case SAVE_TEXT, SAVE_TEXT_FILE, DELETE_FILE -> addIfPresent(details, "File: ", step.text("FileName"));
            case COPY_FILE -> {
                addIfPresent(details, "From: ", step.firstText("SourceFileName", "FileName"));
                addIfPresent(details, "To: ", step.text("DestinationFileName"));
            }
            case RUN_SQL_STATEMENT -> {
                addIfPresent(details, "Source: ", step.text("DatasourceName"));
                addPreview(step, details, "SQL: ", step.firstText("SqlStatement", "SqlText", "Sql"));
            }
            case RUN_SCRIPT -> {
                addIfPresent(details, "Language: ", step.text("ScriptLanguage"));
                addPreview(step, details, "Script: ", step.firstText("Script", "ScriptText"));
            }
            case RUN_PROCESS -> addIfPresent(details, "Process: ", step.text("ProcessName"));
            case BRANCH -> {
                String expression = step.text("Expression");
                if (expression.length() > LONG_CONDITION) {
                    details.add("Full Condition: " + expression);
                }
            }
            case DECISION -> addIfPresent(details, "Input: ", step.text("InputTableName"));
            default -> {
            }
        }
    }

    // technical mode only
    private void addPreview(StepContext step, List<String> details, String label, String code) {
        if (!step.isBusiness() && !code.isBlank()) {
            details.add(label + StepText.truncate(code, StepText.PREVIEW_LENGTH));
        }
    }

    public List<String> filters(StepContext step) {
        return criteriaFlattener.flatten(step.getStorage());
    }

    /**
     * {@code [NOT ]EXISTS IN <table> WHERE <field> = <column> AND ...} for every exists filter.
     */
    public List<String> existsLogic(StepContext step) {
        List<String> logic = new ArrayList<>();
        for (ParameterBag filter : step.getStorage().listAt("ExistsFilters", "ExistsFilterItem")) {
            String negation = "true".equalsIgnoreCase(filter.text("NotExistsFlag").trim()) ? "NOT " : "";
            String links = filter.listAt("Links", "ExistsFilterItemLink").stream()
                    .map(link -> link.text("FieldName") + " = " + link.text("ColumnName"))
                    .collect(Collectors.joining(" AND "));
            logic.add(negation + "EXISTS IN " + filter.text("FilterTableName") + " WHERE " + links);
        }
        return logic;
    }

    /**
     * Dynamic fields of the step, or failing those the columns of its output table definition.
     */
    public List<DataDictionaryEntry> dataDictionary(StepContext step) {
        List<ParameterBag> fields = step.getStorage().listAt("DynamicFields", "Field");
        if (fields.isEmpty()) {
            fields = step.getRecord().getOutputTableDefinition().listAt("Columns", "ColumnItem");
        }
        List<DataDictionaryEntry> entries = new ArrayList<>();
        for (ParameterBag field : fields) {
            ParameterBag definition = field.get("FieldDef").get("ValueObjectFieldDefinitionOfString");
            if (!definition.isPresent()) {
                definition = field;
            }
            String type = definition.firstText("FieldType", "ColumnType");
            entries.add(DataDictionaryEntry.builder()
                    .name(field.firstText("@_Name", "ColumnName"))
                    .type(type.isBlank() ? StepText.DEFAULT_COLUMN_TYPE : type)
                    .length(definition.text("MaxLength"))
                    .description(field.get("Description").text("string"))
                    .build());
        }
        return entries;
    }

    private static void addIfPresent(List<String> details, String label, String value) {
        if (value != null && !value.isBlank()) {
            details.add(label + value);
        }
    }
}
