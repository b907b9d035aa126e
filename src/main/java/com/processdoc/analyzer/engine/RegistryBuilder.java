package com.processdoc.analyzer.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.engine.ProcessRegistry.ColumnOrigin;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.VariableEntry;
import com.processdoc.analyzer.model.input.ParameterBag;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.util.StepText;

/**
 * Collects table names, variables, iterators and step outputs from the flat step list, and
 * column origins while the tree is walked.
 *
 * Malformed or missing fields are skipped; nothing here fails.
 */
public class RegistryBuilder {
    private static final Logger log = LoggerFactory.getLogger(RegistryBuilder.class);

    static final List<String> TABLE_FIELDS = List.of(
            "TableName", "InputTableName", "OutputTableName",
            "JoinTable1", "JoinTable2", "AppendToTableName",
            "ExportMemoryTableName", "MemoryTableName",
            "FilterTableName", "TableToPurge");

    static final List<String> OUTPUT_FIELDS = List.of("OutputVariable", "ResultVariable");

    public static final String TEXT_FILE_OUTPUT = "DATA";

    /**
     * Single forward pass over every record, in input order.
     */
    public void collect(List<StepRecord> records, ProcessRegistry registry) {
        for (StepRecord record : records) {
            collect(record, registry);
        }
        log.debug("Registry holds {} tables, {} variables, {} step outputs",
                registry.getTableNames().size(), registry.getVariableNames().size(), registry.getStepOutputs().size());
    }

    private void collect(StepRecord record, ProcessRegistry registry) {
        StepType type = StepType.fromTag(record.getStepType());
        ParameterBag storage = record.getStorage();

        for (String field : TABLE_FIELDS) {
            addTable(storage.text(field), registry);
        }
        addTable(record.getOutputTableName(), registry);
        addTable(record.getOutputTableDefinition().text("TableName"), registry);

        if (type.isVariableDefinition()) {
            String name = storage.text("VariableName").trim();
            if (!name.isEmpty()) {
                String value = storage.firstText("VariableValue", "Expression");
                registry.putVariable(new VariableEntry(name, VariableEntry.Kind.VARIABLE, value, record.getDisplayName()));
            }
        }

        for (String field : OUTPUT_FIELDS) {
            String output = storage.text(field).trim();
            if (!output.isEmpty()) {
                registry.addStepOutput(output);
            }
        }

        if (type == StepType.LOAD_TEXT_FILE && !hasAnyText(storage, OUTPUT_FIELDS)) {
            registry.addStepOutput(TEXT_FILE_OUTPUT);
        }

        if (type == StepType.LOOP) {
            String iterator = storage.text("InputVariable").trim();
            if (!iterator.isEmpty()) {
                registry.putVariable(new VariableEntry(iterator, VariableEntry.Kind.ITERATOR,
                        VariableEntry.LOOP_CONDITION, record.getDisplayName()));
            }
        }
    }

    /**
     * Remembers the columns an active step defines so later mappings can name their origin.
     */
    public void registerColumns(StepRecord record, StepType type, ProcessRegistry registry) {
        ParameterBag storage = record.getStorage();
        String stepName = record.getDisplayName();
        if (type == StepType.RUN_DIRECT_QUERY || type == StepType.RUN_TABLE_QUERY) {
            for (ParameterBag column : storage.listAt("Columns", "ColumnItem")) {
                register(column, column.text("ColumnSource"), stepName, registry);
            }
        } else if (type == StepType.ADD_COLUMN || type == StepType.UPDATE_COLUMN) {
            for (ParameterBag column : storage.listAt("Columns", "ColumnItemDef")) {
                register(column, column.text("Expression"), stepName, registry);
            }
        } else if (type == StepType.CREATE_TABLE) {
            for (ParameterBag column : record.getOutputTableDefinition().listAt("Columns", "ColumnItem")) {
                register(column, "Table Definition", stepName, registry);
            }
        }
    }

    private void register(ParameterBag column, String source, String stepName, ProcessRegistry registry) {
        String name = column.text("ColumnName");
        if (name.isBlank()) {
            return;
        }
        registry.putColumnOrigin(name, new ColumnOrigin(StepText.columnType(column), source, stepName));
    }

    private static void addTable(String name, ProcessRegistry registry) {
        if (StepText.isMeaningfulName(name)) {
            registry.addTable(name.trim());
        }
    }

    private static boolean hasAnyText(ParameterBag storage, List<String> fields) {
        return fields.stream().anyMatch(storage::hasText);
    }
}
