package com.processdoc.analyzer.describe;

import java.util.ArrayList;
import java.util.List;

import com.processdoc.analyzer.engine.RegistryBuilder;
import com.processdoc.analyzer.model.OutputDescriptor;
import com.processdoc.analyzer.model.OutputDescriptor.OutputKind;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.util.StepText;

/**
 * Resolves the tables and variables a step reads and writes.
 */
public class StepIoResolver {

    static final List<String> INPUT_FIELDS = List.of(
            "InputTableName", "JoinTable1", "JoinTable2", "FilterTableName", "ExportMemoryTableName", "InputVariable");

    static final List<String> OUTPUT_FIELDS = List.of(
            "OutputTableName", "AppendToTableName", "VariableName", "OutputVariable", "ResultVariable", "MemoryTableName");

    public List<String> inputs(StepContext step) {
        List<String> inputs = new ArrayList<>();
        for (String field : INPUT_FIELDS) {
            StepText.addName(inputs, step.text(field));
        }
        // TableName is what a step reads unless the step creates it or defines a variable
        if (step.getType() != StepType.CREATE_TABLE && !step.getType().isVariableDefinition()) {
            StepText.addName(inputs, step.text("TableName"));
        }
        return inputs;
    }

    public List<String> outputs(StepContext step) {
        List<String> outputs = new ArrayList<>();
        for (String field : OUTPUT_FIELDS) {
            StepText.addName(outputs, step.text(field));
        }
        if (step.getType() == StepType.LOAD_TEXT_FILE && outputs.isEmpty()) {
            outputs.add(RegistryBuilder.TEXT_FILE_OUTPUT);
        }
        if (step.getType() == StepType.CREATE_TABLE) {
            StepText.addName(outputs, step.text("TableName"));
        }
        return outputs;
    }

    /**
     * The one thing the step is known to produce, or null for types without an explicit output.
     */
    public OutputDescriptor explicitOutput(StepContext step) {
        String target = step.firstText("OutputTableName", "TableName", "VariableName");
        return switch (step.getType()) {
            case IMPORT_WAREHOUSE_DATA -> new OutputDescriptor(OutputKind.WAREHOUSE, target);
            case JOIN_TABLE, CREATE_TABLE -> new OutputDescriptor(OutputKind.TABLE, target);
            case APPEND_TABLE -> new OutputDescriptor(OutputKind.TABLE, step.text("AppendToTableName"));
            case SET_VARIABLE, CALCULATE_VARIABLE -> new OutputDescriptor(OutputKind.VAR, target);
            case LOOP -> new OutputDescriptor(OutputKind.ITERATOR, step.text("InputVariable"));
            default -> null;
        };
    }
}
