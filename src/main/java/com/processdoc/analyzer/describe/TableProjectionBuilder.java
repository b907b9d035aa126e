package com.processdoc.analyzer.describe;

import java.util.List;

import com.processdoc.analyzer.engine.ProcessRegistry.ColumnOrigin;
import com.processdoc.analyzer.expression.ExpressionFlattener;
import com.processdoc.analyzer.model.TableProjection;
import com.processdoc.analyzer.model.TableProjection.TableRow;
import com.processdoc.analyzer.model.input.ParameterBag;
import com.processdoc.analyzer.util.StepText;

/**
 * Builds the tabular view of the columns, mappings or joins a step works with.
 *
 * Returns null for step types without a tabular view and for steps whose column list is empty.
 * Variable steps always get their single row.
 */
public class TableProjectionBuilder {

    static final List<String> QUERY_HEADERS = List.of("Column Name", "Source Field", "Type", "Action");
    static final List<String> FORMULA_HEADERS = List.of("Field", "Formula", "Type");
    static final List<String> VARIABLE_HEADERS = List.of("Variable", "Expression", "Type");
    static final List<String> MAPPING_HEADERS = List.of("Target Column", "Source / Value", "Type", "Origin Step");
    static final List<String> JOIN_HEADERS = List.of("Left", "Condition");
    static final List<String> COLUMN_HEADERS = List.of("Column Name", "Type");

    private static final String NO_VALUE = "-";
    private static final String DEFAULT_ACTION = "Display";

    private final ExpressionFlattener expressionFlattener;

    public TableProjectionBuilder(ExpressionFlattener expressionFlattener) {
        this.expressionFlattener = expressionFlattener;
    }

    public TableProjection build(StepContext step) {
        TableProjection.TableProjectionBuilder table = TableProjection.builder();
        switch (step.getType()) {
            case RUN_DIRECT_QUERY, RUN_TABLE_QUERY, RUN_SIMPLE_QUERY -> {
                table.headers(QUERY_HEADERS);
                step.getStorage().listAt("Columns", "ColumnItem").forEach(column -> table.row(queryRow(column)));
            }
            case ADD_COLUMN, UPDATE_COLUMN -> {
                table.headers(FORMULA_HEADERS);
                step.getStorage().listAt("Columns", "ColumnItemDef").forEach(column -> table.row(formulaRow(column)));
            }
            case SET_VARIABLE, CALCULATE_VARIABLE -> {
                String expression = step.firstText("Expression", "VariableValue");
                return table.headers(VARIABLE_HEADERS)
                        .row(TableRow.builder()
                                .cell(step.text("VariableName"))
                                .cell(expression)
                                .cell("Variable")
                                .rules(expressionFlattener.flatten(expression).orElse(null))
                                .build())
                        .build();
            }
            case IMPORT_WAREHOUSE_DATA -> {
                table.headers(MAPPING_HEADERS);
                step.getStorage().listAt("ColumnMapping", "TableColumnMapping")
                        .forEach(mapping -> table.row(mappingRow(step, mapping)));
            }
            case JOIN_TABLE -> {
                table.headers(JOIN_HEADERS);
                step.getStorage().listAt("Joins", "JoinItemDef").forEach(join -> table.row(TableRow.of(
                        join.text("JoinTable1") + "." + join.text("JoinColumn1"),
                        join.text("JoinType") + " " + join.text("JoinTable2") + "." + join.text("JoinColumn2"))));
            }
            case CREATE_TABLE -> {
                table.headers(COLUMN_HEADERS);
                ParameterBag definition = step.getRecord().getOutputTableDefinition();
                List<ParameterBag> columns = definition.listAt("Columns", "ColumnItem");
                if (columns.isEmpty()) {
                    columns = definition.get("TableDefinition").listAt("Columns", "TableColumnDefinition");
                }
                columns.forEach(column -> table.row(TableRow.of(column.text("ColumnName"), StepText.columnType(column))));
            }
            default -> {
                return null;
            }
        }
        TableProjection projection = table.build();
        return projection.hasRows() ? projection : null;
    }

    private TableRow queryRow(ParameterBag column) {
        String name = column.text("ColumnName");
        String source = column.text("ColumnSource");
        String type = column.firstText("ColumnDataType", "DataType");
        String action = column.text("ColumnActionType");
        return TableRow.of(
                name,
                !source.isBlank() ? source : !name.isBlank() ? name : NO_VALUE,
                type.isBlank() ? StepText.DEFAULT_COLUMN_TYPE : type,
                action.isBlank() ? DEFAULT_ACTION : action);
    }

    private TableRow formulaRow(ParameterBag column) {
        String expression = column.text("Expression");
        return TableRow.builder()
                .cell(column.text("ColumnName"))
                .cell(expression)
                .cell(StepText.columnType(column))
                .rules(expressionFlattener.flatten(expression).orElse(null))
                .build();
    }

    /**
     * Mapping of a warehouse column; type and origin fall back to what earlier active steps
     * declared for the mapped source column.
     */
    private TableRow mappingRow(StepContext step, ParameterBag mapping) {
        String mappedValue = mapping.text("MappedValue");
        ColumnOrigin origin = step.getRegistry()
                .findColumnOrigin(StepText.stripBrackets(mappedValue))
                .orElse(null);
        String type = mapping.firstText("ColumnDataType", "DataType", "ColumnType");
        if (type.isBlank()) {
            type = origin != null ? origin.getDataType() : StepText.DEFAULT_COLUMN_TYPE;
        }
        String originStep = origin != null && !origin.getOriginStep().isBlank() ? origin.getOriginStep() : NO_VALUE;
        return TableRow.of(mapping.text("ColumnName"), mappedValue, type, originStep);
    }
}
