package com.processdoc.analyzer.engine;

import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.DescriptionMode;
import com.processdoc.analyzer.model.ExecutionModel;
import com.processdoc.analyzer.model.ExecutionNode;
import com.processdoc.analyzer.model.VariableEntry;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.parser.StepRecordReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProcessAnalyzer.
 */
class ProcessAnalyzerTest {

    private static final String PROCESS = """
        {"ArrayOfStep": {"Step": [
            {"StepId": 20, "ParentStepId": 10, "Sequence": "2", "StepType": "AddColumn", "Name": "Apply Rate",
             "Definition": {"StorageObject": {"TableName": "Orders",
                 "Columns": {"ColumnItemDef": {"ColumnName": "Net", "Expression": "Amount * Rate"}}}}},
            {"StepId": 10, "ParentStepId": 0, "Sequence": "1", "StepType": "Group", "Name": "Prepare"},
            {"StepId": 11, "ParentStepId": 10, "Sequence": "1", "StepType": "SetVariable", "Name": "Set Rate",
             "Definition": {"StorageObject": {"VariableName": "Rate", "VariableValue": "0.8"}}},
            {"StepId": 12, "ParentStepId": 10, "Sequence": "3", "StepType": "PurgeTable", "Name": "Purge Stage",
             "Definition": {"StorageObject": {"TableToPurge": "Stage"}}},
            {"StepId": 13, "ParentStepId": 10, "StepType": "RunTableQuery", "Name": "Late Query", "IsActive": "false",
             "Definition": {"StorageObject": {"TableName": "Orders"}}},
            {"StepId": 30, "ParentStepId": 0, "Sequence": "2", "StepType": "Loop", "Name": "Each Region", "IsActive": false,
             "Definition": {"StorageObject": {"InputVariable": "Regions"}}},
            {"StepId": 31, "ParentStepId": 30, "Sequence": "1", "StepType": "ImportWarehouseData", "Name": "Save",
             "Definition": {"StorageObject": {"TableName": "Sales"}}},
            {"StepId": 40, "ParentStepId": 99, "Sequence": "3", "StepType": "Mystery", "Name": "Orphan"}
        ]}}
        """;

    private final ProcessAnalyzer analyzer = new ProcessAnalyzer();
    private final ExecutionTreeQueries queries = new ExecutionTreeQueries();

    @Test
    void testTechnicalModeKeepsEveryStep() {
        List<StepRecord> records = read(PROCESS);
        ExecutionModel model = analyzer.analyze(records, DescriptionMode.TECHNICAL);

        assertThat(queries.countNodes(model.getExecutionTree())).isEqualTo(records.size());
        assertThat(model.getExecutionFlow()).hasSize(records.size());
        assertThat(model.getMode()).isEqualTo(DescriptionMode.TECHNICAL);
    }

    @Test
    void testTreeIsNestedAndOrderedBySequence() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.TECHNICAL);

        assertThat(model.getExecutionTree()).extracting(ExecutionNode::getName)
                .containsExactly("Prepare", "Each Region", "Orphan");
        ExecutionNode prepare = model.getExecutionTree().get(0);
        assertThat(prepare.getChildren()).extracting(ExecutionNode::getName)
                .containsExactly("Set Rate", "Apply Rate", "Purge Stage", "Late Query");
        assertThat(prepare.getChildren()).extracting(ExecutionNode::getDepth).containsOnly(1);
    }

    @Test
    void testFlowIsDepthFirstAndSharesNodesWithTree() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.TECHNICAL);

        assertThat(model.getExecutionFlow()).extracting(ExecutionNode::getName).containsExactly(
                "Prepare", "Set Rate", "Apply Rate", "Purge Stage", "Late Query", "Each Region", "Save", "Orphan");
        assertThat(model.getExecutionFlow().get(1)).isSameAs(model.getExecutionTree().get(0).getChildren().get(0));
    }

    @Test
    void testBusinessModeDropsHousekeepingAndInactiveSteps() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.BUSINESS);

        assertThat(model.getExecutionFlow()).extracting(ExecutionNode::getName).containsExactly(
                "Prepare", "Set Rate", "Apply Rate", "Each Region", "Save", "Orphan");
        ExecutionNode loop = queries.findByName(model.getExecutionTree(), "Each Region").orElseThrow();
        assertThat(loop.isActive()).isFalse();
        assertThat(loop.getPhase()).isEqualTo("Loop [DISABLED]");
    }

    @Test
    void testDroppedStepTakesItsSubtree() {
        ExecutionModel model = analyzer.analyze(read("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "CreateTable", "Name": "Create"},
                {"StepId": 2, "ParentStepId": 1, "StepType": "RunTableQuery", "Name": "Nested"}
            ]}}
            """), DescriptionMode.BUSINESS);

        assertThat(model.getExecutionTree()).isEmpty();
        assertThat(model.getExecutionFlow()).isEmpty();
    }

    @Test
    void testRegistryContentsAreReturned() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.TECHNICAL);

        assertThat(model.getVariableSet()).containsExactly("Rate", "Regions");
        VariableEntry rate = model.getVariables().get(0);
        assertThat(rate.getName()).isEqualTo("Rate");
        assertThat(rate.getValue()).isEqualTo("0.8");
        assertThat(rate.getUsages()).containsExactly("Apply Rate", "Set Rate");
        assertThat(model.getTableSet()).containsExactly("Orders", "Stage", "Sales");
        assertThat(model.getVariables()).extracting(VariableEntry::getKind)
                .containsExactly(VariableEntry.Kind.VARIABLE, VariableEntry.Kind.ITERATOR);
    }

    @Test
    void testOrphanIsReportedAndUnknownTypeKeepsRawTag() {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.TECHNICAL, diagnostics);

        ExecutionNode orphan = queries.findByStepId(model.getExecutionTree(), "40").orElseThrow();
        assertThat(orphan.getDepth()).isZero();
        assertThat(orphan.getRawType()).isEqualTo("Mystery");
        assertThat(orphan.getContext()).isEqualTo("Mystery");
        assertThat(model.getDiagnostics()).isSameAs(diagnostics);
        assertThat(diagnostics.getInfos()).hasSize(1);
    }

    @Test
    void testAnalysisIsRepeatable() {
        List<StepRecord> records = read(PROCESS);

        ExecutionModel first = analyzer.analyze(records, DescriptionMode.TECHNICAL);
        ExecutionModel second = analyzer.analyze(records, DescriptionMode.TECHNICAL);

        assertThat(second).isEqualTo(first);
        assertThat(second.getExecutionTree()).isEqualTo(first.getExecutionTree());
    }

    @Test
    void testNullModeMeansTechnical() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), null);

        assertThat(model.getMode()).isEqualTo(DescriptionMode.TECHNICAL);
        assertThat(model.getExecutionFlow()).hasSize(8);
    }

    @Test
    void testReturnedCollectionsAreReadOnly() {
        ExecutionModel model = analyzer.analyze(read(PROCESS), DescriptionMode.TECHNICAL);

        assertThatThrownBy(() -> model.getExecutionTree().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> model.getTableSet().add("X")).isInstanceOf(UnsupportedOperationException.class);
    }

    private static List<StepRecord> read(String json) {
        return new StepRecordReader().read(json, new AnalysisDiagnostics());
    }
}
