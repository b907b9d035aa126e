package com.processdoc.analyzer.engine;

import com.processdoc.analyzer.engine.ProcessRegistry.ColumnOrigin;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.StepType;
import com.processdoc.analyzer.model.VariableEntry;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.parser.StepRecordReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RegistryBuilder and UsageIndexer.
 */
class RegistryBuilderTest {

    private final RegistryBuilder builder = new RegistryBuilder();

    @Test
    void testSetVariableRegistersValueAndDeclaringStep() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "SetVariable", "Name": "Set Rate",
                 "Definition": {"StorageObject": {"VariableName": "Rate", "VariableValue": "5"}}}
            ]}}
            """);

        VariableEntry rate = registry.findVariable("Rate").orElseThrow();
        assertThat(rate.getKind()).isEqualTo(VariableEntry.Kind.VARIABLE);
        assertThat(rate.getValue()).isEqualTo("5");
        assertThat(rate.getDeclaringStep()).isEqualTo("Set Rate");
    }

    @Test
    void testVariableWithoutValueIsNotAvailable() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "CalculateVariable", "Name": "Calc",
                 "Definition": {"StorageObject": {"VariableName": "Total"}}},
                {"StepId": 2, "StepType": "SetVariable", "Name": "No Name",
                 "Definition": {"StorageObject": {"VariableValue": "1"}}}
            ]}}
            """);

        assertThat(registry.getVariableNames()).containsExactly("Total");
        assertThat(registry.findVariable("Total").orElseThrow().getValue()).isEqualTo("N/A");
    }

    @Test
    void testRedefinedVariableKeepsFirstPositionAndLastValue() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "SetVariable", "Name": "First",
                 "Definition": {"StorageObject": {"VariableName": "A", "VariableValue": "1"}}},
                {"StepId": 2, "StepType": "SetVariable", "Name": "Other",
                 "Definition": {"StorageObject": {"VariableName": "B", "VariableValue": "2"}}},
                {"StepId": 3, "StepType": "CalculateVariable", "Name": "Again",
                 "Definition": {"StorageObject": {"VariableName": "A", "Expression": "A + 1"}}}
            ]}}
            """);

        assertThat(registry.getVariables()).extracting(VariableEntry::getName).containsExactly("A", "B");
        assertThat(registry.findVariable("A").orElseThrow().getValue()).isEqualTo("A + 1");
        assertThat(registry.findVariable("A").orElseThrow().getDeclaringStep()).isEqualTo("Again");
    }

    @Test
    void testLoopRegistersIterator() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": {"StepId": 1, "StepType": "Loop", "Name": "Each Region",
                "Definition": {"StorageObject": {"InputVariable": "RegionList"}}}}}
            """);

        VariableEntry iterator = registry.findVariable("RegionList").orElseThrow();
        assertThat(iterator.getKind()).isEqualTo(VariableEntry.Kind.ITERATOR);
        assertThat(iterator.getValue()).isEqualTo("Loop Condition");
    }

    @Test
    void testTableNamesSkipPlaceholdersAndBlanks() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "JoinTable", "OutputTableName": "Joined",
                 "Definition": {"StorageObject": {"JoinTable1": "Orders", "JoinTable2": " Customers ", "TableName": "dataset"}}},
                {"StepId": 2, "StepType": "CreateTable", "OutputTableDefinition": {"TableName": "Stage"},
                 "Definition": {"StorageObject": {"TableName": "target", "OutputTableName": ""}}},
                {"StepId": 3, "StepType": "PurgeTable", "Definition": {"StorageObject": {"TableToPurge": "Orders"}}}
            ]}}
            """);

        assertThat(registry.getTableNames()).containsExactly("Orders", "Customers", "Joined", "Stage");
    }

    @Test
    void testStepOutputs() {
        ProcessRegistry registry = collect("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "RunScript", "Definition": {"StorageObject": {"ResultVariable": "ScriptResult"}}},
                {"StepId": 2, "StepType": "LoadTextFile", "Definition": {"StorageObject": {"FileName": "in.csv"}}},
                {"StepId": 3, "StepType": "LoadTextFile", "Definition": {"StorageObject": {"OutputVariable": "Lines"}}}
            ]}}
            """);

        assertThat(registry.getStepOutputs()).containsExactly("ScriptResult", "DATA", "Lines");
    }

    @Test
    void testRegisterColumnsRemembersOrigins() {
        List<StepRecord> records = read("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "RunTableQuery", "Name": "Query",
                 "Definition": {"StorageObject": {"Columns": {"ColumnItem": {"ColumnName": "Amount", "ColumnSource": "AMT", "ColumnType": "Decimal"}}}}},
                {"StepId": 2, "StepType": "AddColumn", "Name": "Calc",
                 "Definition": {"StorageObject": {"Columns": {"ColumnItemDef": [{"ColumnName": "Net", "Expression": "[Amount] * 0.8"}]}}}},
                {"StepId": 3, "StepType": "CreateTable", "Name": "Create",
                 "OutputTableDefinition": {"Columns": {"ColumnItem": {"ColumnName": "Flag", "ColumnType": {"#text": "Boolean"}}}}}
            ]}}
            """);
        ProcessRegistry registry = new ProcessRegistry();
        for (StepRecord record : records) {
            builder.registerColumns(record, StepType.fromTag(record.getStepType()), registry);
        }

        assertThat(registry.findColumnOrigin("Amount")).contains(new ColumnOrigin("Decimal", "AMT", "Query"));
        assertThat(registry.findColumnOrigin("Net")).contains(new ColumnOrigin("String", "[Amount] * 0.8", "Calc"));
        assertThat(registry.findColumnOrigin("Flag")).contains(new ColumnOrigin("Boolean", "Table Definition", "Create"));
        assertThat(registry.findColumnOrigin("Missing")).isEmpty();
    }

    @Test
    void testUsagesAreSubstringMatchesInFirstSeenOrder() {
        List<StepRecord> records = read("""
            {"ArrayOfStep": {"Step": [
                {"StepId": 1, "StepType": "SetVariable", "Name": "Set Rate",
                 "Definition": {"StorageObject": {"VariableName": "Rate", "VariableValue": "5"}}},
                {"StepId": 2, "StepType": "AddColumn", "Name": "Apply",
                 "Definition": {"StorageObject": {"Columns": {"ColumnItemDef": {"ColumnName": "Net", "Expression": "Amount * Rate"}}}}},
                {"StepId": 3, "StepType": "AddColumn", "Name": "Apply",
                 "Definition": {"StorageObject": {"Columns": {"ColumnItemDef": {"ColumnName": "Gross", "Expression": "Amount / Rate"}}}}},
                {"StepId": 4, "StepType": "RunTableQuery", "Name": "Rates",
                 "Definition": {"StorageObject": {"TableName": "ExchangeRates"}}},
                {"StepId": 5, "StepType": "RunTableQuery", "Name": "Unrelated",
                 "Definition": {"StorageObject": {"TableName": "Orders"}}}
            ]}}
            """);
        ProcessRegistry registry = new ProcessRegistry();
        builder.collect(records, registry);
        new UsageIndexer().index(records, registry);

        assertThat(registry.findVariable("Rate").orElseThrow().getUsages())
                .containsExactly("Set Rate", "Apply", "Rates");
    }

    private ProcessRegistry collect(String json) {
        ProcessRegistry registry = new ProcessRegistry();
        builder.collect(read(json), registry);
        return registry;
    }

    private static List<StepRecord> read(String json) {
        return new StepRecordReader().read(json, new AnalysisDiagnostics());
    }
}
