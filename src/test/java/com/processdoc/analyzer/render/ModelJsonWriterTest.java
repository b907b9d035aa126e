package com.processdoc.analyzer.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processdoc.analyzer.engine.ProcessAnalyzer;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.DescriptionMode;
import com.processdoc.analyzer.model.ExecutionModel;
import com.processdoc.analyzer.parser.StepRecordReader;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelJsonWriter.
 */
class ModelJsonWriterTest {

    private static final String PROCESS = """
        {"ArrayOfStep": {"Step": [
            {"StepId": 1, "Sequence": "1", "Name": "Each Region", "StepType": "Loop",
             "Definition": {"StorageObject": {"InputVariable": "Regions"}}},
            {"StepId": 2, "ParentStepId": 1, "Sequence": "1", "Name": "Save", "StepType": "ImportWarehouseData",
             "Definition": {"StorageObject": {"TableName": "Sales", "ImportOption": "I"}}}
        ]}}
        """;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSerializesTreeVariablesAndSets() throws Exception {
        JsonNode json = mapper.readTree(new ModelJsonWriter().toJson(analyze()));

        assertThat(json.get("mode").asText()).isEqualTo("TECHNICAL");
        JsonNode loop = json.get("executionTree").get(0);
        assertThat(loop.get("name").asText()).isEqualTo("Each Region");
        assertThat(loop.get("output").get("kind").asText()).isEqualTo("ITERATOR");
        assertThat(loop.get("children").get(0).get("details").get(0).asText()).isEqualTo("Mode: Insert Only");
        assertThat(json.get("executionFlow")).hasSize(2);
        assertThat(json.get("variables").get(0).get("kind").asText()).isEqualTo("ITERATOR");
        assertThat(json.get("tableSet").get(0).asText()).isEqualTo("Sales");
    }

    @Test
    void testOmitsNullFields() throws Exception {
        JsonNode save = mapper.readTree(new ModelJsonWriter().toJson(analyze()))
                .get("executionTree").get(0).get("children").get(0);

        assertThat(save.has("rules")).isFalse();
        assertThat(save.has("table")).isFalse();
        assertThat(save.has("output")).isTrue();
    }

    private static ExecutionModel analyze() {
        return new ProcessAnalyzer().analyze(
                new StepRecordReader().read(PROCESS, new AnalysisDiagnostics()), DescriptionMode.TECHNICAL);
    }
}
