package com.processdoc.analyzer.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.input.ParameterBag;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.parser.exception.StepContainerException;

/**
 * Reads the object form of a step export ({@code {"ArrayOfStep": {"Step": ...}}}) into step
 * records.
 *
 * The XML decoding itself happens upstream; this reader only normalizes its output: a single
 * step object becomes a one-element list, the step definition's storage object becomes the
 * step's parameter bag, and scalar fields are read as text whatever their JSON type.
 */
public class StepRecordReader {
    private static final Logger log = LoggerFactory.getLogger(StepRecordReader.class);

    public static final String CONTAINER_FIELD = "ArrayOfStep";
    public static final String STEP_FIELD = "Step";

    private final ObjectMapper mapper;

    public StepRecordReader() {
        this(new ObjectMapper());
    }

    public StepRecordReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<StepRecord> read(Path file, AnalysisDiagnostics diagnostics) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(mapper.readTree(in), diagnostics);
        } catch (IOException e) {
            throw new StepContainerException("Failed to read step export: " + file, e);
        }
    }

    public List<StepRecord> read(String json, AnalysisDiagnostics diagnostics) {
        try {
            return read(mapper.readTree(json), diagnostics);
        } catch (IOException e) {
            throw new StepContainerException("Step export is not valid JSON: " + e.getMessage(), e);
        }
    }

    public List<StepRecord> read(JsonNode root, AnalysisDiagnostics diagnostics) {
        if (root == null || !root.hasNonNull(CONTAINER_FIELD)) {
            throw new StepContainerException("Step export has no " + CONTAINER_FIELD + " container");
        }
        JsonNode container = root.get(CONTAINER_FIELD);
        if (!container.has(STEP_FIELD)) {
            throw new StepContainerException(CONTAINER_FIELD + " has no " + STEP_FIELD + " list");
        }

        List<StepRecord> records = new ArrayList<>();
        for (ParameterBag step : ParameterBag.of(container.get(STEP_FIELD)).asList()) {
            records.add(toRecord(step, diagnostics));
        }
        log.debug("Read {} step records", records.size());
        return records;
    }

    private StepRecord toRecord(ParameterBag step, AnalysisDiagnostics diagnostics) {
        ParameterBag definition = step.get("Definition");
        if (definition.isScalar() && !definition.asText().isBlank()) {
            String message = "Step " + step.text("StepId") + " carries an undecoded definition; its parameters are ignored";
            log.warn(message);
            diagnostics.warn(message);
        }

        return StepRecord.builder()
                .stepId(step.text("StepId").trim())
                .parentStepId(step.text("ParentStepId").trim())
                .stepType(step.text("StepType").trim())
                .sequence(step.text("Sequence").trim())
                .active(readActiveFlag(step.get("IsActive")))
                .name(step.text("Name"))
                .description(step.text("Description"))
                .narration(step.text("Narration"))
                .comments(step.text("Comments"))
                .outputTableName(step.text("OutputTableName"))
                .storage(definition.get("StorageObject"))
                .outputTableDefinition(step.get("OutputTableDefinition"))
                .build();
    }

    /**
     * Absent flags mean active; only an explicit false (boolean or text) disables a step.
     */
    static boolean readActiveFlag(ParameterBag flag) {
        if (!flag.isPresent()) {
            return true;
        }
        String value = flag.asText().trim().toLowerCase(Locale.ROOT);
        return !value.equals("false");
    }
}
