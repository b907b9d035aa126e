package com.processdoc.analyzer.report;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.config.AnalyzerConfig;
import com.processdoc.analyzer.engine.ExecutionTreeQueries;
import com.processdoc.analyzer.engine.ProcessAnalyzer;
import com.processdoc.analyzer.engine.exception.StepCycleException;
import com.processdoc.analyzer.model.AnalysisDiagnostics;
import com.processdoc.analyzer.model.ExecutionModel;
import com.processdoc.analyzer.model.input.StepRecord;
import com.processdoc.analyzer.parser.StepRecordReader;
import com.processdoc.analyzer.parser.exception.StepContainerException;
import com.processdoc.analyzer.render.MermaidFlowRenderer;
import com.processdoc.analyzer.render.ModelJsonWriter;
import com.processdoc.analyzer.render.OutlineRenderer;

/**
 * Reads a step export, analyzes it and writes the result in the configured format.
 */
public class ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private final AnalyzerConfig config;
    private final StepRecordReader reader;
    private final ProcessAnalyzer analyzer;
    private final ExecutionTreeQueries queries;
    private final PrintStream standardOutput;

    public ReportGenerator(AnalyzerConfig config) {
        this(config, System.out);
    }

    public ReportGenerator(AnalyzerConfig config, PrintStream standardOutput) {
        this.config = config;
        this.reader = new StepRecordReader();
        this.analyzer = new ProcessAnalyzer();
        this.queries = new ExecutionTreeQueries();
        this.standardOutput = standardOutput;
    }

    public ReportResult generate() {
        AnalysisDiagnostics diagnostics = new AnalysisDiagnostics();
        try {
            log.info("Step 1: Reading steps from {}", config.getInputFile());
            List<StepRecord> records = reader.read(config.getInputFile(), diagnostics);

            log.info("Step 2: Analyzing {} steps ({} mode)", records.size(), config.getMode());
            ExecutionModel model = analyzer.analyze(records, config.getMode(), diagnostics);

            log.info("Step 3: Writing {} output", config.getFormat());
            write(model);

            return ReportResult.builder()
                    .success(true)
                    .outputPath(config.getOutputFile())
                    .stepsRead(records.size())
                    .nodesDescribed(queries.countNodes(model.getExecutionTree()))
                    .variableCount(model.getVariables().size())
                    .tableCount(model.getTableSet().size())
                    .stepOutputCount(model.getStepOutputSet().size())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .build();
        } catch (StepContainerException | StepCycleException e) {
            return ReportResult.failure(e.getMessage());
        } catch (IOException e) {
            log.debug("Writing output failed", e);
            return ReportResult.failure("Could not write output: " + e.getMessage());
        }
    }

    private void write(ExecutionModel model) throws IOException {
        if (config.writesToStandardOutput()) {
            Writer writer = new OutputStreamWriter(standardOutput, StandardCharsets.UTF_8);
            render(model, writer);
            writer.flush();
            return;
        }
        Path output = config.getOutputFile();
        if (Files.exists(output) && !config.isForce()) {
            throw new IOException("Output file already exists: " + output);
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            render(model, writer);
        }
    }

    private void render(ExecutionModel model, Writer writer) throws IOException {
        switch (config.getFormat()) {
            case OUTLINE -> new OutlineRenderer().render(model, writer);
            case JSON -> new ModelJsonWriter().write(model, writer);
            case MERMAID -> new MermaidFlowRenderer().render(model, writer);
        }
    }
}
