package com.processdoc.analyzer.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.cli.exception.OptionsValidationException;
import com.processdoc.analyzer.cli.model.AnalyzeOptions;
import com.processdoc.analyzer.cli.model.ValidatedAnalyzeOptions;
import com.processdoc.analyzer.cli.output.AnalyzeResultsPrinter;
import com.processdoc.analyzer.cli.validation.AnalyzeOptionsValidator;
import com.processdoc.analyzer.config.AnalyzerConfig;
import com.processdoc.analyzer.report.ReportGenerator;
import com.processdoc.analyzer.report.ReportResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that documents an ETL process from its step export.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        version = "etl-process-analyzer 1.0.0",
        description = "Reconstructs the execution tree, variable catalogue and decision tables of an ETL process."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private AnalyzeOptions options;

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalyzeResultsPrinter printer = new AnalyzeResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedAnalyzeOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            AnalyzerConfig config = AnalyzerConfig.builder()
                    .inputFile(validated.getNormalizedInput())
                    .outputFile(validated.getNormalizedOutput())
                    .mode(options.getMode())
                    .format(options.getFormat())
                    .force(options.isForce())
                    .build();

            ReportResult result = new ReportGenerator(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        } catch (Exception e) {
            log.error("Analysis failed with exception", e);
            return 1;
        }
    }
}
