package com.processdoc.analyzer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.processdoc.analyzer.cli.exception.OptionsValidationException;
import com.processdoc.analyzer.cli.model.AnalyzeOptions;
import com.processdoc.analyzer.cli.model.ValidatedAnalyzeOptions;

public class AnalyzeOptionsValidator {

    public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
        List<String> errors = new ArrayList<>();

        Path input = null;
        if (o.getInput() == null) {
            errors.add("Input file is required (--input / -i).");
        } else {
            input = o.getInput().toAbsolutePath().normalize();
            if (!Files.isRegularFile(input)) {
                errors.add("Input file does not exist or is not a file: " + o.getInput());
            }
        }

        if (o.getMode() == null) {
            errors.add("Description mode is required (--mode / -m).");
        }
        if (o.getFormat() == null) {
            errors.add("Output format is required (--format / -f).");
        }

        Path output = null;
        if (o.getOutput() != null) {
            output = o.getOutput().toAbsolutePath().normalize();
            if (Files.isDirectory(output)) {
                errors.add("Output path is a directory: " + o.getOutput());
            } else if (Files.exists(output) && !o.isForce()) {
                errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
            }
            if (output.equals(input)) {
                errors.add("Output file must differ from the input file: " + o.getOutput());
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedAnalyzeOptions(input, output);
    }
}
