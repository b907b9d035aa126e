package com.processdoc.analyzer.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.model.VariableEntry;
import com.processdoc.analyzer.model.input.StepRecord;

/**
 * Cross-references every step's parameters against the registered variable names.
 *
 * Matching is plain substring containment on the serialized parameters, so a variable whose
 * name is part of a longer token is reported as used there too.
 */
public class UsageIndexer {
    private static final Logger log = LoggerFactory.getLogger(UsageIndexer.class);

    public void index(List<StepRecord> records, ProcessRegistry registry) {
        List<VariableEntry> variables = registry.getVariables();
        if (variables.isEmpty()) {
            return;
        }
        for (StepRecord record : records) {
            String text = record.getStorage().flatText();
            if (text.isEmpty()) {
                continue;
            }
            for (VariableEntry variable : variables) {
                if (text.contains(variable.getName())) {
                    variable.addUsage(record.getDisplayName());
                    log.debug("Variable {} referenced by step '{}'", variable.getName(), record.getDisplayName());
                }
            }
        }
    }
}
