package com.processdoc.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.processdoc.analyzer.model.VariableEntry;

import lombok.Getter;
import lombok.Value;

/**
 * Names discovered while analyzing one process: variables, tables, ad-hoc step outputs and
 * column origins. Built fresh for every analysis run and never shared between runs.
 */
public class ProcessRegistry {

    private final Map<String, VariableEntry> variables = new LinkedHashMap<>();
    @Getter
    private final Set<String> tableNames = new LinkedHashSet<>();
    @Getter
    private final Set<String> stepOutputs = new LinkedHashSet<>();
    private final Map<String, ColumnOrigin> columnOrigins = new HashMap<>();

    /**
     * Registers a variable, replacing an earlier definition of the same name in place.
     */
    public void putVariable(VariableEntry entry) {
        variables.put(entry.getName(), entry);
    }

    public Optional<VariableEntry> findVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public List<VariableEntry> getVariables() {
        return new ArrayList<>(variables.values());
    }

    public Set<String> getVariableNames() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public void addTable(String name) {
        tableNames.add(name);
    }

    public void addStepOutput(String name) {
        stepOutputs.add(name);
    }

    public void putColumnOrigin(String column, ColumnOrigin origin) {
        columnOrigins.put(column, origin);
    }

    public Optional<ColumnOrigin> findColumnOrigin(String column) {
        return Optional.ofNullable(columnOrigins.get(column));
    }

    /**
     * Where a column was last defined: its data type, the expression or source field it came
     * from, and the step that defined it.
     */
    @Value
    public static class ColumnOrigin {
        String dataType;
        String source;
        String originStep;
    }
}
