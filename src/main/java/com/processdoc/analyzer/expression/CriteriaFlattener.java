package com.processdoc.analyzer.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.processdoc.analyzer.model.input.ParameterBag;

/**
 * Flattens filter criteria into an itemized list of predicates such as
 * {@code Status = A} or {@code Amount BETWEEN 1 AND 10}.
 *
 * Criteria may be grouped into nested criteria sets. Groups are walked depth first, each
 * group's own predicates before its subgroups. The AND/OR connectives between predicates and
 * groups are not reproduced.
 */
public class CriteriaFlattener {

    /**
     * Storage fields that may hold criteria, in reading order.
     */
    public static final List<String> HOLDER_FIELDS = List.of(
            "Criteria", "WarehouseCriteria", "SourceCriteria", "FilterCriteria");

    private static final List<String> GROUP_FIELDS = List.of("CriteriaSet", "CriteriaSetItem");

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("EQ", "="),
            Map.entry("EQUAL", "="),
            Map.entry("EQUALS", "="),
            Map.entry("NE", "<>"),
            Map.entry("NOTEQUAL", "<>"),
            Map.entry("GREATERTHAN", ">"),
            Map.entry("GREATERTHANOREQUAL", ">="),
            Map.entry("GREATERTHANOREQUALTO", ">="),
            Map.entry("LESSTHAN", "<"),
            Map.entry("LESSTHANOREQUAL", "<="),
            Map.entry("LESSTHANOREQUALTO", "<="),
            Map.entry("GT", ">"),
            Map.entry("GE", ">="),
            Map.entry("LT", "<"),
            Map.entry("LE", "<="),
            Map.entry("LK", "LIKE"),
            Map.entry("LIKE", "LIKE"),
            Map.entry("NL", "NOT LIKE"),
            Map.entry("NOTLIKE", "NOT LIKE"),
            Map.entry("IN", "IN"),
            Map.entry("NI", "NOT IN"),
            Map.entry("NOTIN", "NOT IN"),
            Map.entry("BT", "BETWEEN"),
            Map.entry("BETWEEN", "BETWEEN"),
            Map.entry("NU", "IS NULL"),
            Map.entry("ISNULL", "IS NULL"),
            Map.entry("NN", "IS NOT NULL"),
            Map.entry("ISNOTNULL", "IS NOT NULL"));

    private static final String BETWEEN = "BETWEEN";
    private static final String MISSING_VALUE = "?";
    private static final Pattern PASCAL_CASE = Pattern.compile("(?:[A-Z][a-z0-9]+)+");

    /**
     * Predicates of every criteria holder on the storage object.
     */
    public List<String> flatten(ParameterBag storage) {
        List<String> predicates = new ArrayList<>();
        for (String field : HOLDER_FIELDS) {
            predicates.addAll(flattenHolder(storage.get(field)));
        }
        return predicates;
    }

    /**
     * Predicates of a single criteria holder.
     */
    public List<String> flattenHolder(ParameterBag holder) {
        List<String> predicates = new ArrayList<>();
        if (!holder.isPresent()) {
            return predicates;
        }
        if (holder.isScalar()) {
            addIfNotBlank(predicates, holder.asText());
            return predicates;
        }

        collectValues(holder, predicates);
        for (String groupField : GROUP_FIELDS) {
            for (ParameterBag group : holder.list(groupField)) {
                collectGroup(group, predicates);
            }
        }
        return predicates;
    }

    private void collectGroup(ParameterBag group, List<String> predicates) {
        collectValues(group, predicates);
        // a CriteriaSet element may just wrap its CriteriaSetItem groups
        for (ParameterBag subgroup : group.list("CriteriaSetItem")) {
            collectGroup(subgroup, predicates);
        }
        for (ParameterBag subgroup : group.listAt("CriteriaSets", "CriteriaSetItem")) {
            collectGroup(subgroup, predicates);
        }
        for (ParameterBag subgroup : group.listAt("NestedSets", "CriteriaSetItem")) {
            collectGroup(subgroup, predicates);
        }
        for (ParameterBag subgroup : group.listAt("SubGroups", "CriteriaSetItem")) {
            collectGroup(subgroup, predicates);
        }
    }

    private void collectValues(ParameterBag owner, List<String> predicates) {
        ParameterBag values = owner.get("CriteriaValues");
        if (values.isScalar()) {
            addIfNotBlank(predicates, values.asText());
            return;
        }
        for (ParameterBag value : values.list("CriteriaValue")) {
            predicates.add(describe(value));
        }
    }

    /**
     * {@code <column> <operator> <value1>}, plus {@code AND <value2>} for ranges.
     */
    public String describe(ParameterBag criterion) {
        String column = criterion.firstText("ColumnId", "ColumnName");
        ParameterBag operatorField = criterion.get("Operator");
        String operatorCode = operatorField.isScalar() ? operatorField.asText() : operatorField.text("Value");
        String operator = humanizeOperator(operatorCode);

        StringBuilder predicate = new StringBuilder(column).append(' ').append(operator);
        String first = criterion.text("Value1");
        if (BETWEEN.equals(operator)) {
            predicate.append(' ').append(orMissing(first))
                    .append(" AND ").append(orMissing(criterion.text("Value2")));
        } else if (!first.isBlank()) {
            predicate.append(' ').append(first);
        }
        return predicate.toString().trim();
    }

    /**
     * Symbol or keyword for a vendor operator code. Unknown PascalCase names are split into
     * lower-case words ({@code StartsWith} becomes {@code starts with}); other unknown codes are
     * kept as written.
     */
    public static String humanizeOperator(String code) {
        if (code == null || code.isBlank()) {
            return "=";
        }
        String key = code.trim().toUpperCase(Locale.ROOT).replace(" ", "");
        String known = OPERATORS.get(key);
        if (known != null) {
            return known;
        }
        String trimmed = code.trim();
        if (!PASCAL_CASE.matcher(trimmed).matches()) {
            return trimmed;
        }
        return trimmed.replaceAll("([A-Z])", " $1").trim().toLowerCase(Locale.ROOT);
    }

    private static String orMissing(String value) {
        return value.isBlank() ? MISSING_VALUE : value;
    }

    private static void addIfNotBlank(List<String> predicates, String text) {
        if (text != null && !text.isBlank()) {
            predicates.add(text.trim());
        }
    }
}
