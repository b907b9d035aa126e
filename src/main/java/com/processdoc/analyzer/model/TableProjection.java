package com.processdoc.analyzer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Headered rows describing the columns, mappings or joins a step works with.
 */
@Value
@Builder
public class TableProjection {
    @Singular
    List<String> headers;
    @Singular
    List<TableRow> rows;

    public boolean hasRows() {
        return !rows.isEmpty();
    }

    @Value
    @Builder
    public static class TableRow {
        @Singular
        List<String> cells;

        /**
         * Flattened rules of the row's formula, or null when the formula is not conditional.
         */
        List<Rule> rules;

        public static TableRow of(String... cells) {
            return TableRow.builder().cells(List.of(cells)).build();
        }
    }
}
