package com.processdoc.analyzer.util;

import java.util.Collection;
import java.util.Set;

import com.processdoc.analyzer.model.input.ParameterBag;

/**
 * Text helpers shared by the registry and the step descriptors.
 */
public class StepText {

    /**
     * Default names the vendor tool fills in for unnamed tables.
     */
    public static final Set<String> PLACEHOLDER_NAMES = Set.of("dataset", "target");

    public static final String DEFAULT_COLUMN_TYPE = "String";

    public static final int PREVIEW_LENGTH = 200;

    private StepText() {
        // Utility class
    }

    /**
     * True for non-blank names that are not one of the placeholders.
     */
    public static boolean isMeaningfulName(String name) {
        return name != null && !name.isBlank() && !PLACEHOLDER_NAMES.contains(name.trim());
    }

    /**
     * Appends the value to the list unless it is blank, a placeholder or already present.
     */
    public static void addName(Collection<String> names, String value) {
        if (isMeaningfulName(value) && !names.contains(value)) {
            names.add(value);
        }
    }

    /**
     * Declared data type of a column definition, defaulting to String.
     */
    public static String columnType(ParameterBag column) {
        String type = column.firstText("ColumnType", "ColumnDataType", "DataType");
        return type.isBlank() ? DEFAULT_COLUMN_TYPE : type;
    }

    /**
     * Last segment of a Windows-style path.
     */
    public static String baseName(String path) {
        if (path == null) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('\\'), path.lastIndexOf('/'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Cuts text to {@code max} characters, marking the cut with an ellipsis.
     */
    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String collapsed = text.strip();
        if (collapsed.length() <= max) {
            return collapsed;
        }
        return collapsed.substring(0, max) + "...";
    }

    /**
     * Identifier safe for anchors and diagram ids: every non-alphanumeric character becomes '_'.
     */
    public static String slug(String type, String name) {
        return (nullToEmpty(type) + "_" + nullToEmpty(name)).replaceAll("[^a-zA-Z0-9]", "_");
    }

    /**
     * Removes one pair of enclosing square brackets, as used around column references.
     */
    public static String stripBrackets(String reference) {
        if (reference == null) {
            return "";
        }
        return reference.replaceAll("^\\[|\\]$", "");
    }

    public static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
