package com.processdoc.analyzer.model.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import lombok.EqualsAndHashCode;

/**
 * Read-only view over an operation-specific parameter tree (a step's storage object).
 *
 * The vendor export is loosely structured: a field may be absent, a scalar, an object carrying
 * its text under {@code #text}, a single object, or a list of objects. Every accessor here
 * degrades to an empty value instead of failing.
 */
@EqualsAndHashCode
public final class ParameterBag {

    public static final String TEXT_KEY = "#text";

    private static final ParameterBag EMPTY = new ParameterBag(MissingNode.getInstance());

    private final JsonNode node;

    private ParameterBag(JsonNode node) {
        this.node = node != null ? node : MissingNode.getInstance();
    }

    public static ParameterBag of(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return EMPTY;
        }
        return new ParameterBag(node);
    }

    public static ParameterBag empty() {
        return EMPTY;
    }

    public boolean isPresent() {
        return !node.isMissingNode() && !node.isNull();
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    /**
     * True when the field exists and carries non-blank text.
     */
    public boolean hasText(String key) {
        return !text(key).isBlank();
    }

    public boolean isScalar() {
        return node.isValueNode();
    }

    public ParameterBag get(String key) {
        if (!node.isObject()) {
            return EMPTY;
        }
        return of(node.get(key));
    }

    /**
     * Text of this value: scalars as-is, objects through their {@code #text} member, any other
     * object as its JSON form. Missing and null values give an empty string.
     */
    public String asText() {
        if (!isPresent()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText("");
        }
        if (node.isObject() && node.has(TEXT_KEY)) {
            JsonNode text = node.get(TEXT_KEY);
            return text.isNull() ? "" : text.asText("");
        }
        return node.toString();
    }

    public String text(String key) {
        return get(key).asText();
    }

    /**
     * First non-blank text among the given keys, or an empty string.
     */
    public String firstText(String... keys) {
        for (String key : keys) {
            String value = text(key);
            if (!value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    /**
     * Text of the key, or the fallback when the field is missing or blank.
     */
    public String textOr(String key, String fallback) {
        String value = text(key);
        return value.isBlank() ? fallback : value;
    }

    /**
     * This value as a list: arrays element-wise, any other present value as a singleton.
     */
    public List<ParameterBag> asList() {
        if (!isPresent()) {
            return Collections.emptyList();
        }
        if (node.isArray()) {
            List<ParameterBag> items = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                ParameterBag item = of(element);
                if (item.isPresent()) {
                    items.add(item);
                }
            }
            return items;
        }
        if (node.isTextual() && node.asText().isBlank()) {
            return Collections.emptyList();
        }
        return List.of(this);
    }

    public List<ParameterBag> list(String key) {
        return get(key).asList();
    }

    /**
     * List stored as {@code <container><item>...</item></container>}, normalized whether the
     * item occurs once or many times.
     */
    public List<ParameterBag> listAt(String container, String item) {
        return get(container).list(item);
    }

    /**
     * Serialized form used for text containment checks.
     */
    public String flatText() {
        return isPresent() ? node.toString() : "";
    }

    public JsonNode toJsonNode() {
        return node;
    }

    @Override
    public String toString() {
        return flatText();
    }
}
