package com.processdoc.analyzer.render;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.model.ExecutionModel;

/**
 * Renders an {@link ExecutionModel} as an indented plain-text outline: one line per step,
 * its details and rules below it, then the variable catalogue.
 */
public class OutlineRenderer extends TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(OutlineRenderer.class);

    static final String TEMPLATE_NAME = "outline.ftl";

    public void render(ExecutionModel model, Writer writer) throws IOException {
        process(TEMPLATE_NAME, Map.of("model", model), writer);
        log.debug("Rendered outline of {} steps", model.getExecutionFlow().size());
    }

    public String render(ExecutionModel model) {
        StringWriter writer = new StringWriter();
        try {
            render(model, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
