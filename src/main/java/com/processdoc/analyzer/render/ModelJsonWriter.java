package com.processdoc.analyzer.render;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.processdoc.analyzer.model.ExecutionModel;

/**
 * Serializes an {@link ExecutionModel} to pretty-printed JSON, leaving out null fields.
 */
public class ModelJsonWriter {

    private final ObjectMapper mapper;

    public ModelJsonWriter() {
        this.mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(ExecutionModel model, Writer writer) throws IOException {
        mapper.writeValue(writer, model);
        writer.flush();
    }

    public String toJson(ExecutionModel model) {
        try {
            return mapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize execution model", e);
        }
    }
}
