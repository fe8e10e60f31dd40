package com.tessera.modeling.service.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Renders {@link SolutionReport}s and {@link Diagnostic}s as JSON.
 */
public final class ReportWriter {

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(true);
    }

    public ReportWriter(boolean pretty) {
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, pretty)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public String toJson(SolutionReport report) {
        return serialize(report);
    }

    public String toJson(Diagnostic diagnostic) {
        return serialize(diagnostic);
    }

    public void write(Object report, Writer out) throws IOException {
        objectMapper.writeValue(out, report);
        out.write(System.lineSeparator());
        out.flush();
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
