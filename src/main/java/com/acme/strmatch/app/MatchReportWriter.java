package com.acme.strmatch.app;

import com.acme.strmatch.domain.model.QueryMatches;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Renders batch results as a JSON array of
 * {@code {"query_id": ..., "top_candidates": [...]}} objects.
 */
@Component
@RequiredArgsConstructor
public class MatchReportWriter {

    private final ObjectMapper objectMapper;

    public String toJson(List<QueryMatches> results) {
        try {
            return writer().writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render match report", e);
        }
    }

    public void write(List<QueryMatches> results, Writer out) {
        try {
            writer().writeValue(out, results);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write match report", e);
        }
    }

    private ObjectWriter writer() {
        return objectMapper.writerWithDefaultPrettyPrinter();
    }
}
