package com.spreadsheet.calc.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads golden cases from JSON: an array of
 * {@code {sheet, cell, expectedValue, tolerance, category?}} objects.
 * Numbers are read as BigDecimal so no precision is lost before comparison.
 */
public class GoldenCaseReader {

    private final ObjectReader reader;

    public GoldenCaseReader(ObjectMapper mapper) {
        this.reader = mapper.readerFor(new TypeReference<List<GoldenCase>>() { })
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public GoldenCaseReader() {
        this(new ObjectMapper());
    }

    public List<GoldenCase> read(InputStream input) {
        try {
            return reader.readValue(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read golden cases", e);
        }
    }

    public List<GoldenCase> read(String json) {
        try {
            return reader.readValue(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read golden cases", e);
        }
    }
}
