package com.forecastsentinel.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.pipeline.DataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link DataWriter} producing a JSON array with one object per row, keys in
 * column order. Dates are written as ISO-8601 strings.
 */
public class JsonDatasetWriter implements DataWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDatasetWriter.class);
    private static final String COMPONENT = "json-writer";

    private final Path path;
    private final ObjectMapper mapper;

    public JsonDatasetWriter(Path path) {
        this.path = Objects.requireNonNull(path, "JSON path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        try {
            CsvDatasetWriter.createParentDirectories(path);
            mapper.writeValue(path.toFile(), dataset.rows());
        } catch (IOException e) {
            throw new PipelineException(COMPONENT, "Failed to write JSON file " + path + ": " + e.getMessage(), e);
        }
        LOG.info("Wrote {} row(s) to {}", dataset.size(), path);
    }
}
