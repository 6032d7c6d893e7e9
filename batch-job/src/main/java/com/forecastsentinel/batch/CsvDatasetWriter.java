package com.forecastsentinel.batch;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.pipeline.DataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DataWriter} producing a CSV file with a header row. {@code null}
 * cells are written empty; every other cell is written in its
 * {@link String#valueOf(Object) string form}.
 */
public class CsvDatasetWriter implements DataWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvDatasetWriter.class);
    private static final String COMPONENT = "csv-writer";

    private final Path path;
    private final CsvMapper mapper = new CsvMapper();

    public CsvDatasetWriter(Path path) {
        this.path = Objects.requireNonNull(path, "CSV path must not be null");
    }

    @Override
    public void write(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        CsvSchema.Builder schema = CsvSchema.builder();
        dataset.columns().forEach(schema::addColumn);

        try {
            createParentDirectories(path);
            try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                    SequenceWriter rows = mapper.writer(schema.build().withHeader()).writeValues(out)) {
                for (Map<String, Object> row : dataset.rows()) {
                    rows.write(render(dataset, row));
                }
            }
        } catch (IOException e) {
            throw new PipelineException(COMPONENT, "Failed to write CSV file " + path + ": " + e.getMessage(), e);
        }
        LOG.info("Wrote {} row(s) to {}", dataset.size(), path);
    }

    private static String[] render(Dataset dataset, Map<String, Object> row) {
        String[] cells = new String[dataset.columns().size()];
        for (int i = 0; i < cells.length; i++) {
            Object value = row.get(dataset.columns().get(i));
            cells[i] = value == null ? "" : String.valueOf(value);
        }
        return cells;
    }

    static void createParentDirectories(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
