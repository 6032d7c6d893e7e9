package com.forecastsentinel.batch;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.model.Values;
import com.forecastsentinel.core.pipeline.DataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link DataReader} over a CSV file with a header row.
 *
 * <p>
 * Cells are typed on the way in: empty cells become {@code null}, cells of the
 * configured date columns become {@link java.time.LocalDate}s, integral text
 * becomes {@link Long} and other numeric text {@link Double}. Everything else,
 * quantile text included, stays a {@link String}.
 * </p>
 */
public class CsvDatasetReader implements DataReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvDatasetReader.class);
    private static final String COMPONENT = "csv-reader";
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

    private final Path path;
    private final Set<String> dateColumns;
    private final CsvMapper mapper;

    public CsvDatasetReader(Path path, List<String> dateColumns) {
        this.path = Objects.requireNonNull(path, "CSV path must not be null");
        this.dateColumns = Set.copyOf(Objects.requireNonNull(dateColumns, "Date columns must not be null"));
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public Dataset load() {
        List<String[]> lines = readLines();
        if (lines.isEmpty()) {
            throw new ValidationException(COMPONENT, "CSV file " + path + " has no header row");
        }
        List<String> columns = Arrays.stream(lines.get(0)).map(String::trim).toList();

        List<Map<String, Object>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            if (cells.length == 0 || (cells.length == 1 && cells[0].isBlank())) {
                continue;
            }
            if (cells.length > columns.size()) {
                throw new ValidationException(COMPONENT, "Line " + (i + 1) + " of " + path + " has "
                        + cells.length + " cells but the header has " + columns.size());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < cells.length; c++) {
                row.put(columns.get(c), typed(columns.get(c), cells[c], i + 1));
            }
            rows.add(row);
        }

        Dataset dataset = Dataset.of(columns, rows);
        LOG.info("Read {} row(s) x {} column(s) from {}", dataset.size(), columns.size(), path);
        return dataset;
    }

    private List<String[]> readLines() {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            return it.readAll();
        } catch (IOException e) {
            throw new PipelineException(COMPONENT, "Failed to read CSV file " + path + ": " + e.getMessage(), e);
        }
    }

    private Object typed(String column, String raw, int line) {
        String text = raw.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (dateColumns.contains(column)) {
            return Values.asDate(text).orElseThrow(() -> new ValidationException(COMPONENT,
                    "Line " + line + " of " + path + ": '" + text + "' in date column '" + column
                            + "' is not an ISO date"));
        }
        if (INTEGER.matcher(text).matches()) {
            return Long.parseLong(text);
        }
        return Values.asDouble(text).filter(d -> !d.isNaN() && !d.isInfinite())
                .<Object>map(d -> d)
                .orElse(text);
    }

    public Path getPath() {
        return path;
    }
}
