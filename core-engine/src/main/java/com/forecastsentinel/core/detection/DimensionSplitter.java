package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.model.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits a composite metric key into named dimension values.
 *
 * <p>
 * The key must split into exactly as many parts as there are dimension
 * names; anything else is an {@link AlignmentException}. Each part is then
 * rendered through the dimension's {@link DimensionMapping} if it has a label,
 * otherwise passed through, optionally title-cased.
 * </p>
 *
 * @since 1.0.0
 */
public final class DimensionSplitter {

    private static final String COMPONENT = "dimension-splitter";

    private final List<String> dimensionNames;
    private final String delimiter;
    private final Pattern split;
    private final Map<String, DimensionMapping> mappings;
    private final boolean titleCase;

    public DimensionSplitter(List<String> dimensionNames, String delimiter,
            Map<String, DimensionMapping> mappings, boolean titleCase) {
        this.dimensionNames = List.copyOf(Objects.requireNonNull(dimensionNames, "Dimension names must not be null"));
        this.delimiter = Objects.requireNonNull(delimiter, "Delimiter must not be null");
        this.split = Pattern.compile(Pattern.quote(delimiter));
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(mappings, "Mappings must not be null")));
        this.titleCase = titleCase;
    }

    /**
     * @param metric composite metric key, e.g. {@code producta_ios}
     * @return raw parts in dimension order
     * @throws AlignmentException if the part count differs from the number of
     *                            dimension names
     */
    public List<String> split(String metric) {
        String[] parts = split.split(metric, -1);
        if (parts.length != dimensionNames.size()) {
            throw new AlignmentException(COMPONENT,
                    "Metric '" + metric + "' splits into " + parts.length + " part(s) on '" + delimiter
                            + "' but " + dimensionNames.size() + " dimension name(s) are configured: "
                            + dimensionNames);
        }
        List<String> result = new ArrayList<>(parts.length);
        Collections.addAll(result, parts);
        return result;
    }

    /**
     * Split a metric key and render every part as a display label.
     *
     * @param metric composite metric key
     * @return dimension name → label, in dimension order
     */
    public Map<String, String> labels(String metric) {
        List<String> parts = split(metric);
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < parts.size(); i++) {
            String name = dimensionNames.get(i);
            String token = parts.get(i);
            Optional<String> mapped = Optional.ofNullable(mappings.get(name)).flatMap(m -> m.label(token));
            labels.put(name, mapped.orElseGet(() -> titleCase ? Values.titleCase(token) : token));
        }
        return labels;
    }

    public List<String> getDimensionNames() {
        return dimensionNames;
    }

    public String getDelimiter() {
        return delimiter;
    }
}
