package com.forecastsentinel.core.model;

import com.forecastsentinel.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Dataset}.
 */
class DatasetTest {

    @Test
    @DisplayName("Should fill cells missing from a row map with null")
    void shouldFillMissingCellsWithNull() {
        Dataset dataset = Dataset.of(List.of("date", "a", "b"), List.of(Map.of("date", "2024-01-01", "a", 1)));

        assertThat(dataset.row(0)).containsEntry("a", 1).containsEntry("b", null);
        assertThat(dataset.row(0).keySet()).containsExactly("date", "a", "b");
    }

    @Test
    @DisplayName("Should reject duplicate column names")
    void shouldRejectDuplicateColumns() {
        assertThatThrownBy(() -> Dataset.of(List.of("a", "b", "a"), List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate column name 'a'");
    }

    @Test
    @DisplayName("Should reject a row carrying an unknown column")
    void shouldRejectUnknownRowKey() {
        assertThatThrownBy(() -> Dataset.of(List.of("a"), List.of(Map.of("a", 1, "z", 2))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown column 'z'");
    }

    @Test
    @DisplayName("Should not alias the caller's row maps")
    void shouldCopyRows() {
        Map<String, Object> source = new HashMap<>();
        source.put("a", 1);
        Dataset dataset = Dataset.of(List.of("a"), List.of(source));

        source.put("a", 99);

        assertThat(dataset.row(0)).containsEntry("a", 1);
        assertThatThrownBy(() -> dataset.row(0).put("a", 2)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should name missing and available columns")
    void shouldReportMissingColumns() {
        Dataset dataset = Dataset.builder("date", "sessions").build();

        assertThatThrownBy(() -> dataset.requireColumns("pivot", List.of("date", "platform", "channel")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("[pivot]")
                .hasMessageContaining("platform")
                .hasMessageContaining("channel")
                .hasMessageContaining("sessions");
    }

    @Test
    @DisplayName("Should represent and reject empty datasets")
    void shouldRejectEmptyWhenRequired() {
        Dataset empty = Dataset.empty(List.of("date"));

        assertThat(empty.isEmpty()).isTrue();
        assertThatThrownBy(() -> empty.requireNonEmpty("detector", "Actual dataset"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Actual dataset has no rows");
    }

    @Test
    @DisplayName("Builder rows must match the column count")
    void builderShouldCheckRowLength() {
        assertThatThrownBy(() -> Dataset.builder("a", "b").row(1))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Filter should return a new dataset and leave the source unchanged")
    void filterShouldNotMutateSource() {
        Dataset dataset = Dataset.builder("k", "v").row("x", 1).row("y", 2).build();

        Dataset filtered = dataset.filter(row -> "y".equals(row.get("k")));

        assertThat(filtered.size()).isEqualTo(1);
        assertThat(filtered.columns()).isEqualTo(dataset.columns());
        assertThat(dataset.size()).isEqualTo(2);
    }
}
