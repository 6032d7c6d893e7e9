package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ForecastWorkflow}.
 */
@ExtendWith(MockitoExtension.class)
class ForecastWorkflowTest {

    @Mock private DataReader reader;
    @Mock private Forecaster forecaster;
    @Mock private DataWriter writer;

    @Test
    @DisplayName("Run forecasts the history and writes the result")
    void runShouldWriteForecast() {
        Dataset history = Dataset.builder("date", "m").row("2024-01-01", 5).build();
        Dataset forecast = Dataset.builder("date", "m").row("2024-01-08", "5|4|4|4|5|5|5|6|6|6").build();
        when(reader.load()).thenReturn(history);
        when(forecaster.forecast(history, 7)).thenReturn(forecast);

        Dataset result = new ForecastWorkflow(reader, forecaster, writer, 7).run();

        assertThat(result).isSameAs(forecast);
        verify(writer).write(forecast);
    }

    @Test
    @DisplayName("Non-positive horizon is a configuration error")
    void shouldRejectNonPositiveHorizon() {
        assertThatThrownBy(() -> new ForecastWorkflow(reader, forecaster, writer, 0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("horizon");
    }

    @Test
    @DisplayName("Empty history fails before forecasting")
    void emptyHistoryShouldFail() {
        when(reader.load()).thenReturn(Dataset.empty(List.of("date")));

        assertThatThrownBy(() -> new ForecastWorkflow(reader, forecaster, writer, 3).run())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Reader returned empty dataset");
        verifyNoInteractions(forecaster, writer);
    }

    @Test
    @DisplayName("Empty forecast fails before writing")
    void emptyForecastShouldFail() {
        Dataset history = Dataset.builder("date", "m").row("2024-01-01", 5).build();
        when(reader.load()).thenReturn(history);
        when(forecaster.forecast(history, 3)).thenReturn(Dataset.empty(List.of("date")));

        assertThatThrownBy(() -> new ForecastWorkflow(reader, forecaster, writer, 3).run())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("horizon 3");
        verifyNoInteractions(writer);
    }
}
