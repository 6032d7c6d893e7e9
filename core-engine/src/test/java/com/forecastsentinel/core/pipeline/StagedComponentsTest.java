package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.model.Dataset;
import com.forecastsentinel.core.transform.ColumnSelector;
import com.forecastsentinel.core.transform.TransformerStages;
import com.forecastsentinel.core.transform.ValueFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StagedReader}, {@link StagedWriter} and
 * {@link StagedForecaster}.
 */
@ExtendWith(MockitoExtension.class)
class StagedComponentsTest {

    private static final Dataset SESSIONS = Dataset.builder("date", "platform", "sessions")
            .row("2024-01-01", "ios", 10)
            .row("2024-01-01", "web", 20)
            .build();

    @Mock private DataReader reader;
    @Mock private DataWriter writer;
    @Mock private Forecaster forecaster;

    @Test
    @DisplayName("Reader applies its after stage to the loaded data")
    void readerShouldApplyAfterStage() {
        when(reader.load()).thenReturn(SESSIONS);
        StagedReader staged = new StagedReader("actual-reader", reader, TransformerStages.builder()
                .after(ValueFilter.include("platform", List.of("web")))
                .build());

        assertThat(staged.load().columnValues("sessions")).containsExactly(20);
        assertThat(staged.getName()).isEqualTo("actual-reader");
    }

    @Test
    @DisplayName("Reader refuses a before stage")
    void readerShouldRejectBeforeStage() {
        TransformerStages stages = TransformerStages.builder().before(ColumnSelector.include("date")).build();

        assertThatThrownBy(() -> new StagedReader("forecast-reader", reader, stages))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("forecast-reader");
    }

    @Test
    @DisplayName("Writer applies its before stage to what it writes")
    void writerShouldApplyBeforeStage() {
        StagedWriter staged = new StagedWriter("writer", writer, TransformerStages.builder()
                .before(ColumnSelector.exclude("platform"))
                .build());

        staged.write(SESSIONS);

        ArgumentCaptor<Dataset> written = ArgumentCaptor.forClass(Dataset.class);
        verify(writer).write(written.capture());
        assertThat(written.getValue().columns()).containsExactly("date", "sessions");
    }

    @Test
    @DisplayName("Writer refuses an after stage")
    void writerShouldRejectAfterStage() {
        TransformerStages stages = TransformerStages.builder().after(ColumnSelector.include("date")).build();

        assertThatThrownBy(() -> new StagedWriter("writer", writer, stages))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Forecaster runs before on the history and after on the forecast")
    void forecasterShouldRunBothStages() {
        Dataset forecast = Dataset.builder("date", "platform", "sessions", "note")
                .row("2024-01-08", "web", "20|18|18|19|19|20|21|21|22|22", "x")
                .build();
        when(forecaster.forecast(any(Dataset.class), eq(1))).thenReturn(forecast);
        StagedForecaster staged = new StagedForecaster("forecaster", forecaster, TransformerStages.builder()
                .before(ValueFilter.include("platform", List.of("web")))
                .after(ColumnSelector.exclude("note"))
                .build());

        Dataset result = staged.forecast(SESSIONS, 1);

        ArgumentCaptor<Dataset> history = ArgumentCaptor.forClass(Dataset.class);
        verify(forecaster).forecast(history.capture(), eq(1));
        assertThat(history.getValue().size()).isEqualTo(1);
        assertThat(result.columns()).containsExactly("date", "platform", "sessions");
    }
}
