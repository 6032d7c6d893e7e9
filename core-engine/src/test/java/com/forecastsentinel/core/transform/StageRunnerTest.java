package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.error.ConfigurationException;
import com.forecastsentinel.core.error.PipelineException;
import com.forecastsentinel.core.error.ValidationException;
import com.forecastsentinel.core.model.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StageRunner}, {@link TransformerStages} and {@link Stage}.
 */
class StageRunnerTest {

    private final Dataset dataset = Dataset.builder("k", "v")
            .row("a", 1)
            .row("b", 2)
            .row("c", 3)
            .build();

    @Test
    @DisplayName("Empty list returns the input unchanged")
    void emptyListShouldBeIdentity() {
        assertThat(StageRunner.run("reader", Stage.AFTER, List.of(), dataset)).isSameAs(dataset);
    }

    @Test
    @DisplayName("Should apply transformers in list order")
    void shouldApplyInOrder() {
        List<String> calls = new ArrayList<>();
        Transformer first = recording("first", calls, ds -> ds.filter(r -> !"a".equals(r.get("k"))));
        Transformer second = recording("second", calls, ds -> {
            assertThat(ds.size()).isEqualTo(2);
            return ds;
        });

        Dataset result = StageRunner.run("detector", Stage.AFTER, List.of(first, second), dataset);

        assertThat(calls).containsExactly("first", "second");
        assertThat(result.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Pipeline errors propagate unchanged and abort the run")
    void shouldPropagatePipelineErrors() {
        List<String> calls = new ArrayList<>();
        ValidationException failure = new ValidationException("pivot", "boom");
        Transformer failing = recording("failing", calls, ds -> {
            throw failure;
        });
        Transformer never = recording("never", calls, ds -> ds);

        assertThatThrownBy(() -> StageRunner.run("detector", Stage.BEFORE, List.of(failing, never), dataset))
                .isSameAs(failure);
        assertThat(calls).containsExactly("failing");
    }

    @Test
    @DisplayName("Unexpected errors are wrapped with component, stage and transformer name")
    void shouldWrapUnexpectedErrors() {
        Transformer failing = recording("custom", new ArrayList<>(), ds -> {
            throw new IllegalStateException("bad state");
        });

        assertThatThrownBy(() -> StageRunner.run("writer", Stage.BEFORE, List.of(failing), dataset))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("[writer]")
                .hasMessageContaining("'custom'")
                .hasMessageContaining("'before'")
                .hasMessageContaining("bad state")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Order matters: select-then-format differs from format-then-select")
    void orderShouldMatter() {
        Dataset numbers = Dataset.builder("name", "share").row("x", 0.5).row("y", 0.25).build();
        Transformer keepLarge = ValueFilter.range("share", 0.3, null);
        Transformer format = ColumnFormatter.percentage(List.of("share"), 0, true);

        Dataset filteredFirst = StageRunner.run("t", Stage.AFTER, List.of(keepLarge, format), numbers);

        assertThat(filteredFirst.columnValues("share")).containsExactly("50%");
        assertThatThrownBy(() -> StageRunner.run("t", Stage.AFTER, List.of(format, keepLarge), numbers))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not numeric");
    }

    @Test
    @DisplayName("Stages built from a key map reject unknown keys")
    void stagesShouldRejectUnknownKeys() {
        Map<String, List<Transformer>> byKey = new LinkedHashMap<>();
        byKey.put("after", List.of(ColumnSelector.exclude("v")));

        TransformerStages stages = TransformerStages.fromMap(byKey);
        assertThat(stages.before()).isEmpty();
        assertThat(stages.after()).hasSize(1);
        assertThat(stages.apply("reader", Stage.AFTER, dataset).columns()).containsExactly("k");

        byKey.put("during", List.of());
        assertThatThrownBy(() -> TransformerStages.fromMap(byKey))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("during")
                .hasMessageContaining("before, after");
    }

    @Test
    @DisplayName("Builder appends transformers per stage in call order")
    void builderShouldKeepOrder() {
        Transformer a = ColumnSelector.exclude("x");
        Transformer b = ColumnSelector.exclude("y");

        TransformerStages stages = TransformerStages.builder().after(a).after(b).build();

        assertThat(stages.after()).containsExactly(a, b);
        assertThat(stages.get(Stage.BEFORE)).isEmpty();
        assertThat(TransformerStages.empty().isEmpty()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Transformer recording(String name, List<String> calls,
            UnaryOperator<Dataset> body) {
        return new Transformer() {
            @Override
            public Dataset apply(Dataset input) {
                calls.add(name);
                return body.apply(input);
            }

            @Override
            public TransformerKind kind() {
                return TransformerKind.VALUE_FILTER;
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
