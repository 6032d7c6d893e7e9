package com.forecastsentinel.core.transform;

import com.forecastsentinel.core.model.Dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The two independent transformer lists a stage-aware component owns.
 *
 * <p>
 * {@code before} wraps the input of the component's primary operation and
 * {@code after} wraps its output. Both default to empty. Instances are
 * immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class TransformerStages {

    private static final TransformerStages EMPTY = new TransformerStages(List.of(), List.of());

    private final List<Transformer> before;
    private final List<Transformer> after;

    private TransformerStages(List<Transformer> before, List<Transformer> after) {
        this.before = Collections.unmodifiableList(new ArrayList<>(before));
        this.after = Collections.unmodifiableList(new ArrayList<>(after));
    }

    public static TransformerStages empty() {
        return EMPTY;
    }

    public static TransformerStages of(List<Transformer> before, List<Transformer> after) {
        return new TransformerStages(
                Objects.requireNonNull(before, "before must not be null"),
                Objects.requireNonNull(after, "after must not be null"));
    }

    /**
     * Build stages from a key → transformers map. Absent keys mean an empty
     * stage.
     *
     * @param byKey map keyed by {@code "before"} / {@code "after"}
     * @return stages
     * @throws com.forecastsentinel.core.error.ConfigurationException for any
     *                                                                 other key
     */
    public static TransformerStages fromMap(Map<String, List<Transformer>> byKey) {
        Objects.requireNonNull(byKey, "Stage map must not be null");
        Map<Stage, List<Transformer>> resolved = new EnumMap<>(Stage.class);
        byKey.forEach((key, list) -> resolved.put(Stage.fromKey(key), list == null ? List.of() : list));
        return of(resolved.getOrDefault(Stage.BEFORE, List.of()),
                resolved.getOrDefault(Stage.AFTER, List.of()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Transformer> before() {
        return before;
    }

    public List<Transformer> after() {
        return after;
    }

    public List<Transformer> get(Stage stage) {
        return stage == Stage.BEFORE ? before : after;
    }

    /**
     * Run one stage through the {@link StageRunner}.
     *
     * @param component owning component name
     * @param stage     stage to run
     * @param dataset   input
     * @return transformed dataset
     */
    public Dataset apply(String component, Stage stage, Dataset dataset) {
        return StageRunner.run(component, stage, get(stage), dataset);
    }

    public boolean isEmpty() {
        return before.isEmpty() && after.isEmpty();
    }

    /**
     * Fluent builder; transformers are appended in call order.
     */
    public static final class Builder {
        private final List<Transformer> before = new ArrayList<>();
        private final List<Transformer> after = new ArrayList<>();

        public Builder before(Transformer... transformers) {
            before.addAll(List.of(transformers));
            return this;
        }

        public Builder before(List<Transformer> transformers) {
            before.addAll(transformers);
            return this;
        }

        public Builder after(Transformer... transformers) {
            after.addAll(List.of(transformers));
            return this;
        }

        public Builder after(List<Transformer> transformers) {
            after.addAll(transformers);
            return this;
        }

        public TransformerStages build() {
            return new TransformerStages(before, after);
        }
    }

    @Override
    public String toString() {
        return "TransformerStages{before=" + before.stream().map(Transformer::name).toList()
                + ", after=" + after.stream().map(Transformer::name).toList() + '}';
    }
}
