package com.forecastsentinel.core.config;

/**
 * Configuration of a reader or writer: only its {@code transformers} block.
 *
 * @since 1.0.0
 */
public class ComponentConfig {

    private StageConfig transformers = new StageConfig();

    public StageConfig getTransformers() {
        return transformers;
    }

    public void setTransformers(StageConfig transformers) {
        this.transformers = transformers != null ? transformers : new StageConfig();
    }

    @Override
    public String toString() {
        return "ComponentConfig{transformers=" + transformers + '}';
    }
}
