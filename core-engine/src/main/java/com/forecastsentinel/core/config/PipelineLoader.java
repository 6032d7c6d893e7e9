package com.forecastsentinel.core.config;

import com.forecastsentinel.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link PipelineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_PIPELINE_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Duplicate keys and unknown properties are rejected while parsing, and
 * every {@code load*} method calls {@link PipelineConfig#validate()} so that a
 * misconfigured pipeline fails before any data is read. An empty document
 * yields the default configuration: no transformers anywhere and the default
 * detector settings.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_PIPELINE_PATH = "PIPELINE_CONFIG_PATH";

    /** Classpath resource used when no override is given. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private static final String COMPONENT = "pipeline-config";

    private PipelineLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the pipeline using automatic resolution: {@code PIPELINE_CONFIG_PATH}
     * if set and present, otherwise {@code pipeline.yml} on the classpath.
     *
     * @return parsed and validated configuration
     */
    public static PipelineConfig load() {
        String envPath = System.getenv(ENV_PIPELINE_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading pipeline from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading pipeline from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the pipeline from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the file is missing, unreadable or
     *                                invalid
     */
    public static PipelineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Pipeline file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new ConfigurationException(COMPONENT, "Pipeline file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException(COMPONENT, "Failed to read pipeline file: " + path, e);
        }
    }

    /**
     * Load the pipeline from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the resource is missing, unreadable or
     *                                invalid
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PipelineLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException(COMPONENT, "Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException(COMPONENT, "Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static PipelineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PipelineConfig.class, options));

        PipelineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException(COMPONENT,
                    "Malformed pipeline configuration in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Pipeline configuration {} is empty; using defaults", source);
            config = new PipelineConfig();
        }
        // Fail fast if any component is misconfigured
        config.validate();

        LOG.info("Loaded pipeline from {}: detector '{}', {} detector transformer(s)", source,
                config.getDetector().getName(),
                config.getDetector().getTransformers().getBefore().size()
                        + config.getDetector().getTransformers().getAfter().size());
        return config;
    }
}
