package com.buildsentinel.core.config;

import com.buildsentinel.core.error.ValidationException;
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
 * Loads and validates {@link AlertingConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method calls {@link AlertingConfig#validate()} after
 * parsing, so a bad file stops the service at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertingConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ALERTING_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "alerting.yml";

    private AlertingConfigLoader() {
    }

    /**
     * Load using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws ValidationException if validation fails
     */
    public static AlertingConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alerting config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading alerting config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws ValidationException      if the content is malformed or invalid
     */
    public static AlertingConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alerting config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerting config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ValidationException      if the content is malformed or invalid
     */
    public static AlertingConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertingConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AlertingConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AlertingConfig.class, options));

        AlertingConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ValidationException("Malformed alerting config " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Alerting config {} is empty, using defaults", source);
            config = new AlertingConfig();
        }
        config.validate();

        LOG.info("Loaded {} routing rule(s) and {} maintenance window(s) from {}",
                config.getRules().size(), config.getMaintenanceWindows().size(), source);
        return config;
    }
}
