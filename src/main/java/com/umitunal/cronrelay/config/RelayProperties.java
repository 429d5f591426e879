package com.umitunal.cronrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Loads {@code cronrelay.*} settings from a classpath properties file. System properties
 * with the same key take precedence over the file.
 */
public final class RelayProperties {
    private static final Logger logger = LoggerFactory.getLogger(RelayProperties.class);

    public static final String DEFAULT_RESOURCE = "cronrelay.properties";
    private static final String KEY_PREFIX = "cronrelay.";

    private RelayProperties() {
    }

    public static Properties load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * A missing resource yields only the system property overrides.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     */
    public static Properties load(String resource) {
        Properties props = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RelayProperties.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Properties resource {} not found, using defaults", resource);
            } else {
                props.load(in);
                logger.debug("Loaded {} properties from {}", props.size(), resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(KEY_PREFIX)) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return props;
    }
}
