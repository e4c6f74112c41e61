package io.agentnode.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable key/value configuration of an agent node.
 * <p>
 * Values are kept as strings and converted by the typed getters. A {@code Settings} instance is
 * never modified: {@link #withOverrides(Map)} returns a new instance, which is how tenant-scoped
 * configuration is layered over the process-wide one.
 * <p>
 * {@link #load()} reads the classpath resource {@value #DEFAULT_RESOURCE} and then applies any
 * system property whose name starts with {@value #PREFIX}.
 */
public final class Settings {

    private static final Logger LOGGER = LoggerFactory.getLogger(Settings.class);

    public static final String DEFAULT_RESOURCE = "/agentnode.properties";
    public static final String PREFIX = "agentnode.";

    public static final String TENANT_ROUTING_ENABLED = "agentnode.tenant-routing.enabled";
    public static final String TENANT_ROUTING_SELECTION = "agentnode.tenant-routing.selection";
    public static final String RESPONSE_TIMEOUT_MS = "agentnode.inbound.response-timeout-ms";
    public static final String HTTP_HOST = "agentnode.transport.http.host";
    public static final String HTTP_PORT = "agentnode.transport.http.port";
    public static final String HTTP_MAX_MESSAGE_SIZE = "agentnode.transport.http.max-message-size";

    private static final Settings EMPTY = new Settings(Map.of());

    private final Map<String, String> values;

    private Settings(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Settings empty() {
        return EMPTY;
    }

    public static Settings of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return new Settings(new HashMap<>(values));
    }

    public static Settings fromProperties(Properties properties) {
        Map<String, String> values = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name).trim());
        }
        return new Settings(values);
    }

    /**
     * Loads the default resource and overlays {@code agentnode.*} system properties.
     *
     * @return the process-wide settings
     */
    public static Settings load() {
        return load(DEFAULT_RESOURCE, System.getProperties());
    }

    static Settings load(String resource, Properties overrides) {
        Properties properties = new Properties();
        URL url = Settings.class.getResource(resource);
        if (url == null) {
            LOGGER.debug("No {} on the classpath, using built-in defaults", resource);
        } else {
            try (InputStream in = url.openStream()) {
                properties.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + resource, e);
            }
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, overrides.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public Settings withOverrides(Map<String, String> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new HashMap<>(values);
        merged.putAll(overrides);
        return new Settings(merged);
    }

    public @Nullable String getString(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        String value = values.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Setting " + key + " is not a boolean: " + value);
    }

    public int getInt(String key, int defaultValue) {
        long value = getLong(key, defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Setting " + key + " is out of range: " + value);
        }
        return (int) value;
    }

    public long getLong(String key, long defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not a number: " + value, e);
        }
    }

    /**
     * Reads a duration expressed in milliseconds.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Duration.ofMillis(getLong(key, defaultValue.toMillis()));
    }

    public boolean tenantRoutingEnabled() {
        return getBoolean(TENANT_ROUTING_ENABLED, false);
    }

    /**
     * @throws IllegalArgumentException if the configured timeout is not positive
     */
    public Duration responseTimeout() {
        Duration timeout = getDuration(RESPONSE_TIMEOUT_MS, Duration.ofSeconds(30));
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Setting " + RESPONSE_TIMEOUT_MS + " must be positive: " + timeout.toMillis());
        }
        return timeout;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Settings) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Settings" + values;
    }
}
