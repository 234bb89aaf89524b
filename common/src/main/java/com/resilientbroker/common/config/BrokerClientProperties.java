/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.config;

import com.resilientbroker.common.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed property accessor for the broker client.
 *
 * <h3>Resolution order</h3>
 * <ol>
 *   <li>JVM system properties ({@code -Dbroker.host=...})</li>
 *   <li>{@code broker-client.properties} on the classpath (or an explicit map)</li>
 *   <li>The getter's default value</li>
 * </ol>
 *
 * <p>Values may contain {@code ${key}} and {@code ${key:default}} placeholders. A placeholder
 * is looked up in system properties, then in the loaded properties, then in environment
 * variables, then falls back to its default. A placeholder that resolves nowhere fails with
 * {@link InvalidConfigurationException}.</p>
 *
 * <pre>{@code
 *   BrokerClientProperties props = BrokerClientProperties.load();
 *   int workers = props.getInt("broker.consumer.workers", 4);
 *   Duration base = props.getDuration("broker.consumer.retry.base-delay", Duration.ofMillis(10));
 * }</pre>
 */
public final class BrokerClientProperties {

    private static final Logger log = LoggerFactory.getLogger(BrokerClientProperties.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    public static final String DEFAULT_RESOURCE = "broker-client.properties";

    private final Map<String, String> properties;

    private BrokerClientProperties(Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /** Load {@value #DEFAULT_RESOURCE} from the classpath (missing file means no properties). */
    public static BrokerClientProperties load() {
        return loadClasspath(DEFAULT_RESOURCE);
    }

    public static BrokerClientProperties loadClasspath(String resource) {
        Properties raw = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = BrokerClientProperties.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(resource)) {
            if (is != null) {
                raw.load(is);
                log.info("Loaded {} properties from classpath:{}", raw.size(), resource);
            } else {
                log.debug("No classpath resource {}, using defaults", resource);
            }
        } catch (IOException e) {
            throw new InvalidConfigurationException("Could not read classpath:" + resource, e);
        }
        Map<String, String> map = new LinkedHashMap<>();
        raw.stringPropertyNames().forEach(k -> map.put(k, raw.getProperty(k)));
        return fromMap(map);
    }

    /** Build from an explicit map; system properties still take precedence. */
    public static BrokerClientProperties fromMap(Map<String, String> source) {
        Map<String, String> merged = new LinkedHashMap<>(source);
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("broker.")) merged.put(key, System.getProperty(key));
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : merged.entrySet()) {
            resolved.put(e.getKey(), resolve(e.getValue(), merged));
        }
        return new BrokerClientProperties(resolved);
    }

    // ─── Typed Getters ──────────────────────────────────────────────

    public String getString(String key) {
        return properties.get(key);
    }

    public String getString(String key, String defaultValue) {
        String val = properties.get(key);
        return val == null || val.isBlank() ? defaultValue : val.trim();
    }

    public int getInt(String key, int defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Integer.parseInt(val.trim()); }
        catch (NumberFormatException e) { throw invalid(key, val, e); }
    }

    public double getDouble(String key, double defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Double.parseDouble(val.trim()); }
        catch (NumberFormatException e) { throw invalid(key, val, e); }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim());
    }

    /**
     * Parse a duration. Supports:
     * <ul>
     *   <li>Plain number → milliseconds</li>
     *   <li>{@code "250ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT30S"}) via {@link Duration#parse}</li>
     * </ul>
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String raw = properties.get(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        String val = raw.trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.substring(0, val.length() - 2).trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            throw invalid(key, raw, e);
        }
    }

    // ─── Namespace Helpers ──────────────────────────────────────────

    /**
     * All properties under {@code prefix}, with the prefix stripped.
     * <p>Example: {@code getSubProperties("broker.queue.args.")} → {@code {"x-queue-type" → "quorum"}}</p>
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        Map.Entry::getValue,
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    @Override
    public String toString() {
        return "BrokerClientProperties{count=" + properties.size() + "}";
    }

    // ─── Placeholder Resolution ─────────────────────────────────────

    static String resolve(String value, Map<String, String> source) {
        if (value == null || !value.contains("${")) return value;
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolveExpression(matcher.group(1), source)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String resolveExpression(String expr, Map<String, String> source) {
        String key = expr;
        String defaultValue = null;
        int colon = expr.indexOf(':');
        if (colon >= 0) {
            key = expr.substring(0, colon).trim();
            defaultValue = expr.substring(colon + 1);
        }

        String val = System.getProperty(key);
        if (val != null) return val;
        val = source.get(key);
        if (val != null && !val.contains("${")) return val;
        val = System.getenv(key);
        if (val != null) return val;
        if (defaultValue != null) return defaultValue;

        throw new InvalidConfigurationException("Unresolved placeholder ${" + key + "}");
    }

    private static InvalidConfigurationException invalid(String key, String value, Exception cause) {
        return new InvalidConfigurationException("Invalid value for '" + key + "': '" + value + "'", cause);
    }
}
