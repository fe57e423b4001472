package me.christianrobert.py2lua.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory transpiler configuration with defaults.
 *
 * <p>Keys:
 * <ul>
 *   <li>{@value #IN_FILE} - syntax tree JSON to read (environment {@code in_file})</li>
 *   <li>{@value #OUT_FILE} - Lua file to write (environment {@code out_file})</li>
 *   <li>{@value #API_ORIGINS} - comma-separated import origins whose members are renamed to camelCase</li>
 *   <li>{@value #RUN_ON_START} - transpile the configured files when started without arguments
 *       (environment {@code run_on_start})</li>
 * </ul>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String IN_FILE = "transpiler.in-file";
    public static final String OUT_FILE = "transpiler.out-file";
    public static final String API_ORIGINS = "transpiler.api-origins";
    public static final String RUN_ON_START = "transpiler.run-on-start";

    static final String DEFAULT_IN_FILE = "transpiler_in.json";
    static final String DEFAULT_OUT_FILE = "transpiler_out.lua";
    static final String DEFAULT_API_ORIGINS = "cc_lib";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    ConfigService(Map<String, String> environment) {
        this.environment = environment;
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(IN_FILE, environment.getOrDefault("in_file", DEFAULT_IN_FILE));
        configuration.put(OUT_FILE, environment.getOrDefault("out_file", DEFAULT_OUT_FILE));
        configuration.put(API_ORIGINS, DEFAULT_API_ORIGINS);
        configuration.put(RUN_ON_START, Boolean.parseBoolean(environment.getOrDefault("run_on_start", "false")));

        log.info("Configuration service initialized: in={}, out={}", configuration.get(IN_FILE), configuration.get(OUT_FILE));
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values ("cc_lib,cc_extra") and collections, which is how
     * a JSON array arrives through the REST API. Trims whitespace and filters out empty strings.
     *
     * @param key Configuration key
     * @return List of strings, or empty list if value is null/empty
     */
    public List<String> getConfigValueAsStringList(String key) {
        Object value = configuration.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        Stream<String> entries;
        if (value instanceof Collection) {
            entries = ((Collection<?>) value).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString);
        } else {
            entries = Arrays.stream(value.toString().split(","));
        }
        return entries
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
