package me.christianrobert.substation.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String VALIDATION_ALWAYS = "validation.always";
    public static final String VALIDATION_STRICT_REFERENCES = "validation.strict-references";
    public static final String PARSER_TWO_STAGE = "parser.two-stage";
    public static final String PARSER_MAX_SOURCE_PREVIEW = "parser.max-source-preview";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(VALIDATION_ALWAYS, false);
        configuration.put(VALIDATION_STRICT_REFERENCES, false);
        configuration.put(PARSER_TWO_STAGE, true);
        configuration.put(PARSER_MAX_SOURCE_PREVIEW, 100);

        log.info("Configuration service initialized with default values");
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
     * Boolean flag with a fallback for missing or non-boolean values.
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a configuration value as an int.
     * Accepts numbers and numeric strings (values arriving over REST are often strings).
     *
     * @return the value, or defaultValue if missing or not numeric
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
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
