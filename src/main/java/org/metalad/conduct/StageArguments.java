package org.metalad.conduct;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.exceptions.ConfigurationException;
import org.metalad.record.RecordCodec;

/**
 * Typed access to the arguments of a pipeline stage
 */
class StageArguments {
    private static final Log logArguments = LogFactory.getLog(StageArguments.class);

    private final String stage;
    private final Map<String, Object> arguments;

    StageArguments(String stage, Map<String, Object> arguments) {
        this.stage = stage;
        this.arguments = arguments == null ? Collections.emptyMap() : arguments;
    }

    void checkKnown(String... known) throws ConfigurationException {
        List<String> knownKeys = Arrays.asList(known);
        List<String> unknown = new ArrayList<>();
        for (String key : arguments.keySet()) {
            if (!knownKeys.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw error("unknown argument(s) " + unknown + ", known: " + knownKeys);
        }
    }

    /**
     * @param defaultValue Value of a missing argument, null if the argument is required
     */
    String getString(String key, String defaultValue) throws ConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            if (defaultValue == null) {
                throw error("argument '" + key + "' is required");
            }
            return defaultValue;
        }
        if (value instanceof Map || value instanceof List) {
            throw error("argument '" + key + "' must be a string");
        }
        return value.toString();
    }

    String getChoice(String key, String defaultValue, String... choices)
        throws ConfigurationException {
        String value = getString(key, defaultValue);
        if (!Arrays.asList(choices).contains(value)) {
            throw error(
                "argument '" + key + "' must be one of " + Arrays.toString(choices) + ", got: "
                    + value);
        }
        return value;
    }

    boolean getBoolean(String key, boolean defaultValue) throws ConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw error("argument '" + key + "' must be true or false, got: " + value);
    }

    Map<String, Object> getMap(String key) throws ConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw error("argument '" + key + "' must be a mapping");
        }
        return RecordCodec.toStringKeyMap((Map<?, ?>) value);
    }

    private ConfigurationException error(String detail) {
        String errMsg = "Stage " + stage + ": " + detail;
        logArguments.error(errMsg);
        return new ConfigurationException(errMsg);
    }
}
