package org.metalad.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one extractor invocation
 */
public final class ExtractorResult {
    private final String extractorVersion;
    private final Map<String, Object> extractionParameter;
    private final boolean success;
    private final Map<String, Object> statusFields;
    private final JsonNode immediateData;

    public ExtractorResult(
        String extractorVersion, Map<String, Object> extractionParameter, boolean success,
        Map<String, Object> statusFields, JsonNode immediateData) {
        this.extractorVersion = extractorVersion;
        this.extractionParameter = Collections.unmodifiableMap(new LinkedHashMap<>(
            extractionParameter == null ? Collections.emptyMap() : extractionParameter));
        this.success = success;
        this.statusFields = Collections.unmodifiableMap(new LinkedHashMap<>(
            statusFields == null ? Collections.emptyMap() : statusFields));
        this.immediateData = immediateData;
    }

    public String getExtractorVersion() {
        return extractorVersion;
    }

    public Map<String, Object> getExtractionParameter() {
        return extractionParameter;
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getStatusFields() {
        return statusFields;
    }

    /**
     * @return Extracted metadata of IMMEDIATE extractors, null for EXTERNAL_FILE extractors
     */
    public JsonNode getImmediateData() {
        return immediateData;
    }
}
