package org.metalad.add;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options of a metadata add: values merged into the record before validation and the checks
 * that may be relaxed.
 */
public final class AddParameters {
    private final Map<String, Object> additionalValues;
    private final boolean allowOverride;
    private final boolean allowUnknown;
    private final boolean allowIdMismatch;

    /**
     * @param additionalValues Keys added to the metadata, may be null
     * @param allowOverride    Additional values may replace keys of the metadata
     * @param allowUnknown     Unknown keys are ignored instead of rejected
     * @param allowIdMismatch  A record of another dataset may be added, only a warning is logged
     */
    public AddParameters(
        Map<String, Object> additionalValues, boolean allowOverride, boolean allowUnknown,
        boolean allowIdMismatch) {
        this.additionalValues = Collections.unmodifiableMap(new LinkedHashMap<>(
            additionalValues == null ? Collections.emptyMap() : additionalValues));
        this.allowOverride = allowOverride;
        this.allowUnknown = allowUnknown;
        this.allowIdMismatch = allowIdMismatch;
    }

    public static AddParameters defaults() {
        return new AddParameters(null, false, false, false);
    }

    public Map<String, Object> getAdditionalValues() {
        return additionalValues;
    }

    public boolean isAllowOverride() {
        return allowOverride;
    }

    public boolean isAllowUnknown() {
        return allowUnknown;
    }

    public boolean isAllowIdMismatch() {
        return allowIdMismatch;
    }
}
