package com.umitunal.cronrelay.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a validator check. Rejections carry a message and the values that were checked.
 */
public final class ValidationResult {
    private static final ValidationResult ALLOWED = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String error;
    private final Map<String, Object> details;

    private ValidationResult(boolean valid, String error, Map<String, Object> details) {
        this.valid = valid;
        this.error = error;
        this.details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationResult allowed() {
        return ALLOWED;
    }

    public static ValidationResult rejected(String error, Map<String, Object> details) {
        return new ValidationResult(false, error, details);
    }

    public boolean isValid() { return valid; }

    /** Null when valid. */
    public String getError() { return error; }

    public Map<String, Object> getDetails() { return details; }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{rejected: " + error + "}";
    }
}
