package com.promptflow.promptflow_backend.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of checking a candidate edge. An invalid result blocks the edge;
 * a valid result may still carry an advisory {@code suggestion}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionResult(boolean valid, String message, String suggestion) {

    private static final ConnectionResult VALID = new ConnectionResult(true, null, null);

    public static ConnectionResult ok() {
        return VALID;
    }

    public static ConnectionResult okWithSuggestion(String suggestion) {
        return new ConnectionResult(true, null, suggestion);
    }

    public static ConnectionResult invalid(String message) {
        return new ConnectionResult(false, message, null);
    }

    public static ConnectionResult invalid(String message, String suggestion) {
        return new ConnectionResult(false, message, suggestion);
    }
}
