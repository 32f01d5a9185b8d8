package com.chartboost.core.error;

/**
 * Failure codes reported by consent operations.
 */
public enum ConsentError {

    /**
     * The CMP never reached the ready state, or no options were available to initialize it.
     */
    INITIALIZATION_ERROR("Consent management platform failed to initialize"),

    /**
     * The requested dialog type is not supported by the CMP.
     */
    DIALOG_SHOW_ERROR("Unable to show consent dialog"),

    /**
     * An unexpected failure escaped a consent action.
     */
    UNKNOWN("Unknown consent error");

    private final String message;

    ConsentError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
