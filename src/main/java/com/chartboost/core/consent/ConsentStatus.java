package com.chartboost.core.consent;

public enum ConsentStatus {

    GRANTED,

    DENIED,

    UNKNOWN;

    public static ConsentStatus of(boolean granted) {
        return granted ? GRANTED : DENIED;
    }

    /**
     * Snapshot value for this status, {@code null} when unknown.
     */
    public ConsentValue toConsentValue() {
        return switch (this) {
            case GRANTED -> ConsentValue.GRANTED;
            case DENIED -> ConsentValue.DENIED;
            case UNKNOWN -> null;
        };
    }
}
