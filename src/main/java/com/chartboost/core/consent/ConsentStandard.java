package com.chartboost.core.consent;

/**
 * Regulatory consent representations tracked by every consent adapter. Partner keys are not part of
 * this set, they are discovered at runtime.
 */
public enum ConsentStandard {

    /**
     * IAB TCF consent string.
     */
    TCF("tcf"),

    /**
     * IAB US Privacy string.
     */
    USP("usp"),

    /**
     * CCPA opt-in flag, valued with {@link ConsentValue}.
     */
    CCPA_OPT_IN("ccpa_opt_in");

    private final String value;

    ConsentStandard(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Tells whether the given consent key belongs to a standard rather than to a partner.
     */
    public static boolean isStandard(String key) {
        for (ConsentStandard standard : values()) {
            if (standard.value.equals(key)) {
                return true;
            }
        }
        return false;
    }
}
