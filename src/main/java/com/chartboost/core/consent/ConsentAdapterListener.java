package com.chartboost.core.consent;

/**
 * Receives consent changes detected by a {@link ConsentAdapter}. Callbacks are invoked on the adapter's
 * main context, exceptions they throw are logged and ignored.
 */
public interface ConsentAdapterListener {

    /**
     * Called once per consent key whose value changed. The new value, or its absence, is available
     * through {@link ConsentAdapter#consents()}.
     */
    void onConsentChange(String standard);

    default void onConsentStatusChange(ConsentStatus status) {
    }
}
