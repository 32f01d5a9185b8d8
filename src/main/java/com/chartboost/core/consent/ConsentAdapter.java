package com.chartboost.core.consent;

import io.vertx.core.Future;

import java.util.Map;

/**
 * Bridge between the core SDK and a consent management platform.
 * <p>
 * Every operation completes its {@link Future} exactly once and never fails with anything other than
 * {@link com.chartboost.core.error.ConsentException}.
 */
public interface ConsentAdapter {

    /**
     * Whether the CMP currently requires consent to be collected. {@code true} until the CMP has been read.
     */
    boolean shouldCollectConsent();

    /**
     * Read-only view of the current consents keyed by consent standard or partner id. Keys without a value
     * are absent.
     */
    Map<String, String> consents();

    ConsentStatus consentStatus();

    ConsentAdapterListener getListener();

    void setListener(ConsentAdapterListener listener);

    Future<Void> grantConsent(ConsentStatusSource statusSource);

    Future<Void> denyConsent(ConsentStatusSource statusSource);

    Future<Void> resetConsent();

    Future<Void> showConsentDialog(ConsentDialogType dialogType);
}
