package com.chartboost.core.consent.usercentrics.sdk;

import io.vertx.core.Handler;

/**
 * Operations of the Usercentrics CMP SDK consumed by the adapter.
 * <p>
 * Callbacks may be invoked on any thread chosen by the SDK.
 */
public interface UsercentricsSdk {

    void initialize(UsercentricsOptions options);

    /**
     * Resolves once the SDK has loaded its consent data, or failed to do so. Exactly one of the handlers is
     * expected to be called, but callers must tolerate both or neither.
     */
    void isReady(Handler<UsercentricsReadyStatus> onSuccess, Handler<UsercentricsError> onFailure);

    void reset();

    void acceptAll(UsercentricsConsentType consentType);

    void denyAll(UsercentricsConsentType consentType);

    CcpaData getUspData();

    void getTcfData(Handler<TcfData> callback);

    /**
     * Subscribes to consent changes made outside of the adapter, for example through the SDK's own UI.
     */
    UsercentricsDisposableEvent onConsentUpdated(Handler<UpdatedConsentEvent> callback);
}
