package com.chartboost.core.consent.usercentrics.sdk;

import io.vertx.core.Handler;

/**
 * Consent dialog supplied by the SDK. Must be used from the main context.
 */
public interface UsercentricsBanner {

    void showFirstLayer(Handler<UsercentricsConsentUserResponse> callback);

    void showSecondLayer(Handler<UsercentricsConsentUserResponse> callback);
}
