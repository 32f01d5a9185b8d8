package com.chartboost.core.consent.usercentrics.sdk;

@FunctionalInterface
public interface UsercentricsDisposableEvent {

    void dispose();
}
