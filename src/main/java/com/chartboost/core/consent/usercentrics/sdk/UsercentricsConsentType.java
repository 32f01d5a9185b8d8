package com.chartboost.core.consent.usercentrics.sdk;

public enum UsercentricsConsentType {

    EXPLICIT,

    IMPLICIT
}
