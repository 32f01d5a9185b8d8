package com.chartboost.core.consent.usercentrics.sdk;

public enum UsercentricsLoggerLevel {

    NONE,

    ERROR,

    WARNING,

    DEBUG
}
