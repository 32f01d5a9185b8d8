package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Value;

@Value(staticConstructor = "of")
public class UsercentricsError {

    String message;

    Throwable cause;

    public static UsercentricsError of(String message) {
        return of(message, null);
    }
}
