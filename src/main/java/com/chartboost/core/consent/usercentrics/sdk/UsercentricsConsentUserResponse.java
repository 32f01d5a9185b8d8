package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Value;

@Value(staticConstructor = "of")
public class UsercentricsConsentUserResponse {

    String userInteraction;

    String controllerId;
}
