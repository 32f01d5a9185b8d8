package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Value;

import java.util.List;

@Value(staticConstructor = "of")
public class UsercentricsReadyStatus {

    boolean shouldCollectConsent;

    List<UsercentricsServiceConsent> consents;
}
