package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Value;

/**
 * Consent for a single data processing service.
 */
@Value(staticConstructor = "of")
public class UsercentricsServiceConsent {

    String templateId;

    String dataProcessor;

    boolean status;
}
