package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class UsercentricsOptions {

    @Builder.Default
    String settingsId = "";

    @Builder.Default
    String defaultLanguage = "en";

    @Builder.Default
    String version = "latest";

    @Builder.Default
    long timeoutMillis = 5000L;

    @Builder.Default
    UsercentricsLoggerLevel loggerLevel = UsercentricsLoggerLevel.DEBUG;

    @Builder.Default
    String ruleSetId = "";

    boolean consentMediation;
}
