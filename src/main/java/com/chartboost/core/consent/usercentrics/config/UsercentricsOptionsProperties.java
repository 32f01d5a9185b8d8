package com.chartboost.core.consent.usercentrics.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class UsercentricsOptionsProperties {

    String settingsId;

    String defaultLanguage;

    String version;

    Long timeoutMillis;

    String loggerLevel;

    String ruleSetId;

    Boolean consentMediation;
}
