package com.chartboost.core.consent.usercentrics.config;

import com.chartboost.core.consent.usercentrics.sdk.UsercentricsOptions;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Adapter configuration with defaults applied.
 */
@Value
@Builder
public class UsercentricsAdapterConfiguration {

    String coreDpsName;

    UsercentricsOptions options;

    Map<String, String> partnerIdOverrides;
}
