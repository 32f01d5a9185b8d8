package com.chartboost.core.consent.usercentrics.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Adapter section of the backend configuration, as sent.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class UsercentricsAdapterProperties {

    String coreDpsName;

    UsercentricsOptionsProperties options;

    Map<String, String> partnerIdMap;
}
