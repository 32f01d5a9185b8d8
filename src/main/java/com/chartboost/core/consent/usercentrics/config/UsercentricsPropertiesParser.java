package com.chartboost.core.consent.usercentrics.config;

import com.chartboost.core.consent.usercentrics.ConsentReconciler;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsLoggerLevel;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsOptions;
import com.chartboost.core.json.JacksonMapper;
import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.json.DecodeException;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Objects;

/**
 * Turns the loosely typed adapter configuration into {@link UsercentricsAdapterConfiguration}.
 * <p>
 * Missing values fall back to the Usercentrics defaults, an unknown logger level falls back to
 * {@link UsercentricsLoggerLevel#DEBUG}.
 */
public class UsercentricsPropertiesParser {

    private static final String DEFAULT_LANGUAGE = "en";
    private static final String DEFAULT_VERSION = "latest";
    private static final long DEFAULT_TIMEOUT_MILLIS = 5000L;

    private final JacksonMapper mapper;

    public UsercentricsPropertiesParser(JacksonMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public UsercentricsAdapterConfiguration parse(JsonNode configuration) throws DecodeException {
        final UsercentricsAdapterProperties properties = configuration == null || configuration.isNull()
                ? new UsercentricsAdapterProperties()
                : mapper.decodeValue(configuration, UsercentricsAdapterProperties.class);

        final UsercentricsOptionsProperties optionsProperties = ObjectUtils.defaultIfNull(
                properties.getOptions(), new UsercentricsOptionsProperties());

        return UsercentricsAdapterConfiguration.builder()
                .coreDpsName(StringUtils.defaultIfBlank(
                        properties.getCoreDpsName(), ConsentReconciler.DEFAULT_CORE_DPS_NAME))
                .options(toOptions(optionsProperties))
                .partnerIdOverrides(properties.getPartnerIdMap() != null
                        ? Collections.unmodifiableMap(properties.getPartnerIdMap())
                        : Collections.emptyMap())
                .build();
    }

    private static UsercentricsOptions toOptions(UsercentricsOptionsProperties properties) {
        return UsercentricsOptions.builder()
                .settingsId(StringUtils.defaultString(properties.getSettingsId()))
                .defaultLanguage(StringUtils.defaultIfEmpty(properties.getDefaultLanguage(), DEFAULT_LANGUAGE))
                .version(StringUtils.defaultIfEmpty(properties.getVersion(), DEFAULT_VERSION))
                .timeoutMillis(ObjectUtils.defaultIfNull(properties.getTimeoutMillis(), DEFAULT_TIMEOUT_MILLIS))
                .loggerLevel(toLoggerLevel(properties.getLoggerLevel()))
                .ruleSetId(StringUtils.defaultString(properties.getRuleSetId()))
                .consentMediation(BooleanUtils.isTrue(properties.getConsentMediation()))
                .build();
    }

    private static UsercentricsLoggerLevel toLoggerLevel(String loggerLevel) {
        return EnumUtils.getEnumIgnoreCase(UsercentricsLoggerLevel.class, loggerLevel, UsercentricsLoggerLevel.DEBUG);
    }
}
