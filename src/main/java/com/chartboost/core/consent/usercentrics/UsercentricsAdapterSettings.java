package com.chartboost.core.consent.usercentrics;

import com.chartboost.core.consent.usercentrics.sdk.BannerSettings;
import com.chartboost.core.consent.usercentrics.sdk.UsercentricsOptions;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Construction-time settings of a {@link UsercentricsAdapter}. Immutable, so one instance may be shared by
 * several adapters.
 */
@Value
@Builder(toBuilder = true)
public class UsercentricsAdapterSettings {

    public static final UsercentricsAdapterSettings DEFAULT = UsercentricsAdapterSettings.builder().build();

    /**
     * Options used to initialize Usercentrics. Without them the adapter waits for
     * {@link UsercentricsAdapter#updateProperties}.
     */
    UsercentricsOptions options;

    /**
     * Name of the Data Processing Service defined in the Usercentrics dashboard for the Chartboost Core SDK.
     */
    @Builder.Default
    String coreDpsName = ConsentReconciler.DEFAULT_CORE_DPS_NAME;

    /**
     * Look and feel of the consent dialogs, {@code null} for the Usercentrics defaults.
     */
    BannerSettings bannerSettings;

    @Builder.Default
    Map<String, String> partnerIdOverrides = Collections.emptyMap();
}
