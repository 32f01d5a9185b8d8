package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Builder;
import lombok.Value;

/**
 * Look and feel of the Usercentrics consent dialogs.
 */
@Value
@Builder
public class BannerSettings {

    String logoUrl;

    String font;

    Integer fontSizeInSp;

    String firstLayerLayout;

    boolean showCloseButton;
}
