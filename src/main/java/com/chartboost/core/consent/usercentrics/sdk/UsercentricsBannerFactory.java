package com.chartboost.core.consent.usercentrics.sdk;

@FunctionalInterface
public interface UsercentricsBannerFactory {

    /**
     * @param bannerSettings look and feel of the dialog, {@code null} for the SDK defaults
     */
    UsercentricsBanner create(BannerSettings bannerSettings);
}
