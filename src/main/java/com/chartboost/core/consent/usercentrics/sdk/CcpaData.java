package com.chartboost.core.consent.usercentrics.sdk;

import lombok.Value;

/**
 * US privacy data. {@code optedOut} is {@code null} when the user has not made a choice.
 */
@Value(staticConstructor = "of")
public class CcpaData {

    Boolean optedOut;

    String uspString;
}
