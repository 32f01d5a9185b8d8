package com.chartboost.core.consent;

/**
 * Who triggered a consent change.
 */
public enum ConsentStatusSource {

    USER,

    DEVELOPER,

    OTHER
}
