package com.chartboost.core.consent;

public enum ConsentValue {

    GRANTED,

    DENIED;

    public String value() {
        return name();
    }

    public static ConsentValue of(boolean granted) {
        return granted ? GRANTED : DENIED;
    }
}
