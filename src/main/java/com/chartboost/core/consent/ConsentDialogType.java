package com.chartboost.core.consent;

import lombok.Value;

/**
 * Kind of consent dialog to present. The set is open, CMP adapters decide which types they support.
 */
@Value(staticConstructor = "of")
public class ConsentDialogType {

    public static final ConsentDialogType CONCISE = ConsentDialogType.of("concise");

    public static final ConsentDialogType DETAILED = ConsentDialogType.of("detailed");

    String value;
}
