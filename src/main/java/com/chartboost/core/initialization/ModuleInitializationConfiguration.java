package com.chartboost.core.initialization;

import lombok.Value;

@Value(staticConstructor = "of")
public class ModuleInitializationConfiguration {

    String chartboostApplicationId;
}
