package com.chartboost.core.initialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Future;

/**
 * Module started by the core SDK after its backend configuration has been applied.
 */
public interface InitializableModule {

    String moduleId();

    String moduleVersion();

    /**
     * Applies the module's part of the backend configuration. Never throws, invalid payloads are ignored.
     */
    void updateProperties(JsonNode configuration);

    Future<Void> initialize(ModuleInitializationConfiguration configuration);
}
