/* (C)2026 */
package com.ammann.carbon.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path parameter holding a region or free-text location. */
    public static final String REGION_PARAM = "region";

    /**
     * Carbon intelligence endpoints
     */
    public static final class Carbon {
        private Carbon() {}

        public static final String BASE = "/carbon";
        public static final String REGION = BASE + "/{" + REGION_PARAM + "}";
        public static final String RELATIVE = REGION + "/relative";
        public static final String GREEN_HOURS = REGION + "/green-hours";
        public static final String TRENDS = REGION + "/trends";
        public static final String STRATEGY = REGION + "/strategy";
        public static final String PATTERNS = BASE + "/patterns";
        public static final String PATTERN = PATTERNS + "/{" + REGION_PARAM + "}";
    }
}
