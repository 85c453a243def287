/* (C)2026 */
package com.ammann.biometrics.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Per-user resource root. */
    public static final String USER = "/users/{userId}";

    /**
     * Analytics endpoints
     */
    public static final class Analytics {
        private Analytics() {}

        public static final String BASE = USER + "/analytics";
        public static final String DAILY = "/daily";
        public static final String SCORE = "/score";
        public static final String CORRELATIONS = "/correlations";
        public static final String LAGGED_CORRELATIONS = CORRELATIONS + "/lagged";
        public static final String CORRELATION_MATRIX = CORRELATIONS + "/matrix";
        public static final String TRENDS = "/trends";
        public static final String CHANGE_POINTS = "/change-points";
    }

    /**
     * Alert endpoints
     */
    public static final class Alerts {
        private Alerts() {}

        public static final String BASE = USER + "/alerts";
        public static final String ACKNOWLEDGE = "/{alertId}/acknowledge";
        public static final String RESOLVE = "/{alertId}/resolve";
        public static final String DISMISS = "/{alertId}/dismiss";
    }

}
