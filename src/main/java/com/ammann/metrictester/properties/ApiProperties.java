/* (C)2026 */
package com.ammann.metrictester.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area (quadrats, registry, metrics, analysis, health)
 * to ensure consistent path naming and simplify path refactoring.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Quadrat placement and arena sampling endpoints
     */
    public static final class Quadrats {
        private Quadrats() {}

        public static final String BASE = "/quadrats";
        public static final String PLACE = "/place";
        public static final String SAMPLE = "/sample";
    }

    /**
     * Metric and null model catalogue endpoints
     */
    public static final class Registry {
        private Registry() {}

        public static final String BASE = "/registry";
        public static final String METRICS = "/metrics";
        public static final String NULLS = "/nulls";
    }

    /**
     * Observed metric endpoints
     */
    public static final class Metrics {
        private Metrics() {}

        public static final String BASE = "/metrics";
        public static final String OBSERVED = "/observed";
    }

    /**
     * Randomization analysis endpoints
     */
    public static final class Analysis {
        private Analysis() {}

        public static final String BASE = "/analysis";
        public static final String RUN = "/run";
        public static final String ROBUST_TEST = "/robust-test";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
