/* (C)2026 */
package com.ammann.telemetry.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area (telemetry, anomalies, mission) to ensure
 * consistent path naming and simplify path refactoring.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Dataset status endpoint path. */
    public static final String STATUS = "/status";

    /** Column statistics endpoint path. */
    public static final String STATS = "/stats";

    /**
     * Telemetry data endpoints
     */
    public static final class Telemetry {
        private Telemetry() {}

        public static final String BASE = "/telemetry";
        public static final String UPLOAD = BASE + "/upload";
        public static final String COLUMNS = BASE + "/columns";
    }

    /**
     * Anomaly detection endpoints
     */
    public static final class Anomalies {
        private Anomalies() {}

        public static final String BASE = "/anomalies";
        public static final String SUMMARY = BASE + "/summary";
        public static final String EVENTS = BASE + "/events";
    }

    /**
     * Static mission configuration endpoints
     */
    public static final class Mission {
        private Mission() {}

        public static final String REDLINES = "/redlines";
        public static final String EVENTS = "/mission-events";
    }
}
