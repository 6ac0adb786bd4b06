/* (C)2026 */
package com.ammann.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static configuration of the monitored mission: the redline table, which also defines
 * the set of monitored parameters, and the named mission event markers.
 *
 * <p>Both maps preserve insertion order and are never mutated after construction.
 *
 * @param redlines      redline limits keyed by parameter name
 * @param missionEvents mission event times in seconds keyed by event name
 */
public record MissionProfile(Map<String, RedlineLimit> redlines, Map<String, Double> missionEvents) {

    public MissionProfile {
        redlines = Collections.unmodifiableMap(new LinkedHashMap<>(redlines));
        missionEvents = Collections.unmodifiableMap(new LinkedHashMap<>(missionEvents));
    }

    /**
     * Display label for a parameter, falling back to the raw name when it has no redline.
     *
     * @param parameter parameter name
     * @return label shown in reports
     */
    public String labelOf(String parameter) {
        RedlineLimit limit = redlines.get(parameter);
        return limit != null && limit.label() != null ? limit.label() : parameter;
    }

    /**
     * Display unit for a parameter, empty when it has no redline.
     *
     * @param parameter parameter name
     * @return unit shown in reports
     */
    public String unitOf(String parameter) {
        RedlineLimit limit = redlines.get(parameter);
        return limit != null ? limit.unit() : "";
    }

    /**
     * Launch profile for the SpaceX CRS-16 ascent telemetry.
     *
     * @return profile with the thirteen monitored parameters and five mission markers
     */
    public static MissionProfile crs16() {
        Map<String, RedlineLimit> redlines = new LinkedHashMap<>();
        redlines.put("velocity_ms", RedlineLimit.of(-50, 8200, "m/s", "Velocity"));
        redlines.put("altitude_km", RedlineLimit.of(-1, 250, "km", "Altitude"));
        redlines.put("velocity_y_ms", RedlineLimit.of(-200, 2000, "m/s", "Vertical Velocity"));
        redlines.put("velocity_x_ms", RedlineLimit.of(-50, 8200, "m/s", "Horizontal Velocity"));
        redlines.put("acceleration_ms2", RedlineLimit.of(0, 40, "m/s2", "Acceleration"));
        redlines.put("downrange_distance_km", RedlineLimit.of(-1, 1500, "km", "Downrange Distance"));
        redlines.put("angle_deg", RedlineLimit.of(-5, 92, "deg", "Flight Angle"));
        redlines.put("dynamic_pressure_pa", RedlineLimit.of(0, 35000, "Pa", "Dynamic Pressure (Q)"));
        redlines.put("jerk_ms3", RedlineLimit.of(-25, 25, "m/s3", "Jerk"));
        redlines.put("altitude_rate_kms", RedlineLimit.of(-0.5, 2.5, "km/s", "Altitude Rate"));
        redlines.put("velocity_rate_ms2", RedlineLimit.of(-30, 45, "m/s2", "Velocity Rate"));
        redlines.put("angle_rate_degs", RedlineLimit.of(-5, 1, "deg/s", "Angle Rate"));
        redlines.put("mach_number", RedlineLimit.of(0, 25, "", "Mach Number"));

        Map<String, Double> events = new LinkedHashMap<>();
        events.put("maxq", 54.0);
        events.put("throttle_down_start", 48.0);
        events.put("throttle_down_end", 68.0);
        events.put("meco", 145.0);
        events.put("ses1", 156.0);

        return new MissionProfile(redlines, events);
    }
}
