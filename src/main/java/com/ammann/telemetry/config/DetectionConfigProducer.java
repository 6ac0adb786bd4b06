/* (C)2026 */
package com.ammann.telemetry.config;

import com.ammann.telemetry.detection.DetectionSettings;
import com.ammann.telemetry.model.MissionProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the detection thresholds and the static mission profile.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>telemetry.detection.zscore-threshold</li>
 *   <li>telemetry.detection.rate-multiplier</li>
 *   <li>telemetry.detection.sustained-window</li>
 *   <li>telemetry.detection.sustained-sigma</li>
 *   <li>telemetry.detection.sustained-min-coverage</li>
 *   <li>telemetry.detection.cluster-window-seconds</li>
 * </ul>
 *
 * <p>Both products are immutable records and therefore produced as {@code @Singleton}
 * rather than behind a client proxy.
 */
@ApplicationScoped
public class DetectionConfigProducer {

    private static final Logger LOG = Logger.getLogger(DetectionConfigProducer.class);

    @ConfigProperty(name = "telemetry.detection.zscore-threshold", defaultValue = "3.0")
    double zScoreThreshold = DetectionSettings.DEFAULT_Z_SCORE_THRESHOLD;

    @ConfigProperty(name = "telemetry.detection.rate-multiplier", defaultValue = "5.0")
    double rateMultiplier = DetectionSettings.DEFAULT_RATE_MULTIPLIER;

    @ConfigProperty(name = "telemetry.detection.sustained-window", defaultValue = "20")
    int sustainedWindow = DetectionSettings.DEFAULT_SUSTAINED_WINDOW;

    @ConfigProperty(name = "telemetry.detection.sustained-sigma", defaultValue = "2.0")
    double sustainedSigma = DetectionSettings.DEFAULT_SUSTAINED_SIGMA;

    @ConfigProperty(name = "telemetry.detection.sustained-min-coverage", defaultValue = "0.8")
    double sustainedMinCoverage = DetectionSettings.DEFAULT_SUSTAINED_MIN_COVERAGE;

    @ConfigProperty(name = "telemetry.detection.cluster-window-seconds", defaultValue = "10.0")
    double clusterWindowSeconds = DetectionSettings.DEFAULT_CLUSTER_WINDOW_SECONDS;

    /**
     * Produces the detection thresholds from configuration.
     *
     * @return validated detection settings
     * @throws IllegalArgumentException if a configured value is out of range
     */
    @Produces
    @Singleton
    public DetectionSettings detectionSettings() {
        DetectionSettings settings =
                new DetectionSettings(
                        zScoreThreshold,
                        rateMultiplier,
                        sustainedWindow,
                        sustainedSigma,
                        sustainedMinCoverage,
                        clusterWindowSeconds);
        LOG.infof("Detection settings: %s", settings);
        return settings;
    }

    /**
     * Produces the mission profile holding the redline table and mission event markers.
     *
     * @return the CRS-16 launch profile
     */
    @Produces
    @Singleton
    public MissionProfile missionProfile() {
        return MissionProfile.crs16();
    }
}
