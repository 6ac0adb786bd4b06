/* (C)2026 */
package com.ammann.telemetry.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MissionProfileTest {

    @Test
    void crs16ProfileDefinesRedlinesAndMarkers() {
        MissionProfile profile = MissionProfile.crs16();

        assertThat(profile.redlines()).hasSize(13);
        assertThat(profile.redlines().get("dynamic_pressure_pa"))
                .isEqualTo(RedlineLimit.of(0, 35000, "Pa", "Dynamic Pressure (Q)"));
        assertThat(profile.missionEvents())
                .containsEntry("maxq", 54.0)
                .containsEntry("meco", 145.0)
                .hasSize(5);
    }

    @Test
    void labelAndUnitFallBackForUnmonitoredParameters() {
        MissionProfile profile = MissionProfile.crs16();

        assertThat(profile.labelOf("velocity_ms")).isEqualTo("Velocity");
        assertThat(profile.unitOf("velocity_ms")).isEqualTo("m/s");
        assertThat(profile.labelOf("battery_v")).isEqualTo("battery_v");
        assertThat(profile.unitOf("battery_v")).isEmpty();
        assertThat(profile.unitOf("mach_number")).isEmpty();
    }

    @Test
    void redlineRejectsInvertedEnvelope() {
        assertThatThrownBy(() -> RedlineLimit.of(10, 5, "m", "Broken"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Broken");
    }
}
