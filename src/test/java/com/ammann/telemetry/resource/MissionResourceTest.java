/* (C)2026 */
package com.ammann.telemetry.resource;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.telemetry.model.MissionProfile;
import com.ammann.telemetry.model.RedlineLimit;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MissionResourceTest {

    private MissionResource resource;

    @BeforeEach
    void setUp() {
        resource = new MissionResource();
        resource.profile = MissionProfile.crs16();
    }

    @Test
    @SuppressWarnings("unchecked")
    void returnsRedlineTable() {
        Map<String, RedlineLimit> redlines = (Map<String, RedlineLimit>) resource.getRedlines().getEntity();

        assertThat(redlines).hasSize(13);
        assertThat(redlines.get("dynamic_pressure_pa").max()).isEqualTo(35000.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void returnsMissionEvents() {
        Map<String, Double> events = (Map<String, Double>) resource.getMissionEvents().getEntity();

        assertThat(events).containsEntry("meco", 145.0).containsEntry("ses1", 156.0);
    }
}
