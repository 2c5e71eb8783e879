package loadgrid.controlplane.config;

import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ControlPlaneConfigTest {

    @Test
    void fluentSettersOverrideDefaults() {
        ControlPlaneConfig config = ControlPlaneConfig.defaults()
                .withHeartbeatTimeout(Duration.ofMillis(300))
                .withPollInterval(Duration.ofMillis(20));

        assertEquals(Duration.ofMillis(300), config.heartbeatTimeout());
        assertEquals(Duration.ofMillis(20), config.pollInterval());
        assertEquals(Duration.ofSeconds(1), config.heartbeatInterval());
        assertEquals(Duration.ofSeconds(120), config.drainTimeout());
    }

    @Test
    void defaultsArePostgresCompatibleH2() {
        assertTrue(ControlPlaneConfig.defaults().databaseUrl().contains("MODE=PostgreSQL"));
    }
}
