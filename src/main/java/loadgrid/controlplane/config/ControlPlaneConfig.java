package loadgrid.controlplane.config;

import java.time.Duration;

/**
 * Configuration holder for orchestrator and worker processes.
 * All settings have sensible defaults.
 */
public final class ControlPlaneConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/loadgrid;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Worker settings
    private Duration pollInterval = Duration.ofMillis(100);
    private Duration heartbeatInterval = Duration.ofSeconds(1);
    private Duration rendezvousTimeout = Duration.ofSeconds(120);

    // Orchestrator settings
    private Duration orchestratorPollInterval = Duration.ofSeconds(1);
    private Duration heartbeatTimeout = Duration.ofSeconds(10);
    private Duration drainTimeout = Duration.ofSeconds(120);

    private ControlPlaneConfig() {
    }

    public static ControlPlaneConfig defaults() {
        return new ControlPlaneConfig();
    }

    public static ControlPlaneConfig fromEnv() {
        ControlPlaneConfig config = new ControlPlaneConfig();

        String dbUrl = System.getenv("LOADGRID_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("LOADGRID_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        config.pollInterval = envMillis("LOADGRID_POLL_INTERVAL_MS", config.pollInterval);
        config.heartbeatInterval = envMillis("LOADGRID_HEARTBEAT_INTERVAL_MS", config.heartbeatInterval);
        config.rendezvousTimeout = envMillis("LOADGRID_RENDEZVOUS_TIMEOUT_MS", config.rendezvousTimeout);
        config.orchestratorPollInterval = envMillis("LOADGRID_ORCHESTRATOR_POLL_MS", config.orchestratorPollInterval);
        config.heartbeatTimeout = envMillis("LOADGRID_HEARTBEAT_TIMEOUT_MS", config.heartbeatTimeout);
        config.drainTimeout = envMillis("LOADGRID_DRAIN_TIMEOUT_MS", config.drainTimeout);

        return config;
    }

    private static Duration envMillis(String name, Duration fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Duration.ofMillis(Long.parseLong(value.trim()));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration rendezvousTimeout() {
        return rendezvousTimeout;
    }

    public Duration orchestratorPollInterval() {
        return orchestratorPollInterval;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration drainTimeout() {
        return drainTimeout;
    }

    // Fluent setters for testing/customization
    public ControlPlaneConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ControlPlaneConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public ControlPlaneConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public ControlPlaneConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public ControlPlaneConfig withRendezvousTimeout(Duration timeout) {
        this.rendezvousTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withOrchestratorPollInterval(Duration interval) {
        this.orchestratorPollInterval = interval;
        return this;
    }

    public ControlPlaneConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withDrainTimeout(Duration timeout) {
        this.drainTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "ControlPlaneConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", heartbeatInterval=" + heartbeatInterval.toMillis() + "ms" +
                ", heartbeatTimeout=" + heartbeatTimeout.toMillis() + "ms" +
                ", rendezvousTimeout=" + rendezvousTimeout.toMillis() + "ms" +
                '}';
    }
}
