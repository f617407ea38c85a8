package groundcontrol.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for ground-control settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    public static final int MIN_PARALLEL = 1;
    public static final int MAX_PARALLEL = 20;

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/ground-control;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Scheduling settings
    private int maxParallel = 3;
    private Duration pollInterval = Duration.ofMillis(500);

    // Execution settings
    private String defaultImplementer = "claude_code";
    private String defaultAgent = "developer";
    private Duration implementerTimeout = Duration.ofSeconds(600);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("GC_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String maxParallel = System.getenv("GC_MAX_PARALLEL");
        if (maxParallel != null && !maxParallel.isBlank()) {
            config.withMaxParallel(parseInt("GC_MAX_PARALLEL", maxParallel));
        }

        String pollMs = System.getenv("GC_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.withPollInterval(Duration.ofMillis(parseInt("GC_POLL_INTERVAL_MS", pollMs)));
        }

        String implementer = System.getenv("GC_IMPLEMENTER");
        if (implementer != null && !implementer.isBlank()) {
            config.defaultImplementer = implementer;
        }

        String timeout = System.getenv("GC_IMPLEMENTER_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.withImplementerTimeout(Duration.ofSeconds(parseInt("GC_IMPLEMENTER_TIMEOUT_SECONDS", timeout)));
        }

        return config;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int maxParallel() {
        return maxParallel;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public String defaultImplementer() {
        return defaultImplementer;
    }

    public String defaultAgent() {
        return defaultAgent;
    }

    public Duration implementerTimeout() {
        return implementerTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("databasePoolSize must be positive");
        }
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withMaxParallel(int maxParallel) {
        if (maxParallel < MIN_PARALLEL || maxParallel > MAX_PARALLEL) {
            throw new IllegalArgumentException(
                    "maxParallel must be between " + MIN_PARALLEL + " and " + MAX_PARALLEL + ", got: " + maxParallel);
        }
        this.maxParallel = maxParallel;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative");
        }
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withDefaultImplementer(String implementer) {
        this.defaultImplementer = implementer;
        return this;
    }

    public CoordinatorConfig withDefaultAgent(String agent) {
        this.defaultAgent = agent;
        return this;
    }

    public CoordinatorConfig withImplementerTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("implementerTimeout must be positive");
        }
        this.implementerTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", maxParallel=" + maxParallel +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", defaultImplementer='" + defaultImplementer + '\'' +
                ", implementerTimeout=" + implementerTimeout.toSeconds() + "s" +
                '}';
    }
}
