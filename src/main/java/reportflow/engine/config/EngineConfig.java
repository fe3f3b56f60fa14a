package reportflow.engine.config;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Configuration holder for the reporting engine.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Job store
    private String databaseUrl = "jdbc:h2:file:./data/reportflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Reporting data source (queries run here); null means "same as the job store"
    private String sourceUrl = null;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Execution settings
    private Path outputDir = Path.of("./outputs");
    private int workerThreads = 4;
    private int queryTimeoutSeconds = 0; // 0 = no timeout
    private int maxRows = 0; // 0 = unlimited
    private ZoneId zone = ZoneId.systemDefault();

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String dbUrl = System.getenv("REPORTFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String sourceUrl = System.getenv("REPORTFLOW_SOURCE_URL");
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            config.sourceUrl = sourceUrl;
        }

        String port = System.getenv("REPORTFLOW_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String outputDir = System.getenv("REPORTFLOW_OUTPUT_DIR");
        if (outputDir != null && !outputDir.isBlank()) {
            config.outputDir = Path.of(outputDir);
        }

        String workers = System.getenv("REPORTFLOW_WORKER_THREADS");
        if (workers != null && !workers.isBlank()) {
            config.workerThreads = Integer.parseInt(workers);
        }

        String timeout = System.getenv("REPORTFLOW_QUERY_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.queryTimeoutSeconds = Integer.parseInt(timeout);
        }

        String zone = System.getenv("REPORTFLOW_ZONE");
        if (zone != null && !zone.isBlank()) {
            config.zone = ZoneId.of(zone);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    /**
     * JDBC URL of the data source report queries run against.
     * Falls back to the job store URL when not configured separately.
     */
    public String sourceUrl() {
        return sourceUrl != null ? sourceUrl : databaseUrl;
    }

    public boolean hasSeparateSource() {
        return sourceUrl != null && !sourceUrl.equals(databaseUrl);
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path outputDir() {
        return outputDir;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public int maxRows() {
        return maxRows;
    }

    public ZoneId zone() {
        return zone;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withSourceUrl(String url) {
        this.sourceUrl = url;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public EngineConfig withOutputDir(Path dir) {
        this.outputDir = dir;
        return this;
    }

    public EngineConfig withWorkerThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        this.workerThreads = threads;
        return this;
    }

    public EngineConfig withQueryTimeoutSeconds(int seconds) {
        this.queryTimeoutSeconds = seconds;
        return this;
    }

    public EngineConfig withMaxRows(int maxRows) {
        this.maxRows = maxRows;
        return this;
    }

    public EngineConfig withZone(ZoneId zone) {
        this.zone = zone;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", separateSource=" + hasSeparateSource() +
                ", serverPort=" + serverPort +
                ", outputDir=" + outputDir +
                ", workerThreads=" + workerThreads +
                ", queryTimeoutSeconds=" + queryTimeoutSeconds +
                ", zone=" + zone +
                '}';
    }
}
