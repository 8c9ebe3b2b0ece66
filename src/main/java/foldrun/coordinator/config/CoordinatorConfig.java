package foldrun.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";
    private int maxRequestBytes = 1024 * 1024;

    // Store settings
    private Path workDir = Path.of("./work");

    // Dispatcher settings
    private int maxConcurrentJobs = 2;
    private int queueCapacity = 64;
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private boolean recoverOnStartup = true;

    // Engine settings
    private EngineMode engineMode = EngineMode.AUTO;
    private Duration stubDelay = Duration.ofSeconds(2);
    private int relaxSteps = 200;
    private int maxSequenceLength = 2000;

    // Result mirror settings
    private boolean sinkEnabled = false;
    private String sinkDatabaseUrl = "jdbc:h2:file:./data/foldrun;AUTO_SERVER=TRUE";
    private int sinkPoolSize = 4;
    private int sinkQueueCapacity = 256;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return defaults().applyEnv();
    }

    /**
     * Load settings from an INI file, then apply environment overrides.
     *
     * <pre>
     * [server]     port, host, max_request_bytes
     * [store]      work_dir
     * [dispatcher] max_concurrent, queue_capacity, shutdown_grace_seconds, recover_on_startup
     * [engine]     mode, stub_delay_ms, relax_steps, max_sequence_length
     * [sink]       enabled, database_url, pool_size, queue_capacity
     * </pre>
     */
    public static CoordinatorConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        CoordinatorConfig config = new CoordinatorConfig();

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverPort = opt(server, "port", Integer::parseInt, config.serverPort);
            config.serverHost = opt(server, "host", Function.identity(), config.serverHost);
            config.maxRequestBytes = opt(server, "max_request_bytes", Integer::parseInt, config.maxRequestBytes);
        }

        Profile.Section store = ini.get("store");
        if (store != null) {
            config.workDir = opt(store, "work_dir", Path::of, config.workDir);
        }

        Profile.Section dispatcher = ini.get("dispatcher");
        if (dispatcher != null) {
            config.maxConcurrentJobs = opt(dispatcher, "max_concurrent", Integer::parseInt, config.maxConcurrentJobs);
            config.queueCapacity = opt(dispatcher, "queue_capacity", Integer::parseInt, config.queueCapacity);
            config.shutdownGracePeriod = opt(dispatcher, "shutdown_grace_seconds",
                    s -> Duration.ofSeconds(Long.parseLong(s)), config.shutdownGracePeriod);
            config.recoverOnStartup = opt(dispatcher, "recover_on_startup", Boolean::parseBoolean,
                    config.recoverOnStartup);
        }

        Profile.Section engine = ini.get("engine");
        if (engine != null) {
            config.engineMode = opt(engine, "mode", EngineMode::parse, config.engineMode);
            config.stubDelay = opt(engine, "stub_delay_ms",
                    s -> Duration.ofMillis(Long.parseLong(s)), config.stubDelay);
            config.relaxSteps = opt(engine, "relax_steps", Integer::parseInt, config.relaxSteps);
            config.maxSequenceLength = opt(engine, "max_sequence_length", Integer::parseInt,
                    config.maxSequenceLength);
        }

        Profile.Section sink = ini.get("sink");
        if (sink != null) {
            config.sinkEnabled = opt(sink, "enabled", Boolean::parseBoolean, config.sinkEnabled);
            config.sinkDatabaseUrl = opt(sink, "database_url", Function.identity(), config.sinkDatabaseUrl);
            config.sinkPoolSize = opt(sink, "pool_size", Integer::parseInt, config.sinkPoolSize);
            config.sinkQueueCapacity = opt(sink, "queue_capacity", Integer::parseInt, config.sinkQueueCapacity);
        }

        return config.applyEnv().validate();
    }

    private CoordinatorConfig applyEnv() {
        String port = System.getenv("FOLDRUN_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String workDirEnv = System.getenv("FOLDRUN_WORK_DIR");
        if (workDirEnv != null && !workDirEnv.isBlank()) {
            workDir = Path.of(workDirEnv);
        }

        String maxConcurrent = System.getenv("FOLDRUN_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            maxConcurrentJobs = Integer.parseInt(maxConcurrent);
        }

        String queue = System.getenv("FOLDRUN_QUEUE_CAPACITY");
        if (queue != null && !queue.isBlank()) {
            queueCapacity = Integer.parseInt(queue);
        }

        String mode = System.getenv("FOLDRUN_ENGINE_MODE");
        if (mode != null && !mode.isBlank()) {
            engineMode = EngineMode.parse(mode);
        }

        String sinkUrl = System.getenv("FOLDRUN_SINK_DB_URL");
        if (sinkUrl != null && !sinkUrl.isBlank()) {
            sinkDatabaseUrl = sinkUrl;
            sinkEnabled = true;
        }

        return this;
    }

    private CoordinatorConfig validate() {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("max_concurrent must be at least 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queue_capacity must be at least 1");
        }
        if (maxSequenceLength < 1) {
            throw new IllegalArgumentException("max_sequence_length must be at least 1");
        }
        return this;
    }

    private static <T> T opt(Profile.Section section, String key, Function<String, T> parser, T fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return parser.apply(value.trim());
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxRequestBytes() {
        return maxRequestBytes;
    }

    public Path workDir() {
        return workDir;
    }

    public int maxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public Duration shutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public boolean recoverOnStartup() {
        return recoverOnStartup;
    }

    public EngineMode engineMode() {
        return engineMode;
    }

    public Duration stubDelay() {
        return stubDelay;
    }

    public int relaxSteps() {
        return relaxSteps;
    }

    public int maxSequenceLength() {
        return maxSequenceLength;
    }

    public boolean sinkEnabled() {
        return sinkEnabled;
    }

    public String sinkDatabaseUrl() {
        return sinkDatabaseUrl;
    }

    public int sinkPoolSize() {
        return sinkPoolSize;
    }

    public int sinkQueueCapacity() {
        return sinkQueueCapacity;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withWorkDir(Path dir) {
        this.workDir = dir;
        return this;
    }

    public CoordinatorConfig withMaxConcurrentJobs(int max) {
        this.maxConcurrentJobs = max;
        return this;
    }

    public CoordinatorConfig withQueueCapacity(int capacity) {
        this.queueCapacity = capacity;
        return this;
    }

    public CoordinatorConfig withShutdownGracePeriod(Duration grace) {
        this.shutdownGracePeriod = grace;
        return this;
    }

    public CoordinatorConfig withRecoverOnStartup(boolean recover) {
        this.recoverOnStartup = recover;
        return this;
    }

    public CoordinatorConfig withEngineMode(EngineMode mode) {
        this.engineMode = mode;
        return this;
    }

    public CoordinatorConfig withStubDelay(Duration delay) {
        this.stubDelay = delay;
        return this;
    }

    public CoordinatorConfig withRelaxSteps(int steps) {
        this.relaxSteps = steps;
        return this;
    }

    public CoordinatorConfig withMaxSequenceLength(int length) {
        this.maxSequenceLength = length;
        return this;
    }

    public CoordinatorConfig withSink(String databaseUrl) {
        this.sinkEnabled = databaseUrl != null;
        this.sinkDatabaseUrl = databaseUrl;
        return this;
    }

    public CoordinatorConfig withSinkQueueCapacity(int capacity) {
        this.sinkQueueCapacity = capacity;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "serverPort=" + serverPort +
                ", workDir='" + workDir + '\'' +
                ", maxConcurrentJobs=" + maxConcurrentJobs +
                ", queueCapacity=" + queueCapacity +
                ", engineMode=" + engineMode +
                ", sinkEnabled=" + sinkEnabled +
                '}';
    }
}
