package foldrun.coordinator.config;

import foldrun.coordinator.api.v1.HealthController;
import foldrun.coordinator.api.v1.JobController;
import foldrun.coordinator.engine.EngineResolver;
import foldrun.coordinator.engine.LatticeFoldingEngine;
import foldrun.coordinator.engine.StubFoldingEngine;
import foldrun.coordinator.repository.JobStore;
import foldrun.coordinator.scheduler.ExecutionDispatcher;
import foldrun.coordinator.scheduler.JobRecovery;
import foldrun.coordinator.server.RouterHandler;
import foldrun.coordinator.service.JobService;
import foldrun.coordinator.sink.JdbcPersistenceSink;
import foldrun.coordinator.sink.JobCompletionListener;
import foldrun.coordinator.sink.SinkForwarder;
import foldrun.coordinator.store.Database;
import foldrun.coordinator.store.FileJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.recoverJobs(); // settle jobs left by a previous process
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final JobStore jobStore;
    private final EngineResolver engineResolver;
    private final Database database;
    private final SinkForwarder sinkForwarder;
    private final ExecutionDispatcher dispatcher;
    private final JobService jobService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.jobStore = new FileJobStore(config);
        this.engineResolver = new EngineResolver(
                new LatticeFoldingEngine(config),
                new StubFoldingEngine(config),
                config.engineMode());

        // Result mirror, optional and never fatal
        Database db = null;
        SinkForwarder forwarder = null;
        if (config.sinkEnabled()) {
            try {
                db = new Database(config);
                forwarder = new SinkForwarder(new JdbcPersistenceSink(db), config.sinkQueueCapacity());
            } catch (RuntimeException e) {
                log.warn("Result mirror unavailable, continuing without it: {}", e.getMessage());
                if (db != null) {
                    db.close();
                    db = null;
                }
            }
        }
        this.database = db;
        this.sinkForwarder = forwarder;
        JobCompletionListener listener = forwarder != null ? forwarder : JobCompletionListener.NONE;

        // Services
        this.dispatcher = new ExecutionDispatcher(jobStore, engineResolver, listener, config);
        this.jobService = new JobService(jobStore, dispatcher, config);

        // Controllers (public API)
        this.healthController = new HealthController(engineResolver);
        this.jobController = new JobController(jobService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public EngineResolver engineResolver() {
        return engineResolver;
    }

    public ExecutionDispatcher dispatcher() {
        return dispatcher;
    }

    public JobService jobService() {
        return jobService;
    }

    /**
     * @return the mirror forwarder, or null when the mirror is disabled or unreachable
     */
    public SinkForwarder sinkForwarder() {
        return sinkForwarder;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Settle jobs left behind by a previous process, if enabled.
     */
    public int recoverJobs() {
        if (!config.recoverOnStartup()) {
            log.info("Job recovery disabled");
            return 0;
        }
        return new JobRecovery(jobStore, dispatcher).recover();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop dispatcher first so in-flight runs can still hand off results
        try {
            dispatcher.shutdown();
        } catch (Exception e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        if (sinkForwarder != null) {
            try {
                sinkForwarder.close();
            } catch (Exception e) {
                log.warn("Error stopping result mirror: {}", e.getMessage());
            }
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
