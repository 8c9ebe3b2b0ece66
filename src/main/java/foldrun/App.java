package foldrun;

import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.config.Dependencies;
import foldrun.coordinator.server.FoldNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Service entry point.
 *
 * Usage: {@code java -jar foldrun-coordinator.jar [config.ini]}. Without an
 * argument the INI path is taken from {@code FOLDRUN_CONFIG}, and without
 * that the configuration comes from the environment.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        CoordinatorConfig config = loadConfig(args);

        Dependencies deps = Dependencies.create(config);
        FoldNettyServer server = new FoldNettyServer(deps.routerHandler(), config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "foldrun-shutdown"));

        deps.recoverJobs();
        server.start();
        log.info("Folding coordinator ready on port {}", server.port());

        stopped.await();
    }

    static CoordinatorConfig loadConfig(String[] args) throws IOException {
        String path = args.length > 0 ? args[0] : System.getenv("FOLDRUN_CONFIG");
        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from {}", path);
            return CoordinatorConfig.fromIni(new File(path));
        }
        return CoordinatorConfig.fromEnv();
    }
}
