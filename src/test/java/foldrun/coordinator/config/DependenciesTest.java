package foldrun.coordinator.config;

import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.store.Database;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    @TempDir
    Path workDir;

    private CoordinatorConfig stubConfig() {
        return CoordinatorConfig.defaults()
                .withWorkDir(workDir)
                .withEngineMode(EngineMode.STUB)
                .withStubDelay(Duration.ofMillis(20));
    }

    @Test
    void wiresWithoutMirror() {
        try (Dependencies deps = Dependencies.create(stubConfig())) {
            assertNull(deps.sinkForwarder());
            assertEquals(2, deps.routerHandler().controllerCount());
            assertSame(deps.routerHandler(), deps.routerHandler());
            assertEquals("stub", deps.engineResolver().activeEngineName());
        }
    }

    @Test
    void succeededJobsReachMirror() throws Exception {
        String url = "jdbc:h2:mem:deps-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1";
        try (Dependencies deps = Dependencies.create(stubConfig().withSink(url))) {
            assertNotNull(deps.sinkForwarder());

            String id = deps.jobService().submit("mirrored", "ACDE", null, null);
            await().atMost(Duration.ofSeconds(10))
                    .until(() -> deps.jobService().getStatus(id).status() == JobStatus.SUCCEEDED);
            await().atMost(Duration.ofSeconds(10)).until(() -> deps.sinkForwarder().forwardedCount() == 1);
        }

        try (Database db = new Database(url, 1);
                Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT engine, sequence FROM fold_results WHERE job_id = ?")) {
            ps.setString(1, "mirrored");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("stub", rs.getString("engine"));
                assertEquals("ACDE", rs.getString("sequence"));
            }
        }
    }

    @Test
    void unreachableMirrorIsNotFatal() {
        CoordinatorConfig config = stubConfig().withSink("jdbc:nosuchdriver://localhost/foldrun");
        try (Dependencies deps = Dependencies.create(config)) {
            assertNull(deps.sinkForwarder());
            assertNotNull(deps.jobService());
        }
    }

    @Test
    void recoveryCanBeDisabled() {
        try (Dependencies deps = Dependencies.create(stubConfig().withRecoverOnStartup(false))) {
            assertEquals(0, deps.recoverJobs());
        }
    }
}
