package foldrun.coordinator.sink;

import foldrun.coordinator.model.JobCompletion;
import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.JobParams;
import foldrun.coordinator.model.Protocol;
import foldrun.coordinator.store.Database;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPersistenceSinkTest {

    private static Database db;
    private static JdbcPersistenceSink sink;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        db = new Database("jdbc:h2:mem:test-sink;DB_CLOSE_DELAY=-1", 2);
        sink = new JdbcPersistenceSink(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanResults() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM fold_results");
            conn.commit();
        }
    }

    private static JobCompletion completion(String jobId, String sequence, String pdb, Double energy) {
        JobInput input = JobInput.builder()
                .jobId(jobId)
                .sequence(sequence)
                .params(new JobParams(Protocol.FOLD, 1, null, true))
                .submittedAt(Instant.now())
                .build();
        return new JobCompletion(input, pdb, energy, "lattice",
                Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    void insertsNewResult() throws Exception {
        sink.upsert(completion("m-1", "ACDE", "ATOM\nEND\n", -4.5));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT status, sequence, protocol, engine, artifact_content, energy, completed_at "
                                + "FROM fold_results WHERE job_id = ?")) {
            ps.setString(1, "m-1");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("succeeded", rs.getString("status"));
                assertEquals("ACDE", rs.getString("sequence"));
                assertEquals("fold", rs.getString("protocol"));
                assertEquals("lattice", rs.getString("engine"));
                assertEquals("ATOM\nEND\n", rs.getString("artifact_content"));
                assertEquals(-4.5, rs.getDouble("energy"));
                assertEquals(Instant.parse("2026-03-01T12:00:00Z"), rs.getTimestamp("completed_at").toInstant());
                assertFalse(rs.next());
            }
        }
    }

    @Test
    void upsertReplacesExistingRow() throws Exception {
        sink.upsert(completion("m-2", "AAAA", "OLD", -1.0));
        sink.upsert(completion("m-2", "WWWW", "NEW", null));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT COUNT(*), MAX(sequence), MAX(artifact_content), MAX(energy) "
                                + "FROM fold_results WHERE job_id = ?")) {
            ps.setString(1, "m-2");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1));
                assertEquals("WWWW", rs.getString(2));
                assertEquals("NEW", rs.getString(3));
                rs.getDouble(4);
                assertTrue(rs.wasNull());
            }
        }
    }

    @Test
    void healthyWhileDatabaseOpen() {
        assertTrue(sink.isHealthy());
    }
}
