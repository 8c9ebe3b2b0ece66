package foldrun.coordinator.store;

import foldrun.coordinator.model.InputUnreadableException;
import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.JobNotFoundException;
import foldrun.coordinator.model.JobParams;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.Protocol;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.model.StatusUnreadableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileJobStoreTest {

    @TempDir
    Path root;

    private FileJobStore store;

    @BeforeEach
    void setUp() {
        store = new FileJobStore(root);
    }

    private static JobInput input(String id, String sequence) {
        return JobInput.builder()
                .jobId(id)
                .sequence(sequence)
                .directions(List.of("R", "U"))
                .params(new JobParams(Protocol.FOLD, 2, "11", true))
                .submittedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void saveAndLoadInput() {
        JobInput in = input("job-1", "ACDE");
        store.putInput(in);

        assertTrue(Files.isRegularFile(root.resolve("inputs/job-1/input.json")));
        assertTrue(store.hasInput("job-1"));
        assertEquals(in, store.getInput("job-1"));
    }

    @Test
    @DisplayName("Re-writing an input replaces it without merging")
    void inputReplaced() {
        store.putInput(input("job-1", "ACDE"));
        JobInput second = JobInput.builder()
                .jobId("job-1")
                .sequence("WWW")
                .params(JobParams.defaults())
                .submittedAt(Instant.now())
                .build();
        store.putInput(second);

        JobInput loaded = store.getInput("job-1");
        assertEquals("WWW", loaded.sequence());
        assertTrue(loaded.directions().isEmpty());
        assertEquals(JobParams.defaults(), loaded.params());
    }

    @Test
    void missingInputIsNotFound() {
        assertFalse(store.hasInput("nope"));
        assertThrows(JobNotFoundException.class, () -> store.getInput("nope"));
    }

    @Test
    void corruptInputIsUnreadable() throws Exception {
        Path file = root.resolve("inputs/bad/input.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        assertThrows(InputUnreadableException.class, () -> store.getInput("bad"));
    }

    @Test
    void statusAbsentThenWritten() {
        assertEquals(Optional.empty(), store.getStatus("job-2"));

        store.putStatus(StatusRecord.failed("job-2", "boom"));
        StatusRecord status = store.getStatus("job-2").orElseThrow();

        assertEquals(JobStatus.FAILED, status.status());
        assertEquals("boom", status.errorMessage());
        assertNotNull(status.updatedAt());
    }

    @Test
    void statusLastWriterWins() {
        store.putStatus(StatusRecord.queued("job-3"));
        store.putStatus(StatusRecord.running("job-3"));
        store.putStatus(StatusRecord.succeeded("job-3"));

        StatusRecord status = store.getStatus("job-3").orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, status.status());
        assertNull(status.errorMessage());
    }

    @Test
    @DisplayName("A corrupt status file is a server fault, not a missing job")
    void corruptStatusIsUnreadable() throws Exception {
        Path file = root.resolve("results/job-4/status.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"jobId\":\"job-4\",\"status\":\"exploded\"}");

        assertThrows(StatusUnreadableException.class, () -> store.getStatus("job-4"));
    }

    @Test
    void artifactBytesRoundTrip() {
        assertTrue(store.getArtifact("job-5").isEmpty());

        byte[] pdb = "ATOM\nEND\n".getBytes(StandardCharsets.UTF_8);
        store.putArtifact("job-5", pdb);

        assertArrayEquals(pdb, store.getArtifact("job-5").orElseThrow());
        assertTrue(Files.isRegularFile(root.resolve("results/job-5/output.pdb")));
    }

    @Test
    void deleteArtifact() {
        store.putArtifact("job-6", "END\n".getBytes(StandardCharsets.UTF_8));

        store.deleteArtifact("job-6");
        assertTrue(store.getArtifact("job-6").isEmpty());

        // absent artifact is fine
        assertDoesNotThrow(() -> store.deleteArtifact("job-6"));
        assertDoesNotThrow(() -> store.deleteArtifact("never-written"));
    }

    @Test
    void writesLeaveNoTempFiles() throws Exception {
        store.putStatus(StatusRecord.running("job-6"));
        store.putArtifact("job-6", new byte[] { 1, 2, 3 });
        store.putStatus(StatusRecord.succeeded("job-6"));

        try (Stream<Path> files = Files.list(root.resolve("results/job-6"))) {
            assertEquals(List.of("output.pdb", "status.json"),
                    files.map(p -> p.getFileName().toString()).sorted().toList());
        }
    }

    @Test
    void listsIdsFromBothRoots() {
        store.putInput(input("b-job", "AC"));
        store.putStatus(StatusRecord.running("a-job"));
        store.putInput(input("c-job", "AC"));
        store.putStatus(StatusRecord.queued("c-job"));

        assertEquals(List.of("a-job", "b-job", "c-job"), store.listJobIds());
    }

    @Test
    void generatedIdsAreUniqueHex() {
        String a = store.generateId();
        String b = store.generateId();

        assertEquals(32, a.length());
        assertTrue(a.matches("[0-9a-f]{32}"));
        assertNotEquals(a, b);
    }

    @Test
    void healthyWhenRootsWritable() {
        assertTrue(store.isHealthy());
    }
}
