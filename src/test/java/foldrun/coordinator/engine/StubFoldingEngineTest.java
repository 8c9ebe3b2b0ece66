package foldrun.coordinator.engine;

import foldrun.coordinator.model.Protocol;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StubFoldingEngineTest {

    private static EngineRequest request(String sequence) {
        return new EngineRequest(sequence, List.of(), Protocol.RELAX, 1, null, true);
    }

    @Test
    void alwaysAvailable() {
        StubFoldingEngine stub = new StubFoldingEngine(Duration.ZERO);
        assertTrue(stub.isAvailable());
        assertEquals("stub", stub.name());
        assertDoesNotThrow(stub::initialize);
    }

    @Test
    void returnsPlaceholderStructureRegardlessOfInput() {
        StubFoldingEngine stub = new StubFoldingEngine(Duration.ZERO);

        EngineResult a = stub.execute(request("AAAA"));
        EngineResult b = stub.execute(request("WYWYWYWYWY"));

        assertEquals(StubFoldingEngine.PLACEHOLDER_ENERGY, a.energy());
        assertArrayEquals(a.artifact(), b.artifact());

        String pdb = new String(a.artifact(), StandardCharsets.UTF_8);
        assertTrue(pdb.startsWith("ATOM      1  N   GLY A   1"));
        assertTrue(pdb.contains(" CA  GLY "));
        assertTrue(pdb.endsWith("END\n"));
        assertEquals(6, pdb.split("\n").length);
    }

    @Test
    void waitsForSimulatedDelay() {
        StubFoldingEngine stub = new StubFoldingEngine(Duration.ofMillis(150));

        long start = System.nanoTime();
        stub.execute(request("AAAA"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 140, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void interruptionFailsExecution() {
        StubFoldingEngine stub = new StubFoldingEngine(Duration.ofSeconds(5));
        Thread.currentThread().interrupt();
        try {
            assertThrows(EngineExecutionException.class, () -> stub.execute(request("AAAA")));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
