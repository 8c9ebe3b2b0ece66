package foldrun.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @TempDir
    Path tempDir;

    private File writeIni(String content) throws Exception {
        Path file = tempDir.resolve("foldrun.ini");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(8000, config.serverPort());
        assertEquals(2, config.maxConcurrentJobs());
        assertEquals(64, config.queueCapacity());
        assertEquals(EngineMode.AUTO, config.engineMode());
        assertEquals(Duration.ofSeconds(2), config.stubDelay());
        assertTrue(config.recoverOnStartup());
        assertFalse(config.sinkEnabled());
    }

    @Test
    void loadsIniSections() throws Exception {
        File ini = writeIni("""
                [server]
                port = 9100
                host = 127.0.0.1

                [store]
                work_dir = /var/lib/foldrun

                [dispatcher]
                max_concurrent = 4
                queue_capacity = 10
                shutdown_grace_seconds = 5
                recover_on_startup = false

                [engine]
                mode = stub
                stub_delay_ms = 250
                relax_steps = 50
                max_sequence_length = 300

                [sink]
                enabled = true
                database_url = jdbc:h2:mem:ini-test
                pool_size = 2
                queue_capacity = 16
                """);

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini);

        assertEquals(9100, config.serverPort());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(Path.of("/var/lib/foldrun"), config.workDir());
        assertEquals(4, config.maxConcurrentJobs());
        assertEquals(10, config.queueCapacity());
        assertEquals(Duration.ofSeconds(5), config.shutdownGracePeriod());
        assertFalse(config.recoverOnStartup());
        assertEquals(EngineMode.STUB, config.engineMode());
        assertEquals(Duration.ofMillis(250), config.stubDelay());
        assertEquals(50, config.relaxSteps());
        assertEquals(300, config.maxSequenceLength());
        assertTrue(config.sinkEnabled());
        assertEquals("jdbc:h2:mem:ini-test", config.sinkDatabaseUrl());
        assertEquals(2, config.sinkPoolSize());
        assertEquals(16, config.sinkQueueCapacity());
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.fromIni(writeIni("""
                [engine]
                relax_steps = 10
                """));

        assertEquals(10, config.relaxSteps());
        assertEquals(64, config.queueCapacity());
        assertEquals(EngineMode.AUTO, config.engineMode());
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        File zeroWorkers = writeIni("""
                [dispatcher]
                max_concurrent = 0
                """);
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.fromIni(zeroWorkers));

        File unknownMode = writeIni("""
                [engine]
                mode = quantum
                """);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromIni(unknownMode));
        assertTrue(ex.getMessage().contains("auto or stub"));
    }

    @Test
    void fluentSetters() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withServerPort(0)
                .withMaxConcurrentJobs(3)
                .withEngineMode(EngineMode.STUB)
                .withSink("jdbc:h2:mem:x");

        assertEquals(0, config.serverPort());
        assertEquals(3, config.maxConcurrentJobs());
        assertEquals(EngineMode.STUB, config.engineMode());
        assertTrue(config.sinkEnabled());

        config.withSink(null);
        assertFalse(config.sinkEnabled());
    }

    @Test
    void engineModeParsing() {
        assertEquals(EngineMode.AUTO, EngineMode.parse(null));
        assertEquals(EngineMode.AUTO, EngineMode.parse(" Auto "));
        assertEquals(EngineMode.STUB, EngineMode.parse("STUB"));
    }
}
