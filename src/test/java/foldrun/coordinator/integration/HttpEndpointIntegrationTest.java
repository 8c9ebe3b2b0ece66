package foldrun.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.config.Dependencies;
import foldrun.coordinator.config.EngineMode;
import foldrun.coordinator.server.FoldNettyServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Runs the Netty server on an ephemeral port with the stub engine.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        @TempDir
        Path workDir;

        private Dependencies deps;
        private FoldNettyServer server;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                CoordinatorConfig config = CoordinatorConfig.defaults()
                                .withServerPort(0)
                                .withWorkDir(workDir)
                                .withEngineMode(EngineMode.STUB)
                                .withStubDelay(Duration.ofMillis(50));

                deps = Dependencies.create(config);
                server = new FoldNettyServer(deps.routerHandler(), config);
                server.start();
                baseUrl = "http://localhost:" + server.port();

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                server.stop();
                deps.close();
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<byte[]> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofByteArray());
        }

        private JsonNode getJson(String path) throws Exception {
                HttpResponse<byte[]> response = get(path);
                assertEquals(200, response.statusCode(),
                                "GET " + path + " failed: " + new String(response.body(), StandardCharsets.UTF_8));
                return MAPPER.readTree(response.body());
        }

        @Test
        @DisplayName("Full HTTP flow: submit, poll until succeeded, download structure")
        void submitPollDownload() throws Exception {
                HttpResponse<String> submit = post("/api/v1/jobs", """
                                {
                                    "jobId": "http-job-1",
                                    "sequence": "ACDEFGHIK",
                                    "params": {"protocol": "relax"}
                                }
                                """);

                assertEquals(202, submit.statusCode(), "Body: " + submit.body());
                JsonNode accepted = MAPPER.readTree(submit.body());
                assertEquals("http-job-1", accepted.get("jobId").asText());
                assertEquals("queued", accepted.get("status").asText());

                await().atMost(Duration.ofSeconds(10))
                                .pollInterval(Duration.ofMillis(50))
                                .until(() -> "succeeded".equals(
                                                getJson("/api/v1/jobs/http-job-1").get("status").asText()));

                JsonNode status = getJson("/api/v1/jobs/http-job-1");
                assertFalse(status.has("errorMessage"));

                HttpResponse<byte[]> pdb = get("/api/v1/jobs/http-job-1/pdb");
                assertEquals(200, pdb.statusCode());
                assertEquals("application/octet-stream",
                                pdb.headers().firstValue("Content-Type").orElse(""));
                assertEquals("attachment; filename=\"http-job-1.pdb\"",
                                pdb.headers().firstValue("Content-Disposition").orElse(""));

                byte[] onDisk = Files.readAllBytes(
                                workDir.resolve("results").resolve("http-job-1").resolve("output.pdb"));
                assertArrayEquals(onDisk, pdb.body());
        }

        @Test
        void generatedIdWhenOmitted() throws Exception {
                HttpResponse<String> submit = post("/api/v1/jobs", "{\"sequence\": \"AAAA\"}");

                assertEquals(202, submit.statusCode(), "Body: " + submit.body());
                String jobId = MAPPER.readTree(submit.body()).get("jobId").asText();
                assertFalse(jobId.isBlank());

                JsonNode status = getJson("/api/v1/jobs/" + jobId);
                assertTrue(status.get("status").asText().matches("queued|running|succeeded"));
        }

        @Test
        void unknownJobIs404() throws Exception {
                HttpResponse<byte[]> status = get("/api/v1/jobs/no-such-job");
                assertEquals(404, status.statusCode());
                JsonNode error = MAPPER.readTree(status.body());
                assertTrue(error.get("error").asText().contains("no-such-job"));

                assertEquals(404, get("/api/v1/jobs/no-such-job/pdb").statusCode());
        }

        @Test
        void unknownRouteIs404() throws Exception {
                assertEquals(404, get("/api/v2/whatever").statusCode());
        }

        @Test
        void malformedRequestsAre400() throws Exception {
                HttpResponse<String> badJson = post("/api/v1/jobs", "{not json");
                assertEquals(400, badJson.statusCode());
                assertTrue(MAPPER.readTree(badJson.body()).has("error"));

                HttpResponse<String> emptyBody = post("/api/v1/jobs", "");
                assertEquals(400, emptyBody.statusCode());

                HttpResponse<String> nullBody = post("/api/v1/jobs", "null");
                assertEquals(400, nullBody.statusCode());
                assertEquals("request body is required",
                                MAPPER.readTree(nullBody.body()).get("error").asText());

                HttpResponse<String> emptySequence = post("/api/v1/jobs", "{\"sequence\": \"\"}");
                assertEquals(400, emptySequence.statusCode());

                HttpResponse<String> badResidue = post("/api/v1/jobs", "{\"sequence\": \"AB1\"}");
                assertEquals(400, badResidue.statusCode());

                HttpResponse<String> badParams = post("/api/v1/jobs",
                                "{\"sequence\": \"AAAA\", \"params\": {\"repeats\": 0}}");
                assertEquals(400, badParams.statusCode());
        }

        @Test
        void healthProbe() throws Exception {
                JsonNode health = getJson("/api/v1/health");

                assertEquals("ok", health.get("status").asText());
                assertEquals("stub", health.get("engine").asText());
                assertTrue(health.has("uptime"));
                assertTrue(health.has("version"));
        }
}
