package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import com.jobagents.model.ReferenceMatch;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the REST client against a local HTTP server serving canned responses.
 */
public class BackendApiClientTest {

    private HttpServer server;
    private BackendApiClient client;
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/jobs/", this::handle);
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        client = new BackendApiClient(baseUrl, new HttpJson(2000), 10, 5);
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requestBodies.put(method + " " + path, body);

        if ("GET".equals(method) && "/jobs/".equals(path)) {
            respond(exchange, 200, "{\"jobs\": ["
                    + "{\"id\": 1, \"title\": \"Data Engineer\", \"company\": \"Acme\", \"description\": \"Pipelines\","
                    + " \"source_url\": \"https://example.com/1\"},"
                    + "5,"
                    + "{\"id\": 2, \"title\": \"Analytics Engineer\", \"company\": \"Initech\"}"
                    + "]}");
        } else if ("GET".equals(method) && "/jobs/1".equals(path)) {
            respond(exchange, 200, "{\"id\": 1, \"title\": \"Data Engineer\", \"company\": \"Acme\"}");
        } else if ("POST".equals(method) && "/jobs/".equals(path)) {
            boolean duplicate = new JSONObject(body).getString("title").contains("Duplicate");
            respond(exchange, 200, duplicate ? "{\"duplicate\": true}" : "{\"id\": 77}");
        } else if ("POST".equals(method) && "/jobs/match".equals(path)) {
            respond(exchange, 200, "{\"matches\": ["
                    + "{\"artifact_id\": 3, \"name\": \"etl-toolkit\", \"similarity\": 0.4, \"skill_overlap\": 0.5},"
                    + "{\"artifact_id\": 4, \"name\": \"stream-lab\", \"combined_score\": 0.8}"
                    + "]}");
        } else if ("POST".equals(method) && "/jobs/generate_resume".equals(path)) {
            respond(exchange, 200, "{\"generated_resume\": \"Resume text\"}");
        } else if ("POST".equals(method) && "/jobs/generate_cover_letter".equals(path)) {
            respond(exchange, 500, "{\"detail\": \"model overloaded\"}");
        } else {
            respond(exchange, 404, "{\"detail\": \"Not Found\"}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    public void testFetchCandidatesSkipsMalformedEntries() {
        Result<List<Candidate>> result = client.fetchCandidates();

        assertTrue(result.isOk(), result.toString());
        List<Candidate> candidates = result.get();
        assertEquals(2, candidates.size());
        assertEquals(1L, candidates.get(0).getId());
        assertEquals("https://example.com/1", candidates.get(0).getSourceUrl());
        assertEquals("", candidates.get(1).getDescription());
    }

    @Test
    public void testFetchCandidate() {
        assertEquals("Acme", client.fetchCandidate(1).get().getCompany());

        Result<Candidate> missing = client.fetchCandidate(99);
        assertTrue(missing.isFailure());
        assertTrue(missing.getError().contains("404"), missing.getError());
    }

    @Test
    public void testSubmitReportsDuplicates() {
        Candidate fresh = new Candidate(null, "Data Engineer", "Acme", "NYC", "Pipelines", "https://example.com/1");
        Candidate duplicate = new Candidate(null, "Duplicate Engineer", "Acme", "Pipelines");

        assertEquals(CandidateSink.SubmitStatus.INSERTED, client.submit(fresh).get());
        JSONObject sent = new JSONObject(requestBodies.get("POST /jobs/"));
        assertEquals("https://example.com/1", sent.getString("source_url"));

        assertEquals(CandidateSink.SubmitStatus.DUPLICATE, client.submit(duplicate).get());
    }

    @Test
    public void testScoreParsesMatches() {
        Result<List<ReferenceMatch>> result = client.score(new Candidate(1L, "Data Engineer", "Acme", "Pipelines"));

        assertTrue(result.isOk(), result.toString());
        assertEquals(2, result.get().size());
        ReferenceMatch first = result.get().get(0);
        assertEquals(0.4, first.getSimilarity(), 1e-9);
        assertEquals(0.5, first.getSkillOverlap(), 1e-9);
        assertNull(first.getCombinedScore());
        assertEquals(0.8, result.get().get(1).getCombinedScore(), 1e-9);

        JSONObject sent = new JSONObject(requestBodies.get("POST /jobs/match"));
        assertEquals(10, sent.getInt("top_k"));
        assertEquals(1, sent.getLong("job_id"));
    }

    @Test
    public void testGenerate() {
        Candidate candidate = new Candidate(1L, "Data Engineer", "Acme", "Pipelines");

        assertEquals("Resume text", client.generate(candidate, GenerationKind.RESUME).get());
        assertEquals(5, new JSONObject(requestBodies.get("POST /jobs/generate_resume")).getInt("top_k"));

        Result<String> letter = client.generate(candidate, GenerationKind.COVER_LETTER);
        assertTrue(letter.isFailure());
        assertTrue(letter.getError().contains("500"), letter.getError());
    }

    @Test
    public void testUnreachableBackendIsFailure() {
        server.stop(0);
        assertTrue(client.fetchCandidates().isFailure());
    }
}
