package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AdzunaListingSourceTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger requests = new AtomicInteger();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/search/", exchange -> {
            requests.incrementAndGet();
            String path = exchange.getRequestURI().getPath();
            String body;
            if (path.endsWith("/1")) {
                body = "{\"results\": ["
                        + "{\"title\": \"Data Engineer\", \"company\": {\"display_name\": \"Acme\"},"
                        + " \"location\": {\"display_name\": \"New York\"}, \"description\": \"Pipelines\","
                        + " \"redirect_url\": \"https://adzuna.example/1\"},"
                        + "{\"title\": \"Analytics Engineer\"}"
                        + "]}";
            } else {
                body = "{\"results\": []}";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/search";
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    @Test
    public void testStopsAtEmptyPage() {
        AdzunaListingSource source = new AdzunaListingSource(baseUrl, "id", "key", "data engineer",
                "New York City", 3, new HttpJson(2000));

        Result<List<Candidate>> result = source.fetchListings();

        assertTrue(result.isOk(), result.toString());
        assertEquals(2, result.get().size());
        assertEquals(2, requests.get(), "Page 2 is empty so page 3 is never requested");

        Candidate first = result.get().get(0);
        assertEquals("Acme", first.getCompany());
        assertEquals("New York", first.getLocation());
        assertEquals("https://adzuna.example/1", first.getSourceUrl());
        assertEquals("", result.get().get(1).getCompany());
    }

    @Test
    public void testMissingCredentials() {
        AdzunaListingSource source = new AdzunaListingSource(baseUrl, "", null, "data engineer",
                "New York City", 3, new HttpJson(2000));

        assertTrue(source.fetchListings().isFailure());
        assertEquals(0, requests.get());
    }

    @Test
    public void testToCandidateDefaults() {
        Candidate candidate = AdzunaListingSource.toCandidate(new JSONObject("{}"));
        assertEquals("Unknown Title", candidate.getTitle());
        assertNull(candidate.getId());
    }
}
