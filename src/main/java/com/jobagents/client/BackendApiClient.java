package com.jobagents.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import com.jobagents.model.ReferenceMatch;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Client for the pipeline backend's REST API.
 *
 * <p>Implements every collaborator the agents talk to over HTTP:</p>
 * <ul>
 *   <li>{@code GET  /jobs/}            list stored postings</li>
 *   <li>{@code GET  /jobs/{id}}        one posting</li>
 *   <li>{@code POST /jobs/}            store a new posting (may answer {@code duplicate})</li>
 *   <li>{@code POST /jobs/match}       score a posting against the reference corpus</li>
 *   <li>{@code POST /jobs/generate_*}  generate a resume or cover letter</li>
 * </ul>
 *
 * <p>All methods return {@link Result}; nothing is thrown to the caller.</p>
 */
public class BackendApiClient implements CandidateSource, CandidateSink, MatchScorer, ContentGenerator {
    private static final Logger logger = Logger.getLogger(BackendApiClient.class.getName());

    private static final Gson gson = new Gson();

    private static final int READ_TIMEOUT_MILLIS = 30_000;
    private static final int LONG_READ_TIMEOUT_MILLIS = 180_000;

    private final String baseUrl;
    private final HttpJson http;
    private final int matchTopK;
    private final int generationTopK;

    /**
     * @param baseUrl backend root, e.g. {@code http://127.0.0.1:8000}
     * @param http transport
     * @param matchTopK number of reference artifacts requested per match
     * @param generationTopK number of reference artifacts used as generation context
     */
    public BackendApiClient(String baseUrl, HttpJson http, int matchTopK, int generationTopK) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = http;
        this.matchTopK = matchTopK;
        this.generationTopK = generationTopK;
    }

    @Override
    public Result<List<Candidate>> fetchCandidates() {
        Result<String> response = http.get(baseUrl + "/jobs/", Map.of(), READ_TIMEOUT_MILLIS);
        if (response.isFailure()) {
            return Result.failure(response.getError(), response.getCause());
        }
        try {
            String body = response.get().trim();
            JSONArray jobs = body.startsWith("[")
                    ? new JSONArray(body)
                    : new JSONObject(body).optJSONArray("jobs");
            if (jobs == null) {
                return Result.failure("GET /jobs/ returned neither a list nor a 'jobs' field");
            }

            List<Candidate> candidates = new ArrayList<>();
            for (int i = 0; i < jobs.length(); i++) {
                JSONObject job = jobs.optJSONObject(i);
                if (job == null) {
                    logger.warning("Skipping non-object entry " + i + " in job list");
                    continue;
                }
                try {
                    candidates.add(gson.fromJson(job.toString(), Candidate.class));
                } catch (JsonParseException e) {
                    logger.warning("Skipping malformed job entry " + i + ": " + e.getMessage());
                }
            }
            return Result.ok(candidates);

        } catch (JSONException e) {
            return Result.failure("GET /jobs/ returned invalid JSON", e);
        }
    }

    @Override
    public Result<Candidate> fetchCandidate(long id) {
        Result<String> response = http.get(baseUrl + "/jobs/" + id, Map.of(), READ_TIMEOUT_MILLIS);
        if (response.isFailure()) {
            return Result.failure(response.getError(), response.getCause());
        }
        try {
            Candidate candidate = gson.fromJson(response.get(), Candidate.class);
            if (candidate == null) {
                return Result.failure("GET /jobs/" + id + " returned an empty body");
            }
            return Result.ok(candidate);
        } catch (JsonParseException e) {
            return Result.failure("GET /jobs/" + id + " returned invalid JSON", e);
        }
    }

    @Override
    public Result<SubmitStatus> submit(Candidate listing) {
        JSONObject payload = new JSONObject();
        payload.put("title", listing.getTitle());
        payload.put("company", listing.getCompany());
        payload.put("location", listing.getLocation());
        payload.put("description", listing.getDescription());
        payload.put("source_url", listing.getSourceUrl());

        Result<String> response = http.post(baseUrl + "/jobs/", payload.toString(), READ_TIMEOUT_MILLIS);
        if (response.isFailure()) {
            return Result.failure(response.getError(), response.getCause());
        }
        try {
            String body = response.get().trim();
            if (body.isEmpty() || "null".equals(body)) {
                return Result.failure("POST /jobs/ returned an empty body");
            }
            JSONObject json = new JSONObject(body);
            return Result.ok(json.optBoolean("duplicate", false) ? SubmitStatus.DUPLICATE : SubmitStatus.INSERTED);
        } catch (JSONException e) {
            return Result.failure("POST /jobs/ returned invalid JSON", e);
        }
    }

    @Override
    public Result<List<ReferenceMatch>> score(Candidate candidate) {
        JSONObject payload = new JSONObject();
        if (candidate.getId() != null) {
            payload.put("job_id", candidate.getId());
        }
        payload.put("title", candidate.getTitle());
        payload.put("company", candidate.getCompany());
        payload.put("description", candidate.getDescription());
        payload.put("top_k", matchTopK);

        Result<String> response = http.post(baseUrl + "/jobs/match", payload.toString(), LONG_READ_TIMEOUT_MILLIS);
        if (response.isFailure()) {
            return Result.failure(response.getError(), response.getCause());
        }
        try {
            JSONArray matches = new JSONObject(response.get()).optJSONArray("matches");
            List<ReferenceMatch> results = new ArrayList<>();
            if (matches == null) {
                return Result.ok(results);
            }
            for (int i = 0; i < matches.length(); i++) {
                JSONObject match = matches.optJSONObject(i);
                if (match != null) {
                    results.add(gson.fromJson(match.toString(), ReferenceMatch.class));
                }
            }
            return Result.ok(results);
        } catch (JSONException | JsonParseException e) {
            return Result.failure("POST /jobs/match returned invalid JSON", e);
        }
    }

    @Override
    public Result<String> generate(Candidate candidate, GenerationKind kind) {
        boolean resume = kind == GenerationKind.RESUME;
        String path = resume ? "/jobs/generate_resume" : "/jobs/generate_cover_letter";
        String field = resume ? "generated_resume" : "generated_cover_letter";

        JSONObject payload = new JSONObject();
        payload.put("title", candidate.getTitle());
        payload.put("company", candidate.getCompany());
        payload.put("description", candidate.getDescription());
        payload.put("top_k", generationTopK);

        Result<String> response = http.post(baseUrl + path, payload.toString(), LONG_READ_TIMEOUT_MILLIS);
        if (response.isFailure()) {
            return Result.failure(response.getError(), response.getCause());
        }
        try {
            JSONObject json = new JSONObject(response.get());
            String text = json.optString(field, null);
            if (text == null || text.isBlank()) {
                return Result.failure("POST " + path + " returned no '" + field + "'");
            }
            return Result.ok(text);
        } catch (JSONException e) {
            return Result.failure("POST " + path + " returned invalid JSON", e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
