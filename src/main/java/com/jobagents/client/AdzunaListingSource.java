package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * {@link ListingSource} backed by the Adzuna job search API.
 *
 * <p>Fetches up to {@code maxPages} pages and stops early on an empty page. A failing
 * page ends the fetch but keeps what earlier pages returned. Missing credentials are a
 * failure, never an exception.</p>
 */
public class AdzunaListingSource implements ListingSource {
    private static final Logger logger = Logger.getLogger(AdzunaListingSource.class.getName());

    private static final int READ_TIMEOUT_MILLIS = 30_000;
    private static final int RESULTS_PER_PAGE = 20;

    private final String baseUrl;
    private final String appId;
    private final String apiKey;
    private final String what;
    private final String where;
    private final int maxPages;
    private final HttpJson http;

    public AdzunaListingSource(String baseUrl, String appId, String apiKey, String what, String where,
                               int maxPages, HttpJson http) {
        this.baseUrl = baseUrl;
        this.appId = appId;
        this.apiKey = apiKey;
        this.what = what;
        this.where = where;
        this.maxPages = maxPages;
        this.http = http;
    }

    @Override
    public Result<List<Candidate>> fetchListings() {
        if (appId == null || appId.isBlank() || apiKey == null || apiKey.isBlank()) {
            return Result.failure("Adzuna app id or api key is not configured");
        }

        List<Candidate> listings = new ArrayList<>();
        for (int page = 1; page <= maxPages; page++) {
            Result<String> response = http.get(pageUrl(page), Map.of(), READ_TIMEOUT_MILLIS);
            if (response.isFailure()) {
                logger.warning("Adzuna request failed on page " + page + ": " + response.getError());
                break;
            }
            try {
                JSONArray results = new JSONObject(response.get()).optJSONArray("results");
                if (results == null || results.isEmpty()) {
                    break;
                }
                for (int i = 0; i < results.length(); i++) {
                    JSONObject result = results.optJSONObject(i);
                    if (result != null) {
                        listings.add(toCandidate(result));
                    }
                }
            } catch (JSONException e) {
                logger.warning("Adzuna returned invalid JSON on page " + page + ": " + e.getMessage());
                break;
            }
        }
        return Result.ok(listings);
    }

    private String pageUrl(int page) {
        return baseUrl + "/" + page
                + "?app_id=" + encode(appId)
                + "&app_key=" + encode(apiKey)
                + "&what=" + encode(what)
                + "&where=" + encode(where)
                + "&results_per_page=" + RESULTS_PER_PAGE
                + "&content-type=application/json";
    }

    static Candidate toCandidate(JSONObject result) {
        JSONObject company = result.optJSONObject("company");
        JSONObject location = result.optJSONObject("location");
        return new Candidate(
                null,
                result.optString("title", "Unknown Title"),
                company == null ? "" : company.optString("display_name", ""),
                location == null ? "" : location.optString("display_name", ""),
                result.optString("description", ""),
                result.optString("redirect_url", ""));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
