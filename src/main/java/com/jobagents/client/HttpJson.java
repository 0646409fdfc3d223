package com.jobagents.client;

import com.jobagents.core.Result;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal JSON-over-HTTP transport on {@link HttpURLConnection}.
 *
 * <p>Never throws: connection errors, timeouts and non-2xx statuses come back as
 * {@link Result#failure(String, Throwable)} so callers can log and move on.</p>
 */
public class HttpJson {
    private static final Logger logger = Logger.getLogger(HttpJson.class.getName());

    private static final int MAX_ERROR_BODY = 300;

    private final int connectTimeoutMillis;

    public HttpJson(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    /**
     * @return the response body of a successful GET
     */
    public Result<String> get(String url, Map<String, String> headers, int readTimeoutMillis) {
        return send("GET", url, headers, null, readTimeoutMillis);
    }

    /**
     * @return the response body of a successful POST with a JSON body
     */
    public Result<String> post(String url, String jsonBody, int readTimeoutMillis) {
        return send("POST", url, Map.of(), jsonBody, readTimeoutMillis);
    }

    private Result<String> send(String method, String url, Map<String, String> headers, String body,
                                int readTimeoutMillis) {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(url).openConnection();
            conn.setRequestMethod(method);
            conn.setConnectTimeout(connectTimeoutMillis);
            conn.setReadTimeout(readTimeoutMillis);
            conn.setRequestProperty("Accept", "application/json");
            for (Map.Entry<String, String> header : headers.entrySet()) {
                conn.setRequestProperty(header.getKey(), header.getValue());
            }

            if (body != null) {
                byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
                conn.setDoOutput(true);
                conn.setRequestProperty("Content-Type", "application/json; charset=utf-8");
                conn.setFixedLengthStreamingMode(bytes.length);
                try (OutputStream out = conn.getOutputStream()) {
                    out.write(bytes);
                }
            }

            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                String errorBody = readFully(conn.getErrorStream());
                if (errorBody.length() > MAX_ERROR_BODY) {
                    errorBody = errorBody.substring(0, MAX_ERROR_BODY) + "...";
                }
                return Result.failure(method + " " + url + " returned HTTP " + status + ": " + errorBody);
            }
            return Result.ok(readFully(conn.getInputStream()));

        } catch (IOException e) {
            logger.log(Level.FINE, method + " " + url + " failed", e);
            return Result.failure(method + " " + url + " failed: " + e.getMessage(), e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    private static String readFully(InputStream in) throws IOException {
        if (in == null) {
            return "";
        }
        try (InputStream stream = in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
