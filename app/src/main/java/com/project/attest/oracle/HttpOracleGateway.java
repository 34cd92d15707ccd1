package com.project.attest.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.ReportValidationException;
import com.project.attest.core.TransientNetworkException;
import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;
import com.project.attest.net.CircuitBreaker;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Oracle gateway speaking JSON over HTTP.
 *
 * <pre>
 * POST {base}/v1/attestations            {"documentId", "locator": {"uri", "contentDigest"}}
 *                                        -> {"requestId"}
 * GET  {base}/v1/attestations/{id}       -> {"status": "pending"}
 *                                        |  {"status": "finalized", "report": {...}}
 *                                        |  {"status": "rejected", "message": "..."}
 * </pre>
 *
 * 5xx, 408, 429 and I/O errors are transient; other non-2xx answers are explicit refusals.
 */
public class HttpOracleGateway implements OracleGateway {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String SERVICE = "oracle";

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final Optional<String> authHeader;
    private final CircuitBreaker circuitBreaker;

    public HttpOracleGateway(String baseUrl, Optional<String> bearerToken, Duration callTimeout) {
        this(baseUrl, bearerToken, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(callTimeout)
                .callTimeout(callTimeout)
                .build(), new ObjectMapper(), new CircuitBreaker("oracle-" + baseUrl));
    }

    public HttpOracleGateway(String baseUrl, Optional<String> bearerToken, OkHttpClient httpClient,
                             ObjectMapper mapper, CircuitBreaker circuitBreaker) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid oracle URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.authHeader = bearerToken.filter(token -> !token.isBlank()).map(token -> "Bearer " + token.trim());
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String submit(DocumentId documentId, ContentLocator locator) {
        SubmitRequest body = new SubmitRequest(documentId.hex(),
                Map.of("uri", locator.uri().toString(), "contentDigest", locator.contentDigest().hex()));
        Request request = withAuth(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegments("v1/attestations").build())
                .post(RequestBody.create(writeJson(body), JSON)))
                .build();

        SubmitResponse response = execute(request, SubmitResponse.class);
        if (response.requestId == null || response.requestId.isBlank()) {
            throw new ReportValidationException("requestId", "Oracle did not assign a request id");
        }
        return response.requestId;
    }

    @Override
    public OraclePoll pollStatus(String requestId) {
        Request request = withAuth(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegments("v1/attestations").addPathSegment(requestId).build())
                .get())
                .build();

        StatusResponse response = execute(request, StatusResponse.class);
        String status = response.status == null ? "" : response.status;
        switch (status) {
            case "pending":
                return OraclePoll.pending();
            case "finalized":
                if (response.report == null) {
                    throw new ReportValidationException("report", "Finalized status without a report");
                }
                return OraclePoll.of(response.report.toReport());
            case "rejected":
                throw new ExternalServiceException(SERVICE,
                        "request " + requestId + " rejected: " + Optional.ofNullable(response.message).orElse("no reason"));
            default:
                throw new ReportValidationException("status", "Unknown oracle status '" + status + "'");
        }
    }

    private <T> T execute(Request request, Class<T> type) {
        if (!circuitBreaker.canExecute()) {
            throw new TransientNetworkException("Oracle circuit breaker '" + circuitBreaker.getName() + "' is OPEN");
        }
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (code >= 500 || code == 408 || code == 429) {
                circuitBreaker.recordFailure();
                throw new TransientNetworkException("Oracle HTTP " + code + " for " + request.url().encodedPath());
            }
            circuitBreaker.recordSuccess();
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new ExternalServiceException(SERVICE, "HTTP " + code + ": " + text);
            }
            try {
                return mapper.readValue(text, type);
            } catch (JsonProcessingException e) {
                throw new ReportValidationException("body", "Unparseable oracle response", e);
            }
        } catch (IOException e) {
            circuitBreaker.recordFailure();
            throw new TransientNetworkException("Oracle call failed: " + e.getMessage(), e);
        }
    }

    private byte[] writeJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode oracle request", e);
        }
    }

    private Request.Builder withAuth(Request.Builder builder) {
        authHeader.ifPresent(value -> builder.header("Authorization", value));
        return builder;
    }

    record SubmitRequest(
            @JsonProperty("documentId") String documentId,
            @JsonProperty("locator") Map<String, String> locator) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SubmitResponse {
        @JsonProperty("requestId")
        String requestId;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StatusResponse {
        @JsonProperty("status")
        String status;

        @JsonProperty("report")
        OracleReportPayload report;

        @JsonProperty("message")
        String message;
    }
}
