package com.project.attest.ipfs;

import com.project.attest.net.CircuitBreaker;
import com.project.attest.net.RetryPolicy;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Read-only access to content pinned on IPFS.
 *
 * Reads go to the node's HTTP API ({@code /api/v0/cat}) first and fall back to a public gateway
 * when one is configured. API calls are retried with backoff and guarded by a circuit breaker.
 *
 * Configuration via environment variables:
 * - IPFS_URL: node API endpoint
 * - IPFS_GATEWAY_URL: fallback gateway for reads
 * - IPFS_MAX_RETRIES, IPFS_RETRY_BACKOFF_MS: retry budget
 * - IPFS_API_BEARER_TOKEN, IPFS_API_BASIC_AUTH: authentication
 */
public class IPFSService {
    private static final Logger log = LoggerFactory.getLogger(IPFSService.class);

    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");
    private static final RequestBody EMPTY_BODY = RequestBody.create(new byte[0], OCTET_STREAM);

    private final String ipfsBaseUrl;
    private final OkHttpClient httpClient;
    private final IpfsOptions options;
    private final RetryPolicy retry;
    private final CircuitBreaker circuitBreaker;

    public IPFSService(String ipfsUrl) {
        this(ipfsUrl, IpfsOptions.fromEnv());
    }

    public IPFSService(String ipfsUrl, IpfsOptions options) {
        this(ipfsUrl, options, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .callTimeout(Duration.ofSeconds(60))
                .build());
    }

    public IPFSService(String ipfsUrl, IpfsOptions options, OkHttpClient httpClient) {
        this.ipfsBaseUrl = buildBaseUrl(resolveUrl(ipfsUrl));
        this.options = options;
        this.httpClient = httpClient;
        this.retry = new RetryPolicy(options.initialBackoffMillis(), 2_000L, 0.0, options.maxRetries());
        this.circuitBreaker = new CircuitBreaker("ipfs " + ipfsBaseUrl);
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Downloads the bytes behind {@code cid}: node API first, then the gateway.
     *
     * @return empty when neither source has the content
     * @throws IOException if the node failed and no gateway is configured
     */
    public Optional<byte[]> cat(String cid) throws IOException {
        try {
            return Optional.of(catViaApi(cid));
        } catch (IOException e) {
            if (options.gatewayUrl().isEmpty()) {
                throw e;
            }
            log.warn("IPFS API read of {} failed, falling back to gateway: {}", cid, e.getMessage());
        }
        return fetchViaGateway(cid);
    }

    private byte[] catViaApi(String cid) throws IOException {
        HttpUrl url = HttpUrl.get(apiUrl("/api/v0/cat"))
                .newBuilder()
                .addQueryParameter("arg", cid)
                .build();
        Request request = withAuth(new Request.Builder()
                .url(url)
                .post(EMPTY_BODY))
                .build();
        return executeWithRetry(request);
    }

    private Optional<byte[]> fetchViaGateway(String cid) throws IOException {
        HttpUrl url = HttpUrl.parse(options.gatewayUrl().get() + cid);
        if (url == null) {
            return Optional.empty();
        }
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw new IOException("IPFS gateway error " + response.code() + ": " + response.message());
            }
            return Optional.of(bodyBytes(response));
        }
    }

    private Request.Builder withAuth(Request.Builder builder) {
        options.authHeader().ifPresent(value -> builder.header("Authorization", value));
        return builder;
    }

    private String apiUrl(String path) {
        return ipfsBaseUrl + path;
    }

    private byte[] executeWithRetry(Request request) throws IOException {
        if (!circuitBreaker.canExecute()) {
            throw new IOException("IPFS circuit breaker '" + circuitBreaker.getName() + "' is open");
        }

        IOException last = null;
        for (int attempt = 1; ; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("IPFS API error " + response.code() + ": " + response.message());
                }
                byte[] result = bodyBytes(response);
                circuitBreaker.recordSuccess();
                return result;
            } catch (IOException ex) {
                last = ex;
                if (!retry.allowsRetry(attempt)) {
                    break;
                }
                try {
                    Thread.sleep(retry.delay(attempt - 1).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    circuitBreaker.recordFailure();
                    throw new IOException("Interrupted during IPFS retry", ie);
                }
            }
        }
        circuitBreaker.recordFailure();
        throw last;
    }

    private static byte[] bodyBytes(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? new byte[0] : body.bytes();
    }

    private static String resolveUrl(String ipfsUrl) {
        if (ipfsUrl.startsWith("http://") || ipfsUrl.startsWith("https://")) {
            return ipfsUrl;
        }
        // multiaddr form: /ip4/127.0.0.1/tcp/5001
        return "http://" + ipfsUrl.replace("/ip4/", "").replace("/tcp/", ":").replace("/", "");
    }

    private static String buildBaseUrl(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * @param gatewayUrl           gateway base, always ending in {@code /}
     * @param authHeader           full {@code Authorization} header value for the node API
     * @param maxRetries           attempts per API call, at least 1
     * @param initialBackoffMillis first retry delay, doubled per attempt
     */
    public record IpfsOptions(
            Optional<String> gatewayUrl,
            Optional<String> authHeader,
            int maxRetries,
            long initialBackoffMillis
    ) {
        public static IpfsOptions fromEnv() {
            return new IpfsOptions(
                    Optional.ofNullable(normalizeGateway(System.getenv("IPFS_GATEWAY_URL"))),
                    Optional.ofNullable(buildAuthHeader()),
                    Math.max(parseInt(System.getenv("IPFS_MAX_RETRIES"), 3), 1),
                    Math.max(parseLong(System.getenv("IPFS_RETRY_BACKOFF_MS"), 200L), 100L)
            );
        }

        public IpfsOptions withGateway(String newGatewayUrl) {
            return new IpfsOptions(Optional.ofNullable(normalizeGateway(newGatewayUrl)), authHeader,
                    maxRetries, initialBackoffMillis);
        }

        private static String normalizeGateway(String gateway) {
            if (gateway == null || gateway.isBlank()) {
                return null;
            }
            return gateway.endsWith("/") ? gateway : gateway + "/";
        }

        private static String buildAuthHeader() {
            String bearer = System.getenv("IPFS_API_BEARER_TOKEN");
            if (bearer != null && !bearer.isBlank()) {
                return "Bearer " + bearer.trim();
            }
            String basic = System.getenv("IPFS_API_BASIC_AUTH");
            if (basic != null && !basic.isBlank()) {
                return "Basic " + Base64.getEncoder().encodeToString(basic.getBytes(StandardCharsets.UTF_8));
            }
            return null;
        }

        private static int parseInt(String value, int defaultValue) {
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        private static long parseLong(String value, long defaultValue) {
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
    }
}
