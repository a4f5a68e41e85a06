package net.spookly.licensegate.remote;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.licensegate.config.ConfigException;

/**
 * Phone-home client over HTTP: {@code POST {serverUrl}/validate} with a hard timeout.
 */
public final class HttpPhoneHomeClient implements PhoneHomeClient {
    static final String USER_AGENT = "LicenseGate/" + PhoneHomeRequest.PROTOCOL_VERSION;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI validateUri;
    private final URI healthUri;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final Clock clock;

    public HttpPhoneHomeClient(String serverUrl, int timeoutMs) {
        this(serverUrl, timeoutMs, Clock.systemUTC());
    }

    HttpPhoneHomeClient(String serverUrl, int timeoutMs, Clock clock) {
        if (serverUrl == null || serverUrl.isBlank()) {
            throw new ConfigException("Phone-home server URL is required");
        }
        if (timeoutMs <= 0) {
            throw new ConfigException("Phone-home timeout must be greater than 0");
        }
        String base = serverUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        try {
            this.validateUri = URI.create(base + "/validate");
            this.healthUri = URI.create(base + "/health");
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid phone-home server URL: " + serverUrl, e);
        }
        this.timeout = Duration.ofMillis(timeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public PhoneHomeResponse check(String token, String machineId) throws PhoneHomeException {
        PhoneHomeRequest body = new PhoneHomeRequest();
        body.licenseKey = token;
        body.machineId = machineId;
        body.timestamp = clock.millis();
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new PhoneHomeException(PhoneHomeException.Kind.NETWORK_ERROR, "Failed to encode phone-home request", e);
        }
        HttpRequest request = HttpRequest.newBuilder(validateUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        HttpResponse<byte[]> response = send(request);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new PhoneHomeException(PhoneHomeException.Kind.SERVER_ERROR, "License validation failed: HTTP " + status);
        }
        return parse(response.body());
    }

    /**
     * Probe {@code GET {serverUrl}/health}; any failure reads as unreachable.
     */
    public boolean isReachable() {
        HttpRequest request = HttpRequest.newBuilder(healthUri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        try {
            int status = send(request).statusCode();
            return status >= 200 && status < 300;
        } catch (PhoneHomeException e) {
            return false;
        }
    }

    private HttpResponse<byte[]> send(HttpRequest request) throws PhoneHomeException {
        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw timeout(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PhoneHomeException(PhoneHomeException.Kind.NETWORK_ERROR, "Phone-home interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw timeout(cause);
            }
            if (cause instanceof IOException) {
                throw new PhoneHomeException(PhoneHomeException.Kind.NETWORK_ERROR,
                        "Phone-home request failed: " + cause.getMessage(), cause);
            }
            throw new PhoneHomeException(PhoneHomeException.Kind.NETWORK_ERROR,
                    "Phone-home request failed: " + cause, cause);
        }
    }

    private PhoneHomeException timeout(Throwable cause) {
        return new PhoneHomeException(PhoneHomeException.Kind.TIMEOUT,
                "License validation timeout after " + timeout.toMillis() + "ms", cause);
    }

    static PhoneHomeResponse parse(byte[] body) throws PhoneHomeException {
        if (body == null || body.length == 0) {
            throw new PhoneHomeException(PhoneHomeException.Kind.SERVER_ERROR, "Empty phone-home response");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new PhoneHomeException(PhoneHomeException.Kind.SERVER_ERROR, "Malformed phone-home response", e);
        }
        if (node == null || !node.isObject()) {
            throw new PhoneHomeException(PhoneHomeException.Kind.SERVER_ERROR, "Phone-home response must be a JSON object");
        }
        JsonNode valid = node.get("valid");
        if (valid == null || !valid.isBoolean()) {
            throw new PhoneHomeException(PhoneHomeException.Kind.SERVER_ERROR, "Phone-home response is missing 'valid'");
        }
        JsonNode reason = node.get("reason");
        JsonNode cachedUntil = node.get("cached_until");
        return new PhoneHomeResponse(
                valid.asBoolean(),
                reason != null && reason.isTextual() ? reason.asText() : null,
                cachedUntil != null && cachedUntil.isIntegralNumber() ? cachedUntil.asLong() : null
        );
    }
}
