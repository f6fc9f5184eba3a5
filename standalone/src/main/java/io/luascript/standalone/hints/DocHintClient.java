package io.luascript.standalone.hints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort lookup of documentation hints for a compiler error.
 *
 * <p>Sends {@code GET <endpoint>?q=<query>} and expects
 * {@code {"hints":[{"title":…,"url":…,"snippet":…}]}}. Any failure (no endpoint, connect or
 * request timeout, non-2xx status, malformed body, I/O error) yields {@link Optional#empty()}; a
 * lookup never throws.
 *
 * <p>Thread-safe: the underlying {@link HttpClient} is designed for concurrent use.
 */
public final class DocHintClient {

    private static final Logger LOG = LoggerFactory.getLogger(DocHintClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Queries are cut to this many characters before being sent. */
    static final int MAX_QUERY_CHARS = 120;

    /** Default connect and request timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    private final String endpoint;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * @param endpoint service URL, or {@code null}/blank to disable lookups
     * @param timeout  connect and request timeout
     */
    public DocHintClient(String endpoint, Duration timeout) {
        this.endpoint = endpoint == null || endpoint.isBlank() ? null : endpoint.trim();
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        LOG.debug("DocHintClient initialized: endpoint={}, timeoutMs={}", this.endpoint, this.timeout.toMillis());
    }

    public boolean enabled() {
        return endpoint != null;
    }

    /**
     * Looks up hints for {@code query}.
     *
     * @return the hints, or empty when the lookup is disabled or failed
     */
    public Optional<List<DocHint>> lookup(String query) {
        if (endpoint == null || query == null || query.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = URI.create(endpoint + (endpoint.contains("?") ? "&" : "?") + "q=" + encode(query));
        } catch (IllegalArgumentException e) {
            LOG.warn("Doc hint endpoint is not a valid URI: endpoint={}", endpoint, e);
            return Optional.empty();
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOG.debug("Doc hint lookup rejected: status={}", response.statusCode());
                return Optional.empty();
            }
            return parse(response.body());
        } catch (IOException e) {
            // HttpTimeoutException and HttpConnectTimeoutException are IOExceptions.
            LOG.debug("Doc hint lookup failed: {}", e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /** Hints from a response body; empty on any shape mismatch. */
    static Optional<List<DocHint>> parse(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            LOG.debug("Doc hint response is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.path("hints").isArray()) {
            return Optional.empty();
        }
        List<DocHint> hints = new ArrayList<>();
        for (JsonNode hint : root.get("hints")) {
            if (!hint.path("title").isTextual()) {
                continue;
            }
            hints.add(new DocHint(
                    hint.get("title").asText(),
                    hint.path("url").asText(""),
                    hint.path("snippet").asText("")));
        }
        return Optional.of(List.copyOf(hints));
    }

    static String encode(String query) {
        String trimmed = query.length() > MAX_QUERY_CHARS ? query.substring(0, MAX_QUERY_CHARS) : query;
        return URLEncoder.encode(trimmed, StandardCharsets.UTF_8);
    }
}
