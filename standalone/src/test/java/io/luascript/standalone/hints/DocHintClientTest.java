package io.luascript.standalone.hints;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DocHintClient} against an in-process HTTP server.
 */
class DocHintClientTest {

    private static final String HINTS_BODY = """
            {"hints":[
              {"title":"Labeled statements","url":"https://docs.example/labels","snippet":"Use goto"},
              {"title":"No url"},
              {"url":"https://docs.example/untitled"}
            ]}
            """;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    private volatile int status = 200;
    private volatile String body = HINTS_BODY;
    private volatile long delayMs = 0;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/search", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastQuery.set(exchange.getRequestURI().getRawQuery());
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private String endpoint() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/search";
    }

    private DocHintClient client(Duration timeout) {
        return new DocHintClient(endpoint(), timeout);
    }

    @Nested
    @DisplayName("Successful lookups")
    class Success {

        @Test
        @DisplayName("entries without a title are skipped and missing fields default to empty")
        void parsesHints() {
            Optional<List<DocHint>> hints = client(Duration.ofSeconds(2)).lookup("Unsupported LabeledStatement");

            assertThat(hints).isPresent();
            assertThat(hints.get())
                    .containsExactly(
                            new DocHint("Labeled statements", "https://docs.example/labels", "Use goto"),
                            new DocHint("No url", "", ""));
        }

        @Test
        @DisplayName("the query is sent URL-encoded as the q parameter")
        void sendsQuery() {
            client(Duration.ofSeconds(2)).lookup("a b&c");

            assertThat(lastQuery.get()).startsWith("q=");
            assertThat(URLDecoder.decode(lastQuery.get().substring(2), StandardCharsets.UTF_8))
                    .isEqualTo("a b&c");
        }

        @Test
        @DisplayName("an endpoint that already has a query string gets the q parameter appended")
        void endpointWithQuery() {
            new DocHintClient(endpoint() + "?lang=js", Duration.ofSeconds(2)).lookup("x");

            assertThat(lastQuery.get()).isEqualTo("lang=js&q=x");
        }
    }

    @Nested
    @DisplayName("Failures yield empty")
    class Failures {

        @Test
        void serverError() {
            status = 500;

            assertThat(client(Duration.ofSeconds(2)).lookup("x")).isEmpty();
        }

        @Test
        void malformedBody() {
            body = "<html>oops</html>";

            assertThat(client(Duration.ofSeconds(2)).lookup("x")).isEmpty();
        }

        @Test
        void requestTimeout() {
            delayMs = 1500;

            assertThat(client(Duration.ofMillis(200)).lookup("x")).isEmpty();
        }

        @Test
        void connectionRefused() throws IOException {
            int port;
            try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                port = socket.getLocalPort();
            }

            DocHintClient client = new DocHintClient("http://127.0.0.1:" + port + "/search", Duration.ofMillis(500));

            assertThat(client.lookup("x")).isEmpty();
        }

        @Test
        void invalidEndpointUri() {
            DocHintClient client = new DocHintClient("http://bad host/ search", Duration.ofMillis(500));

            assertThat(client.lookup("x")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Disabled client")
    class Disabled {

        @Test
        void nullEndpoint() {
            DocHintClient client = new DocHintClient(null, null);

            assertThat(client.enabled()).isFalse();
            assertThat(client.lookup("x")).isEmpty();
        }

        @Test
        void blankEndpoint() {
            assertThat(new DocHintClient("  ", Duration.ofSeconds(1)).enabled()).isFalse();
        }

        @Test
        void blankQueryIsNotSent() {
            assertThat(client(Duration.ofSeconds(2)).lookup(" ")).isEmpty();
            assertThat(lastQuery.get()).isNull();
        }
    }

    @Nested
    @DisplayName("Body parsing and query encoding")
    class Helpers {

        @Test
        void emptyHintsArray() {
            assertThat(DocHintClient.parse("{\"hints\":[]}")).contains(List.of());
        }

        @Test
        void missingHintsField() {
            assertThat(DocHintClient.parse("{\"results\":[]}")).isEmpty();
        }

        @Test
        void emptyBody() {
            assertThat(DocHintClient.parse("")).isEmpty();
        }

        @Test
        void longQueriesAreTruncated() {
            String query = "x".repeat(300);

            assertThat(DocHintClient.encode(query)).hasSize(DocHintClient.MAX_QUERY_CHARS);
        }

        @Test
        void reservedCharactersAreEncoded() {
            assertThat(DocHintClient.encode("a b/c")).isEqualTo("a+b%2Fc");
        }
    }
}
