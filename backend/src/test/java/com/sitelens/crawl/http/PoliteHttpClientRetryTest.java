package com.sitelens.crawl.http;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new CrawlerProperties();
        properties.setGlobalConcurrency(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setUserAgents(List.of("sitelens-test/1.0"));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>").setHeader("Content-Type", "text/html"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch(server.url("/page").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(result.contentType()).isEqualTo("text/html");
        assertThat(server.getRequestCount()).isEqualTo(2);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("sitelens-test/1.0");
        assertThat(request.getHeader("Accept")).startsWith("text/html");
    }

    @Test
    void givesUpAfterConfiguredRetries() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        }
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch(server.url("/limited").toString());

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.failureMessage()).isEqualTo("HTTP error: 429");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void notFoundIsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch(server.url("/missing").toString());

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void configuredStatusesNarrowTheRetrySet() {
        properties.setRequestRetryStatuses(List.of(403, 429));
        server.enqueue(new MockResponse().setResponseCode(503));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult unavailable = client.fetch(server.url("/busy").toString());

        assertThat(unavailable.statusCode()).isEqualTo(503);
        assertThat(server.getRequestCount()).isEqualTo(1);

        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult limited = client.fetch(server.url("/limited").toString());

        assertThat(limited.isSuccessful()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void networkErrorRetriesCanBeDisabled() {
        properties.setRequestRetryOnNetworkErrors(false);
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch(server.url("/drop").toString());

        assertThat(result.errorCode()).isEqualTo("io_error");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void reviewFetchPolicyUsesDoublingDelaysAndFixedNetworkDelay() {
        properties.setRequestRetryBaseDelayMs(2000);
        properties.setRequestRetryMaxDelayMs(0);
        properties.setRequestRetryJitter(false);
        properties.setRequestRetryNetworkDelayMs(2000);
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);
        HttpFetchResult limited = result(429, null);
        HttpFetchResult dropped = result(0, "io_error");

        assertThat(client.backoffDelayMs(1, limited)).isEqualTo(2000);
        assertThat(client.backoffDelayMs(2, limited)).isEqualTo(4000);
        assertThat(client.backoffDelayMs(1, dropped)).isEqualTo(2000);
        assertThat(client.backoffDelayMs(2, dropped)).isEqualTo(2000);
    }

    @Test
    void oversizedBodyIsRejected() {
        properties.setMaxBodyBytes(1024);
        server.enqueue(new MockResponse().setResponseCode(200).setBody("x".repeat(4096)));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch(server.url("/big").toString());

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.body()).isNull();
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void urlWithoutHostIsReportedWithoutRequest() {
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.fetch("https://");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }

    private static HttpFetchResult result(int status, String errorCode) {
        return new HttpFetchResult(
            "https://shop.example.com/reviews",
            null,
            status,
            null,
            null,
            "sitelens-test/1.0",
            Instant.now(),
            Duration.ZERO,
            errorCode,
            errorCode == null ? null : "connection reset"
        );
    }
}
