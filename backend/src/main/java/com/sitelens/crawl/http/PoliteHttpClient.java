package com.sitelens.crawl.http;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ORIGINAL_SERVER))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, properties.getGlobalConcurrency()));
    }

    @Override
    public HttpFetchResult fetch(String url) {
        return get(url, HTML_ACCEPT);
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, acceptHeader);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} after attempt {} ({})", url, attempt, lastResult.failureMessage());
            if (!sleepBackoff(attempt, lastResult)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, null, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String userAgent = pickUserAgent();
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", userAgent)
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            byte[] responseBytes;
            try (InputStream stream = response.body()) {
                responseBytes = stream.readNBytes(properties.getMaxBodyBytes() + 1);
            }
            if (responseBytes.length > properties.getMaxBodyBytes()) {
                return errorResult(
                    url,
                    userAgent,
                    startedAt,
                    "body_too_large",
                    "response exceeded " + properties.getMaxBodyBytes() + " bytes"
                );
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                userAgent,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, userAgent, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, userAgent, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, userAgent, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, userAgent, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private String pickUserAgent() {
        List<String> agents = properties.getUserAgents();
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        if (isNetworkError(result)) {
            return properties.isRequestRetryOnNetworkErrors();
        }
        if (result.errorCode() != null && !result.errorCode().isBlank()) {
            return false;
        }
        int status = result.statusCode();
        List<Integer> retryStatuses = properties.getRequestRetryStatuses();
        if (!retryStatuses.isEmpty()) {
            return retryStatuses.contains(status);
        }
        return status == 403 || status == 408 || status == 429 || status >= 500;
    }

    private boolean isNetworkError(HttpFetchResult result) {
        return "timeout".equals(result.errorCode()) || "io_error".equals(result.errorCode());
    }

    private boolean sleepBackoff(int attempt, HttpFetchResult result) {
        long sleepMs = backoffDelayMs(attempt, result);
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long backoffDelayMs(int attempt, HttpFetchResult result) {
        if (result != null && isNetworkError(result) && properties.getRequestRetryNetworkDelayMs() > 0) {
            return properties.getRequestRetryNetworkDelayMs();
        }
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, Math.min(20, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0 || !properties.isRequestRetryJitter()) {
            return delay;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }

    private HttpFetchResult errorResult(String url, String userAgent, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            userAgent,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
