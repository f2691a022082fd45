package com.newsrelay.collectors.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

public class HttpFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpFetcher.class.getName());
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(500, 502, 503, 504);
    static final String USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final HttpClient client;
    private final HttpClient insecureClient;
    private final Duration requestTimeout;
    private final int retries;
    private final Duration backoff;

    public HttpFetcher(HttpClient client, HttpClient insecureClient, Duration requestTimeout, int retries, Duration backoff) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.insecureClient = insecureClient;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.retries = Math.max(0, retries);
        this.backoff = Objects.requireNonNull(backoff, "backoff is required");
    }

    public FetchResponse get(String url, Deadline deadline, boolean allowInsecure) throws FetchException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorCode.FETCH_ERROR, "Invalid URL " + url, e);
        }
        boolean insecureTried = false;
        FetchException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (deadline.expired()) {
                break;
            }
            try {
                FetchResponse response = sendWithRevalidation(client, uri, deadline);
                if (response.notModified() || isSuccess(response.status())) {
                    return response;
                }
                FetchException failure = new FetchException(
                        FetchErrorCode.http(response.status()), "HTTP " + response.status() + " from " + url);
                if (!RETRYABLE_STATUSES.contains(response.status())) {
                    throw failure;
                }
                last = failure;
            } catch (IOException e) {
                if (FetchErrorClassifier.isSslFailure(e) && allowInsecure && insecureClient != null && !insecureTried) {
                    insecureTried = true;
                    LOGGER.warning("TLS failure for " + url + ", retrying without certificate checks");
                    try {
                        FetchResponse response = sendWithRevalidation(insecureClient, uri, deadline);
                        if (response.notModified() || isSuccess(response.status())) {
                            return response;
                        }
                        throw new FetchException(FetchErrorCode.http(response.status()), "HTTP " + response.status() + " from " + url);
                    } catch (IOException insecureError) {
                        throw new FetchException(FetchErrorClassifier.classify(insecureError),
                                "Insecure retry failed for " + url + ": " + FetchErrorClassifier.rootMessage(insecureError),
                                insecureError);
                    }
                }
                last = new FetchException(FetchErrorClassifier.classify(e),
                        "Fetch failed for " + url + ": " + FetchErrorClassifier.rootMessage(e), e);
            }
            if (attempt < retries) {
                sleepBefore(attempt, deadline, url);
            }
        }
        if (last != null) {
            throw last;
        }
        throw new FetchException(FetchErrorCode.TIMEOUT, "Deadline exceeded before fetching " + url);
    }

    private FetchResponse sendWithRevalidation(HttpClient httpClient, URI uri, Deadline deadline) throws IOException, FetchException {
        HttpResponse<String> response = send(httpClient, request(uri, deadline, false));
        if (response.statusCode() != 304) {
            return toResponse(response);
        }
        if (deadline.expired()) {
            return new FetchResponse(304, "", uri, true);
        }
        HttpResponse<String> forced = send(httpClient, request(uri, deadline, true));
        if (forced.statusCode() == 304) {
            return new FetchResponse(304, "", forced.uri(), true);
        }
        return toResponse(forced);
    }

    private HttpRequest request(URI uri, Deadline deadline, boolean noCache) throws FetchException {
        Duration timeout = deadline.clip(requestTimeout);
        if (timeout.isZero()) {
            throw new FetchException(FetchErrorCode.TIMEOUT, "Deadline exceeded before fetching " + uri);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,application/rss+xml,*/*;q=0.8")
                .header("Accept-Language", "ru-RU,ru;q=0.9,en-US;q=0.8,en;q=0.7");
        if (noCache) {
            builder.header("Cache-Control", "no-cache, no-store, must-revalidate")
                    .header("Pragma", "no-cache");
        }
        return builder.build();
    }

    private static HttpResponse<String> send(HttpClient httpClient, HttpRequest request) throws IOException, FetchException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorCode.TIMEOUT, "Interrupted while fetching " + request.uri(), e);
        }
    }

    private static FetchResponse toResponse(HttpResponse<String> response) {
        String body = response.body() == null ? "" : response.body();
        return new FetchResponse(response.statusCode(), body, response.uri(), false);
    }

    private void sleepBefore(int attempt, Deadline deadline, String url) throws FetchException {
        long base = backoff.toMillis() * (1L << Math.min(attempt, 10));
        long jitter = base <= 0 ? 0 : ThreadLocalRandom.current().nextLong(base / 4 + 1);
        long wait = Math.min(base + jitter, deadline.remaining().toMillis());
        if (wait <= 0) {
            return;
        }
        try {
            Thread.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorCode.TIMEOUT, "Interrupted while backing off for " + url, e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
