package com.elssolution.vuegraf.integration.http;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends a request and retries 429, 5xx, timeouts and I/O errors with a short backoff (+ jitter).
 * Returns the body only on 2xx; everything else ends in an {@link UpstreamException}.
 */
@Slf4j
public class RetryingHttp {

    private static final int[] DEFAULT_RETRY_DELAYS_MS = {500, 1000};

    private final HttpClient httpClient;
    private final String service;
    private final int[] retryDelaysMs;

    public RetryingHttp(HttpClient httpClient, String service) {
        this(httpClient, service, DEFAULT_RETRY_DELAYS_MS);
    }

    public RetryingHttp(HttpClient httpClient, String service, int[] retryDelaysMs) {
        this.httpClient = httpClient;
        this.service = service;
        this.retryDelaysMs = retryDelaysMs.clone();
    }

    public String send(HttpRequest req) throws UpstreamException {
        UpstreamException last = null;
        for (int attempt = 0; attempt <= retryDelaysMs.length; attempt++) {
            try {
                if (log.isDebugEnabled()) {
                    log.debug("{} request > {} {}", service, req.method(), req.uri());
                }
                HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
                int sc = resp.statusCode();
                if (sc / 100 == 2) return resp.body();

                last = new UpstreamException(service + " HTTP " + sc + " — " + truncate(resp.body(), 240), sc, null);
                boolean retryable = sc == 429 || (sc >= 500 && sc < 600);
                if (!retryable) throw last;

            } catch (HttpTimeoutException e) {
                last = new UpstreamTimeoutException(service + " timeout: " + e.getMessage(), e);
            } catch (UpstreamException e) {
                throw e;
            } catch (IOException e) {
                last = new UpstreamException(service + " I/O error: " + e.getMessage(), e);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new UpstreamException(service + " request interrupted", ie);
            }

            if (attempt < retryDelaysMs.length) {
                int sleepMs = retryDelaysMs[attempt] + ThreadLocalRandom.current().nextInt(80, 180);
                log.warn("{} — retrying in {} ms (attempt {}/{})",
                        last.getMessage(), sleepMs, attempt + 1, retryDelaysMs.length);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new UpstreamException(service + " retry interrupted", ie);
                }
            }
        }
        throw last;
    }

    /** HTTP/1.1 client shared by the sessions of all accounts. */
    public static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }
}
