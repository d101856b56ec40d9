package dev.konduit.crawl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches one HTML page per call through the shared crawler {@link RestClient}.
 *
 * <p>A counting gate bounds how many requests are in flight at once across every crawl that
 * shares this bean. Each request carries a User-Agent drawn at random from the configured pool
 * and the configured Accept-Language. Only a 2xx response with an HTML content type yields a
 * body; timeouts, error statuses, other content types and transport errors all yield
 * {@link Optional#empty()} and are never retried.
 *
 * <p>Status and content type are checked before the body is read. The body is then read in
 * chunks and dropped once it exceeds {@link #MAX_BODY_BYTES} or once the whole fetch outlasts
 * {@code konduit.crawler.timeout-ms}, so a slow or endless response cannot hold a gate permit
 * past that deadline plus one socket read.
 */
@Service
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    /** Largest HTML body accepted, in bytes. */
    static final int MAX_BODY_BYTES = 2 * 1024 * 1024;

    private static final int READ_BUFFER_BYTES = 8192;

    private final RestClient restClient;
    private final Semaphore gate;
    private final List<String> userAgents;
    private final String acceptLanguage;
    private final long deadlineNanos;

    public PageFetcher(@Qualifier("crawlerRestClient") RestClient restClient,
                       CrawlerProperties properties) {
        this.restClient = restClient;
        this.gate = new Semaphore(properties.concurrency());
        this.userAgents = properties.userAgents();
        this.acceptLanguage = properties.acceptLanguage();
        this.deadlineNanos = properties.timeoutMs() * 1_000_000L;
    }

    /**
     * Fetch a page's HTML.
     *
     * @param url absolute http(s) URL
     * @return the HTML body, or empty when the page is unusable
     */
    public Optional<String> fetch(String url) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        long deadline = System.nanoTime() + deadlineNanos;
        try {
            return restClient.get()
                    .uri(URI.create(url))
                    .header(HttpHeaders.USER_AGENT, pickUserAgent())
                    .header(HttpHeaders.ACCEPT_LANGUAGE, acceptLanguage)
                    .exchange((request, response) -> acceptHtml(url, response, deadline));
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
            return Optional.empty();
        } finally {
            gate.release();
        }
    }

    /** Permits currently free in the fetch gate. */
    int availablePermits() {
        return gate.availablePermits();
    }

    private Optional<String> acceptHtml(String url, ClientHttpResponse response, long deadline)
            throws IOException {
        if (!response.getStatusCode().is2xxSuccessful()) {
            log.debug("Skipping {}: status {}", url, response.getStatusCode().value());
            return Optional.empty();
        }
        MediaType contentType = response.getHeaders().getContentType();
        if (contentType == null || !MediaType.TEXT_HTML.isCompatibleWith(contentType)) {
            log.debug("Skipping {}: content type {}", url, contentType);
            return Optional.empty();
        }
        long declaredLength = response.getHeaders().getContentLength();
        if (declaredLength > MAX_BODY_BYTES) {
            log.debug("Skipping {}: declared length {} over {} bytes",
                    url, declaredLength, MAX_BODY_BYTES);
            return Optional.empty();
        }
        return readBody(url, response.getBody(), deadline)
                .map(bytes -> new String(bytes, charsetOf(contentType)))
                .filter(html -> !html.isBlank());
    }

    private Optional<byte[]> readBody(String url, InputStream body, long deadline)
            throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_BUFFER_BYTES];
        int read;
        while ((read = body.read(buffer)) != -1) {
            if (out.size() + read > MAX_BODY_BYTES) {
                log.debug("Skipping {}: body over {} bytes", url, MAX_BODY_BYTES);
                return Optional.empty();
            }
            out.write(buffer, 0, read);
            if (System.nanoTime() - deadline > 0) {
                log.warn("Failed to fetch {}: body not received within {} ms",
                        url, deadlineNanos / 1_000_000L);
                return Optional.empty();
            }
        }
        return Optional.of(out.toByteArray());
    }

    private static Charset charsetOf(MediaType contentType) {
        Charset charset = contentType.getCharset();
        return charset != null ? charset : StandardCharsets.UTF_8;
    }

    private String pickUserAgent() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
