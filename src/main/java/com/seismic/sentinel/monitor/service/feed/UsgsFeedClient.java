package com.seismic.sentinel.monitor.service.feed;

import com.seismic.sentinel.monitor.common.exception.FeedFetchException;
import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import com.seismic.sentinel.monitor.model.FeedBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * USGS GeoJSON summary feed over HTTP. One GET per call; connecting, waiting and reading the body together
 * must finish within the configured fetch timeout or the fetch fails as TRANSIENT.
 */
@Slf4j
@Service
public class UsgsFeedClient implements FeedClient {

    private static final List<MediaType> ACCEPT = List.of(MediaType.APPLICATION_JSON, new MediaType("application", "geo+json"));

    private final RestTemplate feedRestTemplate;
    private final GeoJsonEventParser parser;
    private final MonitorProperties props;
    private final Clock clock;
    private final Executor fetchExecutor;

    public UsgsFeedClient(RestTemplate feedRestTemplate,
                          GeoJsonEventParser parser,
                          MonitorProperties props,
                          Clock clock,
                          @Qualifier("feedFetchExecutor") Executor fetchExecutor) {
        this.feedRestTemplate = feedRestTemplate;
        this.parser = parser;
        this.props = props;
        this.clock = clock;
        this.fetchExecutor = fetchExecutor;
    }

    @Override
    public FeedBatch fetch() {
        URI uri = URI.create(props.getFeedUrl());
        Duration timeout = props.getFetchTimeout();
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();

        CompletableFuture<String> download;
        try {
            download = CompletableFuture.supplyAsync(() -> download(uri, deadline), fetchExecutor);
        } catch (RejectedExecutionException e) {
            throw new FeedFetchException(FetchErrorKind.TRANSIENT, "No fetch worker free; previous download still closing", e);
        }

        String body;
        try {
            body = download.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            download.cancel(true);
            throw new FeedFetchException(FetchErrorKind.TRANSIENT,
                    "Feed fetch did not complete within " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            download.cancel(true);
            Thread.currentThread().interrupt();
            throw new FeedFetchException(FetchErrorKind.TRANSIENT, "Interrupted while fetching the feed", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }

        Instant fetchedAt = clock.instant();
        FeedBatch batch = parser.parse(body, fetchedAt);
        log.debug("Fetched {} events ({} skipped) from {} in {}ms", batch.fetched(), batch.getSkipped(), uri,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return batch;
    }

    private String download(URI uri, long deadlineNanos) {
        return feedRestTemplate.execute(uri, HttpMethod.GET,
                request -> request.getHeaders().setAccept(ACCEPT),
                response -> readBody(response, deadlineNanos));
    }

    /**
     * Reads the body, giving up once the deadline has passed so an abandoned download frees its worker.
     */
    private static String readBody(ClientHttpResponse response, long deadlineNanos) throws IOException {
        MediaType type = response.getHeaders().getContentType();
        Charset charset = (type != null && type.getCharset() != null) ? type.getCharset() : StandardCharsets.UTF_8;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        try (InputStream in = response.getBody()) {
            int n;
            while ((n = in.read(buf)) != -1) {
                out.write(buf, 0, n);
                if (System.nanoTime() - deadlineNanos > 0) {
                    throw new SocketTimeoutException("Feed body still streaming at the fetch deadline");
                }
            }
        }
        return out.toString(charset);
    }

    private static FeedFetchException translate(Throwable cause) {
        if (cause instanceof FeedFetchException ffe) {
            return ffe;
        }
        if (cause instanceof ResourceAccessException e) {
            // timeouts and refused connections surface here
            return new FeedFetchException(FetchErrorKind.TRANSIENT, "Feed unreachable: " + e.getMessage(), e);
        }
        if (cause instanceof HttpServerErrorException e) {
            return new FeedFetchException(FetchErrorKind.TRANSIENT, "Feed returned " + e.getStatusCode(), e);
        }
        if (cause instanceof HttpClientErrorException e) {
            FetchErrorKind kind = e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    ? FetchErrorKind.TRANSIENT : FetchErrorKind.PERMANENT;
            return new FeedFetchException(kind, "Feed returned " + e.getStatusCode(), e);
        }
        if (cause instanceof RestClientException e) {
            return new FeedFetchException(FetchErrorKind.PERMANENT, "Feed request failed: " + e.getMessage(), e);
        }
        return new FeedFetchException(FetchErrorKind.PERMANENT, "Feed request failed: " + cause, cause);
    }
}
