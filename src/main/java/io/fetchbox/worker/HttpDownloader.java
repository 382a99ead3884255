package io.fetchbox.worker;

import io.fetchbox.model.Header;
import io.fetchbox.model.ProxyEndpoint;
import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.TaskFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link Downloader} on the JDK HTTP client. One client is kept per proxy
 * endpoint; the response body is handed back as a stream.
 */
public final class HttpDownloader implements Downloader {
    private static final Logger log = LoggerFactory.getLogger(HttpDownloader.class);

    // Headers the JDK client manages itself and refuses to accept from callers.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade"
    );

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final String userAgent;
    private final ConcurrentMap<ProxyEndpoint, HttpClient> clients;

    public HttpDownloader(Duration connectTimeout, Duration requestTimeout, String userAgent) {
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
        this.clients = new ConcurrentHashMap<>();
    }

    @Override
    public DownloadResponse fetch(String url, List<Header> headers, ProxyEndpoint endpoint) throws TaskFailure {
        URI uri = parseUrl(url);
        HttpRequest request = buildRequest(uri, headers);
        HttpClient client = clients.computeIfAbsent(endpoint, this::newClient);
        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpConnectTimeoutException e) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_TIMEOUT, "Connect timeout via " + endpoint + " for " + url, e);
        } catch (HttpTimeoutException e) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_TIMEOUT, "Request timeout via " + endpoint + " for " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION, "Interrupted while downloading " + url, e);
        } catch (IOException e) {
            throw classifyIo(e, url, endpoint);
        } catch (UnresolvedAddressException e) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_DNS, "Cannot resolve host for " + url, e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            closeQuietly(response.body());
            throw TaskFailure.httpStatus(status, url);
        }
        long length = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        return new DownloadResponse(status, response.body(), length, contentType);
    }

    private URI parseUrl(String url) throws TaskFailure {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_MALFORMED_URL, "Malformed URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_MALFORMED_URL, "Unsupported URL scheme: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_MALFORMED_URL, "URL has no host: " + url);
        }
        return uri;
    }

    private HttpRequest buildRequest(URI uri, List<Header> headers) throws TaskFailure {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET();
        boolean hasUserAgent = false;
        for (Header header : headers) {
            String lower = header.name().toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(lower)) {
                log.debug("Skipping restricted header {} for {}", header.name(), uri);
                continue;
            }
            if ("user-agent".equals(lower)) {
                hasUserAgent = true;
            }
            try {
                builder.header(header.name(), header.value());
            } catch (IllegalArgumentException e) {
                throw TaskFailure.of(FailureCode.DOWNLOAD_MALFORMED_URL, "Invalid header " + header.name() + " for " + uri, e);
            }
        }
        if (!hasUserAgent && userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        return builder.build();
    }

    private HttpClient newClient(ProxyEndpoint endpoint) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (!endpoint.direct()) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(endpoint.host(), endpoint.port())));
        }
        return builder.build();
    }

    private static TaskFailure classifyIo(IOException e, String url, ProxyEndpoint endpoint) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof UnknownHostException || cause instanceof UnresolvedAddressException) {
                return TaskFailure.of(FailureCode.DOWNLOAD_DNS, "Cannot resolve host for " + url + " via " + endpoint, e);
            }
            if (cause instanceof HttpTimeoutException) {
                return TaskFailure.of(FailureCode.DOWNLOAD_TIMEOUT, "Timeout via " + endpoint + " for " + url, e);
            }
            cause = cause.getCause();
        }
        if (e instanceof ConnectException) {
            return TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION, "Connection refused via " + endpoint + " for " + url, e);
        }
        String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION, "Connection error via " + endpoint + " for " + url + ": " + detail, e);
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close discarded response body", e);
        }
    }
}
