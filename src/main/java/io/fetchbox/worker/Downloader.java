package io.fetchbox.worker;

import io.fetchbox.model.Header;
import io.fetchbox.model.ProxyEndpoint;
import io.fetchbox.retry.TaskFailure;

import java.util.List;

public interface Downloader {
    /**
     * Issues a GET for {@code url} through {@code endpoint}. Non-2xx responses are
     * reported as {@link io.fetchbox.retry.FailureCode#DOWNLOAD_HTTP_STATUS}.
     */
    DownloadResponse fetch(String url, List<Header> headers, ProxyEndpoint endpoint) throws TaskFailure;
}
