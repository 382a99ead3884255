package io.fetchbox.worker;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * A successful response whose body has not been read yet. The caller owns the
 * stream and must close it.
 */
public record DownloadResponse(int statusCode, InputStream body, long contentLength, String contentType)
        implements Closeable {
    @Override
    public void close() throws IOException {
        body.close();
    }
}
