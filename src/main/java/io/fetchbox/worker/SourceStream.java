package io.fetchbox.worker;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Wraps a download body on its way into storage: hashes and counts bytes as they
 * pass, and remembers a read failure so the caller can tell a broken download
 * apart from a failing upload.
 */
final class SourceStream extends FilterInputStream {
    private final MessageDigest digest;
    private long bytesRead;
    private IOException readFailure;

    SourceStream(InputStream in) {
        super(in);
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public int read() throws IOException {
        try {
            int b = super.read();
            if (b >= 0) {
                digest.update((byte) b);
                bytesRead++;
            }
            return b;
        } catch (IOException e) {
            readFailure = e;
            throw e;
        }
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        try {
            int n = super.read(buf, off, len);
            if (n > 0) {
                digest.update(buf, off, n);
                bytesRead += n;
            }
            return n;
        } catch (IOException e) {
            readFailure = e;
            throw e;
        }
    }

    @Override
    public long skip(long n) throws IOException {
        throw new IOException("skip is not supported on a hashed download stream");
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    long bytesRead() {
        return bytesRead;
    }

    IOException readFailure() {
        return readFailure;
    }

    String sha256Hex() {
        return HexFormat.of().formatHex(digest.digest());
    }
}
