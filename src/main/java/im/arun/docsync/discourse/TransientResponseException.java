package im.arun.docsync.discourse;

import java.io.IOException;

/**
 * Rate limiting or a server side error. The request may succeed when repeated.
 */
class TransientResponseException extends IOException {
    private final int statusCode;
    private final long retryAfterMs;

    TransientResponseException(int statusCode, long retryAfterMs, String message) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    int getStatusCode() {
        return statusCode;
    }

    long getRetryAfterMs() {
        return retryAfterMs;
    }
}
