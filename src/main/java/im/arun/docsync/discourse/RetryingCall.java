package im.arun.docsync.discourse;

import im.arun.docsync.exception.DiscourseException;
import im.arun.docsync.exception.HostUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;

/**
 * One remote call driven through its retry states.
 * <p>
 * {@code PENDING -> RETRYING* -> SUCCEEDED | FAILED}. Transient failures (I/O errors,
 * rate limiting, server errors) move to {@code RETRYING} until the budget is spent;
 * any runtime exception raised by the attempt is terminal and propagates unchanged.
 * <p>
 * A call marked {@link #nonIdempotent()} is only repeated when the server cannot have acted on it:
 * after rate limiting or a failure to connect.
 */
public class RetryingCall<T> {
    private static final Logger logger = LoggerFactory.getLogger(RetryingCall.class);

    public enum State { PENDING, RETRYING, SUCCEEDED, FAILED }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final String description;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Attempt<T> attempt;

    private State state = State.PENDING;
    private int attempts;
    private boolean idempotent = true;

    public RetryingCall(String description, RetryPolicy policy, Sleeper sleeper, Attempt<T> attempt) {
        this.description = description;
        this.policy = policy;
        this.sleeper = sleeper;
        this.attempt = attempt;
    }

    /**
     * Do not repeat the call once the request may have reached the server.
     */
    public RetryingCall<T> nonIdempotent() {
        this.idempotent = false;
        return this;
    }

    public T execute() {
        IOException lastFailure;
        while (true) {
            attempts++;
            long retryAfterMs = 0;
            try {
                T result = attempt.run();
                state = State.SUCCEEDED;
                return result;
            } catch (TransientResponseException e) {
                if (!idempotent && e.getStatusCode() != 429) {
                    throw notRepeated(e);
                }
                lastFailure = e;
                retryAfterMs = e.getRetryAfterMs();
            } catch (IOException e) {
                if (!idempotent && !isConnectionFailure(e)) {
                    throw notRepeated(e);
                }
                lastFailure = e;
            } catch (RuntimeException e) {
                state = State.FAILED;
                throw e;
            }

            if (attempts >= policy.getMaxAttempts()) {
                state = State.FAILED;
                throw exhausted(lastFailure);
            }

            state = State.RETRYING;
            long backoff = policy.backoffMillis(attempts, retryAfterMs);
            logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms",
                    description, attempts, policy.getMaxAttempts(), lastFailure.getMessage(), backoff);
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                state = State.FAILED;
                throw new DiscourseException("Interrupted during retry wait for " + description, ie);
            }
        }
    }

    private DiscourseException notRepeated(IOException failure) {
        state = State.FAILED;
        return new DiscourseException(String.format(
                "%s failed and was not repeated, the server may have applied it: %s",
                description, failure.getMessage()), failure);
    }

    private RuntimeException exhausted(IOException lastFailure) {
        String message = String.format("%s failed after %d attempts: %s",
                description, attempts, lastFailure.getMessage());
        if (isConnectionFailure(lastFailure)) {
            return new HostUnreachableException(message, lastFailure);
        }
        return new DiscourseException(message, lastFailure);
    }

    private static boolean isConnectionFailure(IOException failure) {
        return failure instanceof ConnectException
                || failure instanceof UnknownHostException
                || failure instanceof NoRouteToHostException;
    }

    public State getState() {
        return state;
    }

    public int getAttempts() {
        return attempts;
    }
}
