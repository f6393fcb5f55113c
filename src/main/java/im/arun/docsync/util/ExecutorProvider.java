package im.arun.docsync.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the shared bounded worker pool used to dispatch Discourse calls.
 * Keeps the number of concurrent requests against the forum small so that
 * rate limiting is rarely hit.
 */
public final class ExecutorProvider {
    private static final int DEFAULT_POOL_SIZE = 4;

    private static volatile ExecutorService instance;
    private static volatile int poolSize = DEFAULT_POOL_SIZE;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Sets the pool size used when the executor is next created.
     * Has no effect on an executor that already exists.
     */
    public static void configure(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + size);
        }
        poolSize = size;
    }

    /**
     * Returns the shared ExecutorService, creating it on first use.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "docsync-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
