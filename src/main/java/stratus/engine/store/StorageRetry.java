package stratus.engine.store;

import stratus.engine.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Re-runs a whole state-store transaction on {@link StorageException}, a bounded number of
 * times with linear backoff. Any other exception propagates immediately.
 */
public final class StorageRetry {

    private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);

    private final int maxAttempts;
    private final Duration backoff;

    public StorageRetry(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public <T> T call(String description, Supplier<T> transaction) {
        StorageException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transaction.get();
            } catch (StorageException e) {
                last = e;
                if (attempt < maxAttempts) {
                    log.warn("{} failed (attempt {}/{}): {}", description, attempt, maxAttempts,
                            rootMessage(e));
                    pause(attempt);
                }
            }
        }
        log.error("{} failed after {} attempts", description, maxAttempts);
        throw last;
    }

    public void run(String description, Runnable transaction) {
        call(description, () -> {
            transaction.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(int attempt) {
        try {
            Thread.sleep(backoff.toMillis() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying storage transaction", e);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
