package stratus.engine.store;

import stratus.engine.error.StorageException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StorageRetryTest {

    private final StorageRetry retry = new StorageRetry(3, Duration.ofMillis(1));

    @Test
    void retriesStorageFailuresUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retry.call("flaky write", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new StorageException("locked", new SQLException("database is locked"));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        StorageException e = assertThrows(StorageException.class, () -> retry.run("always locked", () -> {
            attempts.incrementAndGet();
            throw new StorageException("locked", new SQLException("database is locked"));
        }));

        assertEquals("locked", e.getMessage());
        assertEquals(3, attempts.get());
    }

    @Test
    void otherExceptionsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retry.run("bad input", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new StorageRetry(0, Duration.ZERO));
    }
}
