package stratus.engine.monitor;

import java.time.Duration;

/**
 * Waits between supervision ticks. Tests substitute an implementation that advances a
 * fake clock instead of blocking.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(Math.max(0, duration.toMillis()));
    }
}
