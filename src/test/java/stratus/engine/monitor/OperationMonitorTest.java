package stratus.engine.monitor;

import stratus.engine.error.EngineException;
import stratus.engine.model.OperationCategory;
import stratus.engine.operation.RenderedCommand;
import stratus.engine.operation.TemplateType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OperationMonitorTest {

    private static final RenderedCommand COMMAND = new RenderedCommand("nsg-create", TemplateType.SHELL, "true",
            null, null, OperationCategory.WAIT, Duration.ofSeconds(5), Duration.ofSeconds(10), null);

    /**
     * Supervisor whose work finishes after a fixed number of ticks.
     */
    private static final class CountingSupervisor implements Supervisor {
        private final int ticksToFinish;
        private final AtomicInteger ticks = new AtomicInteger();
        private final AtomicBoolean cancelled = new AtomicBoolean();

        CountingSupervisor(int ticksToFinish) {
            this.ticksToFinish = ticksToFinish;
        }

        @Override
        public Supervision start(RenderedCommand command, String runId, boolean validationEnabled) {
            return new Supervision() {
                @Override
                public Optional<MonitorResult> tick(Instant now) {
                    if (ticks.incrementAndGet() < ticksToFinish) {
                        return Optional.empty();
                    }
                    return Optional.of(new MonitorResult(0, Duration.ZERO, false, List.of(),
                            List.of(), "", null));
                }

                @Override
                public void cancel() {
                    cancelled.set(true);
                }
            };
        }

        @Override
        public Duration pollInterval(RenderedCommand command) {
            return Duration.ofSeconds(60);
        }
    }

    @Test
    void registryMustCoverEveryCategory() {
        CountingSupervisor supervisor = new CountingSupervisor(1);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new OperationMonitor(
                Map.of(OperationCategory.FAST, supervisor, OperationCategory.WAIT, supervisor),
                Clock.systemUTC(), Sleeper.system()));
        assertTrue(e.getMessage().contains("HEARTBEAT"));
    }

    @Test
    void dispatchesByCategoryAndSleepsBetweenTicks() {
        CountingSupervisor fast = new CountingSupervisor(1);
        CountingSupervisor wait = new CountingSupervisor(3);
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        OperationMonitor monitor = new OperationMonitor(Map.of(
                OperationCategory.FAST, fast,
                OperationCategory.WAIT, wait,
                OperationCategory.HEARTBEAT, fast), clock, clock.sleeper());

        monitor.supervise(COMMAND, "rec-1", false);

        assertEquals(0, fast.ticks.get());
        assertEquals(3, wait.ticks.get());
        assertEquals(Instant.parse("2026-01-01T00:02:00Z"), clock.instant());
    }

    @Test
    void interruptCancelsWork() {
        CountingSupervisor wait = new CountingSupervisor(Integer.MAX_VALUE);
        OperationMonitor monitor = new OperationMonitor(Map.of(
                OperationCategory.FAST, wait,
                OperationCategory.WAIT, wait,
                OperationCategory.HEARTBEAT, wait), Clock.systemUTC(), duration -> {
                    throw new InterruptedException("shutdown");
                });

        try {
            assertThrows(EngineException.class, () -> monitor.supervise(COMMAND, "rec-1", false));
            assertTrue(wait.cancelled.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
