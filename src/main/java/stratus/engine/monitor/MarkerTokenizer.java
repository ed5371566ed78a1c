package stratus.engine.monitor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State machine over supervised output. All marker interpretation goes through here.
 * <p>
 * AWAITING_START → RUNNING on [START] or [PROGRESS]; → VALIDATING on [VALIDATE];
 * → SUCCEEDED on [SUCCESS]. [ERROR] moves to FAILED from any phase and is sticky.
 * Not thread-safe: fed only by the supervising thread.
 */
public final class MarkerTokenizer {

    public enum Phase {
        AWAITING_START,
        RUNNING,
        VALIDATING,
        SUCCEEDED,
        FAILED
    }

    private final Map<ProgressMarker, Integer> counts = new EnumMap<>(ProgressMarker.class);
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private Phase phase = Phase.AWAITING_START;
    private String lastProgress;
    private int lines;

    /**
     * Consume one output line.
     *
     * @return the marker found on the line, if any
     */
    public Optional<ProgressMarker.Match> feed(String line) {
        lines++;
        Optional<ProgressMarker.Match> found = ProgressMarker.find(line);
        found.ifPresent(this::apply);
        return found;
    }

    private void apply(ProgressMarker.Match match) {
        counts.merge(match.marker(), 1, Integer::sum);
        switch (match.marker()) {
            case START -> advance(Phase.RUNNING);
            case PROGRESS -> {
                lastProgress = match.message();
                advance(Phase.RUNNING);
            }
            case VALIDATE -> advance(Phase.VALIDATING);
            case SUCCESS -> advance(Phase.SUCCEEDED);
            case ERROR -> {
                errors.add(match.message());
                phase = Phase.FAILED;
            }
            case WARNING -> warnings.add(match.message());
            case MONITOR -> {
                // informational only
            }
        }
    }

    private void advance(Phase next) {
        if (phase != Phase.FAILED && next.ordinal() >= phase.ordinal()) {
            phase = next;
        }
    }

    public Phase phase() {
        return phase;
    }

    public boolean started() {
        return count(ProgressMarker.START) > 0;
    }

    public boolean successSeen() {
        return count(ProgressMarker.SUCCESS) > 0;
    }

    public boolean errorSeen() {
        return !errors.isEmpty();
    }

    public int count(ProgressMarker marker) {
        return counts.getOrDefault(marker, 0);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public Optional<String> lastProgress() {
        return Optional.ofNullable(lastProgress);
    }

    public int lines() {
        return lines;
    }
}
