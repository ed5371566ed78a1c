package stratus.engine.monitor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracketed milestone tokens written by supervised work. This is the wire contract between
 * the monitor and every script it supervises, local or remote.
 */
public enum ProgressMarker {
    START,
    PROGRESS,
    VALIDATE,
    SUCCESS,
    ERROR,
    WARNING,
    MONITOR;

    private static final Pattern MARKER = Pattern.compile("\\[(START|PROGRESS|VALIDATE|SUCCESS|ERROR|WARNING|MONITOR)]");

    public String token() {
        return "[" + name() + "]";
    }

    /**
     * First marker on a line, with the text that follows it.
     */
    public static Optional<Match> find(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new Match(valueOf(matcher.group(1)), line.substring(matcher.end()).trim()));
    }

    public record Match(ProgressMarker marker, String message) {
    }
}
