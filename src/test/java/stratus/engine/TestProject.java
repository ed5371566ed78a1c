package stratus.engine;

import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.config.Dependencies;
import stratus.engine.config.EngineConfig;
import stratus.engine.config.IniConfigProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * Copies the fixture deployment project (capabilities, workflows, deployment.ini) into a
 * scratch directory and wires an engine against it with fast polling and an in-memory database.
 */
public final class TestProject {

    private static final String FIXTURE = "/fixtures/project";

    private TestProject() {
    }

    public static Path copyTo(Path target) {
        URL url = TestProject.class.getResource(FIXTURE);
        if (url == null) {
            throw new IllegalStateException("Fixture project not on the test classpath: " + FIXTURE);
        }
        try {
            Path source = Path.of(url.toURI());
            List<Path> files;
            try (Stream<Path> walk = Files.walk(source)) {
                files = walk.toList();
            }
            for (Path file : files) {
                Path destination = target.resolve(source.relativize(file).toString());
                if (Files.isDirectory(file)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(file, destination);
                }
            }
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static EngineConfig config(Path root) {
        return EngineConfig.defaults()
                .withProjectRoot(root)
                .withDatabaseUrl("jdbc:h2:mem:test-project-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withStorageRetry(3, Duration.ofMillis(1))
                .withMarkerPollInterval(Duration.ofMillis(50))
                .withHeartbeat(Duration.ofMillis(20), Duration.ofMinutes(10));
    }

    /**
     * Engine over the project at {@code root}. Environment variables are ignored so the
     * deployment.ini values are the only configuration.
     */
    public static Dependencies open(Path root, CloudControlPlaneClient client) {
        EngineConfig config = config(root);
        return Dependencies.create(config, client, IniConfigProvider.load(config.deploymentConfigFile(), key -> null));
    }
}
