package stratus.cli;

import picocli.CommandLine;
import stratus.engine.TestProject;
import stratus.engine.client.FakeControlPlaneClient;
import stratus.engine.client.RemoteExecutionState;
import stratus.engine.config.Dependencies;
import stratus.engine.config.IniConfigProvider;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class StratusCommandTest {

    private static final String VNET_ID = "/subscriptions/sub-1/resourceGroups/rg-avd/providers/Microsoft.Network/virtualNetworks/vnet-avd";

    @TempDir
    Path root;

    private FakeControlPlaneClient client;
    private StratusCommand command;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        TestProject.copyTo(root);
        client = new FakeControlPlaneClient();
        String dbUrl = "jdbc:h2:mem:test-cli-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        command = new StratusCommand(config -> Dependencies.create(
                config.withDatabaseUrl(dbUrl)
                        .withStorageRetry(3, Duration.ofMillis(1))
                        .withMarkerPollInterval(Duration.ofMillis(50))
                        .withHeartbeat(Duration.ofMillis(20), Duration.ofMinutes(10)),
                client,
                IniConfigProvider.load(config.deploymentConfigFile(), key -> null)));
    }

    @AfterEach
    void tearDown() {
        command.close();
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cli = StratusCommand.commandLine(command);
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        String[] full = new String[args.length + 2];
        full[0] = "--project-root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cli.execute(full);
    }

    @Test
    void operationRunPrintsOutcome() {
        int exit = run("operation", "run", "vnet-create", "-p", "vnet_name=vnet-avd");

        assertEquals(StratusCommand.EXIT_OK, exit, err.toString());
        assertTrue(out.toString().startsWith("vnet-create completed in "), out.toString());
    }

    @Test
    void operationResumeReportsSkip() {
        run("operation", "run", "nsg-create");

        int exit = run("operation", "resume", "nsg-create");

        assertEquals(StratusCommand.EXIT_OK, exit);
        assertTrue(out.toString().contains("nsg-create skipped: checkpoint already completed"), out.toString());
    }

    @Test
    void validationFailuresExitWithTwo() {
        int missingParam = run("operation", "run", "vnet-delete");
        assertEquals(StratusCommand.EXIT_VALIDATION, missingParam);
        assertTrue(err.toString().contains("resource_id"), err.toString());

        int unknown = run("operation", "show", "no-such-operation");
        assertEquals(StratusCommand.EXIT_VALIDATION, unknown);
        assertTrue(err.toString().contains("Unknown operation: no-such-operation"));
    }

    @Test
    void prerequisiteAndExecutionFailuresExitWithOne() {
        int prerequisite = run("operation", "run", "subnet-create");
        assertEquals(StratusCommand.EXIT_FAILURE, prerequisite);
        assertTrue(err.toString().contains("requires vnet-create"), err.toString());

        int failed = run("operation", "run", "nsg-create", "-p", "should_fail=true");
        assertEquals(StratusCommand.EXIT_FAILURE, failed);
        assertTrue(err.toString().contains("Last output:"), err.toString());
        assertTrue(err.toString().contains("[ERROR] security rule conflicts"), err.toString());
    }

    @Test
    void operationListAndShow() {
        assertEquals(StratusCommand.EXIT_OK, run("operation", "list", "--capability", "networking"));
        String listing = out.toString();
        assertTrue(listing.indexOf("vnet-create") < listing.indexOf("subnet-create"));
        assertFalse(listing.contains("golden-image-install-apps"));

        run("operation", "run", "vnet-create");
        assertEquals(StratusCommand.EXIT_OK, run("operation", "show", "vnet-create"));
        assertTrue(out.toString().contains("Checkpoint:  completed"), out.toString());
        assertTrue(out.toString().contains("Last run:    vnet-create_"), out.toString());
    }

    @Test
    void operationValidate() {
        assertEquals(StratusCommand.EXIT_OK, run("operation", "validate", "subnet-create"));
        assertTrue(out.toString().contains("subnet-create: valid"));
    }

    @Test
    void capabilityListShowAndRun() {
        assertEquals(StratusCommand.EXIT_OK, run("capability", "list"));
        assertTrue(out.toString().contains("golden-image"));
        assertTrue(out.toString().contains("networking"));

        assertEquals(StratusCommand.EXIT_VALIDATION, run("capability", "show", "storage"));

        client.thenState(RemoteExecutionState.SUCCEEDED, "[SUCCESS] install-apps", 0);
        assertEquals(StratusCommand.EXIT_OK, run("capability", "run", "golden-image"));
        assertTrue(out.toString().contains("Capability golden-image: 1 operation(s) done"), out.toString());
    }

    @Test
    void workflowRunListShowAndResume() {
        Path broken = root.resolve("workflows").resolve("networking-broken-nsg.yaml");

        assertEquals(StratusCommand.EXIT_FAILURE, run("workflow", "run", broken.toString()));
        String report = out.toString();
        assertTrue(report.contains(": failed (1/3 steps completed)"), report);
        String executionId = report.substring("Execution ".length(), report.indexOf(':'));

        assertEquals(StratusCommand.EXIT_OK, run("workflow", "list"));
        assertTrue(out.toString().contains(executionId));

        assertEquals(StratusCommand.EXIT_OK, run("workflow", "show", executionId));
        assertTrue(out.toString().contains("Failed steps: [Network security group]"), out.toString());

        assertEquals(StratusCommand.EXIT_FAILURE, run("workflow", "resume", executionId));
        assertEquals(StratusCommand.EXIT_VALIDATION, run("workflow", "show", "wf_unknown"));
    }

    @Test
    void workflowValidate() throws Exception {
        Path invalid = root.resolve("workflows").resolve("invalid.yaml");
        Files.writeString(invalid, "workflow:\n  id: invalid\n  steps:\n    - name: x\n      operation: nope\n");

        assertEquals(StratusCommand.EXIT_OK,
                run("workflow", "validate", root.resolve("workflows").resolve("networking.yaml").toString()));
        assertEquals(StratusCommand.EXIT_VALIDATION, run("workflow", "validate", invalid.toString()));
        assertTrue(out.toString().contains("2 problem(s)"), out.toString());
    }

    @Test
    void discoverBuildAndExportGraph() throws Exception {
        client.listing("rg-avd", """
                [{"id": "%1$s", "type": "Microsoft.Network/virtualNetworks",
                  "properties": {"subnets": [{"id": "%1$s/subnets/snet-hosts"}]}},
                 {"id": "%1$s/subnets/snet-hosts", "type": "Microsoft.Network/virtualNetworks/subnets"}]
                """.formatted(VNET_ID));

        assertEquals(StratusCommand.EXIT_OK, run("discover", "rg-avd"));
        assertTrue(out.toString().startsWith("Scope rg-avd: 2 resources, "), out.toString());

        assertEquals(StratusCommand.EXIT_OK, run("graph", "build"));
        assertTrue(out.toString().contains("Nodes: 2, edges: "), out.toString());

        Path dot = root.resolve("graph.dot");
        assertEquals(StratusCommand.EXIT_OK, run("graph", "export", "--format", "dot", "-o", dot.toString()));
        assertTrue(Files.readString(dot).startsWith("digraph"));
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertEquals(StratusCommand.EXIT_OK, run());
        assertTrue(out.toString().contains("Usage: stratus"));
    }

    @Test
    void metricsSummarizeOperationHistory() {
        run("operation", "run", "vnet-create");
        run("operation", "run", "nsg-create", "-p", "should_fail=true");

        assertEquals(StratusCommand.EXIT_OK, run("metrics", "--capability", "networking"));
        String text = out.toString();
        assertTrue(text.contains("Operations in networking: 2 settled, 1 succeeded, 1 failed (50.00% success)"), text);
        assertTrue(text.contains("Most failing:"), text);
        assertTrue(text.contains("nsg-create"), text);

        assertEquals(StratusCommand.EXIT_OK, run("metrics", "--format", "json"));
        assertTrue(out.toString().contains("\"failure_trend\""), out.toString());

        assertEquals(StratusCommand.EXIT_VALIDATION, run("metrics", "--limit", "0"));
    }
}
