package io.tombwatch.cli;

import com.sun.net.httpserver.HttpServer;
import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.harness.TombstoneHarness;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;

final class TombWatchCommandTest {

    @Test
    void globalOptionsOverrideSettings() {
        TombWatchCommand command = new TombWatchCommand();
        CommandLine.ParseResult parsed = new CommandLine(command).parseArgs(
                "--master-url", "10.0.0.7:8080", "--secret", "s3cret", "--out", "reports", "run", "--scenario", "b");

        Assertions.assertEquals("run", parsed.subcommand().commandSpec().name());
        TombWatchSettings settings = command.settings();
        Assertions.assertEquals("http://10.0.0.7:8080", settings.masterUrl());
        Assertions.assertEquals("s3cret", settings.secret());
        Assertions.assertEquals("reports", settings.outputDir());
    }

    @Test
    void verifyAcceptsCommaSeparatedFiles() {
        TombWatchCommand command = new TombWatchCommand();
        CommandLine.ParseResult parsed = new CommandLine(command).parseArgs(
                "verify", "--test-files", "a.mp4,b.mp4", "--output", "v.md");

        TombWatchCommand.VerifyCommand verify = (TombWatchCommand.VerifyCommand) parsed.subcommand().commandSpec().userObject();
        Assertions.assertEquals(List.of("a.mp4", "b.mp4"), verify.testFiles);
        Assertions.assertEquals("v.md", verify.output);
    }

    @Test
    void unknownScenarioIsAConfigurationError() {
        int code = new CommandLine(new TombWatchCommand()).execute("run", "--scenario", "chaos");
        Assertions.assertEquals(TombstoneHarness.EXIT_PRECONDITION, code);
    }

    @Test
    void missingSettingsFileIsAConfigurationError() {
        int code = new CommandLine(new TombWatchCommand()).execute("--settings", "/no/such/settings.json", "stats");
        Assertions.assertEquals(TombstoneHarness.EXIT_PRECONDITION, code);
    }

    @Test
    void statsQueriesCoordinator() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/stats", exchange -> {
            byte[] body = "{\"total_files\":20,\"active_nodes\":3}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            String url = "http://127.0.0.1:" + server.getAddress().getPort();
            Assertions.assertEquals(0, new CommandLine(new TombWatchCommand()).execute("--master-url", url, "stats"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void statsFailsWhenCoordinatorIsDown() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        int code = new CommandLine(new TombWatchCommand()).execute("--master-url", "http://127.0.0.1:" + port, "stats");
        Assertions.assertEquals(TombstoneHarness.EXIT_FAIL, code);
    }
}
