package io.tombwatch.cluster;

import io.tombwatch.config.TombWatchSettings;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ComposeClusterControl implements ClusterControlPort {
    private final CommandRunner runner;
    private final Path composeDir;
    private final String containerNameTemplate;
    private final String dataDirTemplate;
    private final long commandTimeoutMs;

    public ComposeClusterControl(TombWatchSettings settings) {
        this(new ProcessCommandRunner(), settings);
    }

    public ComposeClusterControl(CommandRunner runner, TombWatchSettings settings) {
        this.runner = runner;
        this.composeDir = settings.composePath();
        this.containerNameTemplate = settings.containerNameTemplate();
        this.dataDirTemplate = settings.dataDirTemplate();
        this.commandTimeoutMs = settings.commandTimeoutMs();
    }

    @Override
    public ControlOutcome stop(String nodeId) {
        return lifecycle("stop", nodeId);
    }

    @Override
    public ControlOutcome start(String nodeId) {
        return lifecycle("start", nodeId);
    }

    private ControlOutcome lifecycle(String verb, String nodeId) {
        CommandRunner.CommandResult result = runner.run(
                List.of("docker-compose", verb, nodeId), composeDir, commandTimeoutMs);
        if (result.ok()) {
            return ControlOutcome.ok(nodeId + " " + verb + " confirmed");
        }
        return ControlOutcome.fail(verb + " " + nodeId + " failed: " + result.describeFailure());
    }

    @Override
    public Set<String> listFiles(String nodeId) throws NodeInspectionException {
        String container = containerName(nodeId);
        String dataDir = dataDir(nodeId);
        CommandRunner.CommandResult result = runner.run(
                List.of("docker", "exec", container, "ls", dataDir), composeDir, commandTimeoutMs);
        if (!result.ok()) {
            throw new NodeInspectionException(nodeId, "ls " + dataDir + " in " + container + " failed: " + result.describeFailure());
        }
        Set<String> files = new LinkedHashSet<>();
        for (String line : result.output().split("\n")) {
            String name = line.strip();
            if (!name.isEmpty()) {
                files.add(name);
            }
        }
        return files;
    }

    @Override
    public String fetchLogs(String nodeId) {
        CommandRunner.CommandResult result = runner.run(
                List.of("docker-compose", "logs", "--no-color", nodeId), composeDir, commandTimeoutMs);
        return result.ok() ? result.output() : "";
    }

    @Override
    public boolean clusterUp() {
        CommandRunner.CommandResult result = runner.run(
                List.of("docker-compose", "ps"), composeDir, commandTimeoutMs);
        return result.ok() && result.output().contains("Up");
    }

    @Override
    public String describe() {
        return "docker-compose@" + composeDir;
    }

    String containerName(String nodeId) {
        return expand(containerNameTemplate, nodeId);
    }

    String dataDir(String nodeId) {
        return expand(dataDirTemplate, nodeId);
    }

    private static String expand(String template, String nodeId) {
        return template
                .replace("{node}", nodeId)
                .replace("{index}", trailingDigits(nodeId));
    }

    static String trailingDigits(String nodeId) {
        int end = nodeId.length();
        int start = end;
        while (start > 0 && Character.isDigit(nodeId.charAt(start - 1))) {
            start--;
        }
        return nodeId.substring(start, end);
    }
}
