package io.tombwatch.cluster;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class ProcessCommandRunner implements CommandRunner {
    private static final int MAX_ERROR_CHARS = 512;

    @Override
    public CommandResult run(List<String> command, Path workingDir, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long safeTimeoutMs = Math.max(1_000L, timeoutMs);
        Path spool;
        try {
            spool = Files.createTempFile("tombwatch-cmd-", ".out");
        } catch (IOException e) {
            return CommandResult.spawnFailed("spool create failed: " + e.getMessage());
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            if (workingDir != null && Files.isDirectory(workingDir)) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectErrorStream(true);
            pb.redirectOutput(spool.toFile());
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                return CommandResult.spawnFailed("spawn failed: " + e.getMessage());
            }
            try {
                boolean finished = process.waitFor(safeTimeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return new CommandResult(-1, readSpool(spool), true,
                            "timeout after " + Duration.ofMillis(safeTimeoutMs));
                }
                return new CommandResult(process.exitValue(), readSpool(spool), false, null);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                return CommandResult.spawnFailed("interrupted: " + String.join(" ", command));
            }
        } finally {
            try {
                Files.deleteIfExists(spool);
            } catch (IOException e) {
                spool.toFile().deleteOnExit();
            }
        }
    }

    private static String readSpool(Path spool) {
        try {
            return Files.readString(spool, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
