package io.tombwatch.cluster;

import java.nio.file.Path;
import java.util.List;

@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, Path workingDir, long timeoutMs);

    record CommandResult(int exitCode, String output, boolean timedOut, String error) {
        public static CommandResult spawnFailed(String error) {
            return new CommandResult(-1, "", false, error);
        }

        public boolean ok() {
            return !timedOut && error == null && exitCode == 0;
        }

        public String describeFailure() {
            if (timedOut) {
                return "timed out";
            }
            if (error != null) {
                return error;
            }
            return "exit=" + exitCode + " output=" + ProcessCommandRunner.truncate(output);
        }
    }
}
