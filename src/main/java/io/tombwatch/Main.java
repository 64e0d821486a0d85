package io.tombwatch;

import io.tombwatch.cli.TombWatchCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TombWatchCommand()).execute(args);
        System.exit(code);
    }
}
