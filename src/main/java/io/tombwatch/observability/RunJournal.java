package io.tombwatch.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.tombwatch.security.SensitiveDataMasker;
import io.tombwatch.util.Jsons;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

public final class RunJournal implements HarnessLog {
    public static final String TEXT_LOG = "test_log.txt";
    public static final String JOURNAL = "journal.jsonl";
    private static final DateTimeFormatter LINE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path textLog;
    private final Path journal;
    private final String runId;
    private final String credential;
    private final PrintStream console;
    private final Clock clock;
    private long sequence;

    public RunJournal(Path outputDir, String runId, String credential, PrintStream console, Clock clock) {
        this.textLog = outputDir.resolve(TEXT_LOG);
        this.journal = outputDir.resolve(JOURNAL);
        this.runId = runId;
        this.credential = credential;
        this.console = console;
        this.clock = clock;
        this.sequence = 0L;
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal directory: " + outputDir, e);
        }
    }

    public static RunJournal open(Path outputDir, String runId, String credential) {
        return new RunJournal(outputDir, runId, credential, System.out, Clock.systemDefaultZone());
    }

    @Override
    public synchronized void log(Level level, String message) {
        String time = LINE_TIME.format(clock.instant().atZone(clock.getZone()));
        String line = "[" + time + "] [" + level.name() + "] " + SensitiveDataMasker.redactValue(message, credential);
        if (console != null) {
            console.println(line);
        }
        append(textLog, line + System.lineSeparator(), "log");
    }

    @Override
    public synchronized void record(String action, String node, String result, Map<String, Object> details) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("seq", ++sequence);
        row.put("timestamp", now.toString());
        row.put("run_id", runId);
        row.put("action", action);
        row.put("node", node);
        row.put("result", result);
        row.put("details", sanitizeDetails(details));
        String line = SensitiveDataMasker.redactValue(Jsons.toCompactJson(row), credential);
        append(journal, line + System.lineSeparator(), "journal");
    }

    public Path textLogPath() {
        return textLog;
    }

    public Path journalPath() {
        return journal;
    }

    private JsonNode sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return SensitiveDataMasker.masked(node);
    }

    private static void append(Path file, String text, String what) {
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write " + what + ": " + file, e);
        }
    }
}
