package io.tombwatch.report;

import io.tombwatch.model.Report;
import io.tombwatch.security.SensitiveDataMasker;
import io.tombwatch.verify.VerificationOutcome;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ReportWriter {
    public static final String VERIFICATION_REPORT = "verification_report.md";
    public static final String VERIFICATION_RESULTS = "verification_results.json";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final String credential;
    private final ZoneId zone;

    public ReportWriter(Path outputDir, String credential, ZoneId zone) {
        this.outputDir = outputDir;
        this.credential = credential;
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public Artifacts write(Report report) {
        String stamp = stamp(report.generatedAt());
        Path markdown = outputDir.resolve("tombstone_test_report_" + stamp + ".md");
        Path json = outputDir.resolve("test_results_" + stamp + ".json");
        writeText(markdown, ReportBuilder.markdown(report));
        writeText(json, ReportBuilder.json(report));
        return new Artifacts(markdown, json);
    }

    public Artifacts writeVerification(VerificationOutcome outcome, int targetCount, Path markdownTarget) {
        Path markdown = markdownTarget == null ? outputDir.resolve(VERIFICATION_REPORT) : markdownTarget;
        Path parent = markdown.toAbsolutePath().getParent();
        Path json = (parent == null ? outputDir : parent).resolve(VERIFICATION_RESULTS);
        writeText(markdown, ReportBuilder.verificationMarkdown(outcome, targetCount));
        writeText(json, ReportBuilder.verificationJson(outcome));
        return new Artifacts(markdown, json);
    }

    String stamp(Instant at) {
        return STAMP.format((at == null ? Instant.EPOCH : at).atZone(zone));
    }

    private void writeText(Path target, String content) {
        String safe = SensitiveDataMasker.redactValue(content, credential);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, safe, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report: " + target, e);
        }
    }

    public record Artifacts(Path markdown, Path json) {
    }
}
