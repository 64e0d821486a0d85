package io.tombwatch.config;

import io.tombwatch.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record TombWatchSettings(
        String masterUrl,
        String secret,
        String composeDir,
        List<String> workers,
        String coordinator,
        String containerNameTemplate,
        String dataDirTemplate,
        long commandTimeoutMs,
        long httpTimeoutMs,
        int minFileCount,
        String targetFilePattern,
        long convergenceTimeoutMs,
        long pollIntervalMs,
        long deleteSpacingMs,
        long settleAfterStopMs,
        long settleAfterPartialStopMs,
        long settleAfterStartMs,
        long interScenarioPauseMs,
        String outputDir,
        String tombstoneMarker,
        String partialFailureMarker,
        String autoCleanupMarker
) {
    public static final String DEFAULT_SETTINGS_FILE = "tombwatch-settings.json";
    public static final String DEFAULT_MASTER_URL = "http://localhost:8080";
    public static final String DEFAULT_SECRET = "admin888";
    public static final String DEFAULT_TARGET_PATTERN = "test_movie_%04d.mp4";
    public static final String DEFAULT_TOMBSTONE_MARKER = "创建墓碑";
    public static final String DEFAULT_PARTIAL_FAILURE_MARKER = "部分删除失败";
    public static final String DEFAULT_AUTO_CLEANUP_MARKER = "墓碑机制：自动删除";

    public TombWatchSettings {
        workers = workers == null ? List.of() : List.copyOf(workers);
    }

    public static TombWatchSettings defaults() {
        return new TombWatchSettings(
                DEFAULT_MASTER_URL,
                DEFAULT_SECRET,
                "..",
                List.of("worker1", "worker2", "worker3"),
                "master",
                "movie-dist-kv-{node}-1",
                "/root/data_{index}{index}",
                60_000L,
                10_000L,
                20,
                DEFAULT_TARGET_PATTERN,
                30_000L,
                5_000L,
                500L,
                5_000L,
                10_000L,
                10_000L,
                5_000L,
                "test_videos/logs/tombstone",
                DEFAULT_TOMBSTONE_MARKER,
                DEFAULT_PARTIAL_FAILURE_MARKER,
                DEFAULT_AUTO_CLEANUP_MARKER
        );
    }

    // blank path: default file, optional; a named file must exist
    public static TombWatchSettings load(String path) {
        boolean explicit = path != null && !path.isBlank();
        Path cfg = explicit ? Paths.get(path.trim()) : Paths.get(DEFAULT_SETTINGS_FILE);
        if (!Files.exists(cfg)) {
            if (explicit) {
                throw new IllegalArgumentException("Settings file not found: " + cfg.toAbsolutePath().normalize());
            }
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(cfg.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load settings: " + cfg + " (" + e.getMessage() + ")", e);
        }
    }

    static TombWatchSettings fromFile(SettingsFile file, TombWatchSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long pollInterval = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 100L);
        long convergenceTimeout = sanitizeLong(file.convergenceTimeoutMs(), defaults.convergenceTimeoutMs(), 1_000L);
        if (convergenceTimeout < pollInterval) {
            convergenceTimeout = pollInterval;
        }
        return new TombWatchSettings(
                normalizeUrl(sanitizeText(file.masterUrl(), defaults.masterUrl())),
                file.secret() == null ? defaults.secret() : file.secret(),
                sanitizeText(file.composeDir(), defaults.composeDir()),
                sanitizeNodes(file.workers(), defaults.workers()),
                sanitizeText(file.coordinator(), defaults.coordinator()),
                sanitizeText(file.containerNameTemplate(), defaults.containerNameTemplate()),
                sanitizeText(file.dataDirTemplate(), defaults.dataDirTemplate()),
                sanitizeLong(file.commandTimeoutMs(), defaults.commandTimeoutMs(), 1_000L),
                sanitizeLong(file.httpTimeoutMs(), defaults.httpTimeoutMs(), 500L),
                sanitizeInt(file.minFileCount(), defaults.minFileCount(), 0),
                sanitizePattern(file.targetFilePattern(), defaults.targetFilePattern()),
                convergenceTimeout,
                pollInterval,
                sanitizeLong(file.deleteSpacingMs(), defaults.deleteSpacingMs(), 0L),
                sanitizeLong(file.settleAfterStopMs(), defaults.settleAfterStopMs(), 0L),
                sanitizeLong(file.settleAfterPartialStopMs(), defaults.settleAfterPartialStopMs(), 0L),
                sanitizeLong(file.settleAfterStartMs(), defaults.settleAfterStartMs(), 0L),
                sanitizeLong(file.interScenarioPauseMs(), defaults.interScenarioPauseMs(), 0L),
                sanitizeText(file.outputDir(), defaults.outputDir()),
                sanitizeText(file.tombstoneMarker(), defaults.tombstoneMarker()),
                sanitizeText(file.partialFailureMarker(), defaults.partialFailureMarker()),
                sanitizeText(file.autoCleanupMarker(), defaults.autoCleanupMarker())
        );
    }

    public TombWatchSettings withOverrides(String masterUrlOverride, String secretOverride, String outputDirOverride) {
        return new TombWatchSettings(
                masterUrlOverride == null || masterUrlOverride.isBlank() ? masterUrl : normalizeUrl(masterUrlOverride),
                secretOverride == null ? secret : secretOverride,
                composeDir,
                workers,
                coordinator,
                containerNameTemplate,
                dataDirTemplate,
                commandTimeoutMs,
                httpTimeoutMs,
                minFileCount,
                targetFilePattern,
                convergenceTimeoutMs,
                pollIntervalMs,
                deleteSpacingMs,
                settleAfterStopMs,
                settleAfterPartialStopMs,
                settleAfterStartMs,
                interScenarioPauseMs,
                outputDirOverride == null || outputDirOverride.isBlank() ? outputDir : outputDirOverride.trim(),
                tombstoneMarker,
                partialFailureMarker,
                autoCleanupMarker
        );
    }

    public Path outputPath() {
        return Paths.get(outputDir).toAbsolutePath().normalize();
    }

    public Path composePath() {
        return Paths.get(composeDir).toAbsolutePath().normalize();
    }

    public List<String> logSources() {
        List<String> out = new ArrayList<>(workers);
        if (!out.contains(coordinator)) {
            out.add(coordinator);
        }
        return out;
    }

    static String normalizeUrl(String raw) {
        String value = raw.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "http://" + value;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String sanitizeText(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static List<String> sanitizeNodes(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String node : raw) {
            if (node != null && !node.isBlank() && !out.contains(node.trim())) {
                out.add(node.trim());
            }
        }
        return out.isEmpty() ? fallback : out;
    }

    private static String sanitizePattern(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        try {
            String.format(Locale.ROOT, value, 0);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("targetFilePattern must take one integer argument: " + value, e);
        }
        return value;
    }

    record SettingsFile(
            String masterUrl,
            String secret,
            String composeDir,
            List<String> workers,
            String coordinator,
            String containerNameTemplate,
            String dataDirTemplate,
            Long commandTimeoutMs,
            Long httpTimeoutMs,
            Integer minFileCount,
            String targetFilePattern,
            Long convergenceTimeoutMs,
            Long pollIntervalMs,
            Long deleteSpacingMs,
            Long settleAfterStopMs,
            Long settleAfterPartialStopMs,
            Long settleAfterStartMs,
            Long interScenarioPauseMs,
            String outputDir,
            String tombstoneMarker,
            String partialFailureMarker,
            String autoCleanupMarker
    ) {
    }
}
