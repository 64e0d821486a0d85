package io.tombwatch.support;

import java.nio.file.Files;
import java.nio.file.Path;

public final class TestDirs {
    private TestDirs() {
    }

    public static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (var walk = Files.walk(root)) {
            for (Path p : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
