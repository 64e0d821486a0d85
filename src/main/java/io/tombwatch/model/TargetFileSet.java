package io.tombwatch.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public record TargetFileSet(List<String> files) {
    public TargetFileSet {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (files != null) {
            for (String file : files) {
                if (file != null && !file.isBlank()) {
                    unique.add(file.trim());
                }
            }
        }
        files = List.copyOf(unique);
    }

    public static TargetFileSet of(String... files) {
        return new TargetFileSet(List.of(files));
    }

    public static TargetFileSet numbered(String pattern, int fromInclusive, int toExclusive) {
        List<String> out = new ArrayList<>(Math.max(0, toExclusive - fromInclusive));
        for (int i = fromInclusive; i < toExclusive; i++) {
            out.add(String.format(Locale.ROOT, pattern, i));
        }
        return new TargetFileSet(out);
    }

    public boolean contains(String file) {
        return files.contains(file);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public String describeRange() {
        if (files.isEmpty()) {
            return "(none)";
        }
        if (files.size() == 1) {
            return files.get(0);
        }
        return files.get(0) + " .. " + files.get(files.size() - 1);
    }
}
