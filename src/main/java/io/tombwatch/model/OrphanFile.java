package io.tombwatch.model;

public record OrphanFile(String node, String file) {
}
