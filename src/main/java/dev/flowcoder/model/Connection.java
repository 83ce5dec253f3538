package dev.flowcoder.model;

import java.util.Set;
import java.util.UUID;

/**
 * A directed edge between two blocks. {@code isTruePath} separates a branch's two outcomes
 * (true is the primary path, false the alternate one).
 * <p>
 * {@code condition} and {@code label} are deprecated and only kept so older command files load.
 */
public record Connection(
    String id,
    String sourceBlockId,
    String targetBlockId,
    String sourcePort,
    String targetPort,
    boolean isTruePath,
    String condition, // nullable, deprecated
    String label // nullable, deprecated
) {
    public static final Set<String> PORTS = Set.of("top", "left", "bottom", "right");
    public static final String DEFAULT_SOURCE_PORT = "bottom";
    public static final String DEFAULT_TARGET_PORT = "top";

    public Connection {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (sourceBlockId == null || sourceBlockId.isBlank()) {
            throw new IllegalArgumentException("source_block_id is required");
        }
        if (targetBlockId == null || targetBlockId.isBlank()) {
            throw new IllegalArgumentException("target_block_id is required");
        }
        if (sourcePort == null || !PORTS.contains(sourcePort)) {
            sourcePort = DEFAULT_SOURCE_PORT;
        }
        if (targetPort == null || !PORTS.contains(targetPort)) {
            targetPort = DEFAULT_TARGET_PORT;
        }
    }

    public Connection(String sourceBlockId, String targetBlockId) {
        this(sourceBlockId, targetBlockId, true);
    }

    public Connection(String sourceBlockId, String targetBlockId, boolean isTruePath) {
        this(null, sourceBlockId, targetBlockId, DEFAULT_SOURCE_PORT, DEFAULT_TARGET_PORT, isTruePath, null, null);
    }
}
