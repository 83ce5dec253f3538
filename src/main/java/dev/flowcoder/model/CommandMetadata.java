package dev.flowcoder.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Bookkeeping attached to a command.
 */
public record CommandMetadata(
    LocalDateTime created,
    LocalDateTime modified,
    String version,
    String author, // nullable
    List<String> tags
) {
    public static final String DEFAULT_VERSION = "1.0";

    public CommandMetadata {
        Objects.requireNonNull(created, "created");
        Objects.requireNonNull(modified, "modified");
        version = version == null ? DEFAULT_VERSION : version;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static CommandMetadata now() {
        LocalDateTime now = LocalDateTime.now();
        return new CommandMetadata(now, now, DEFAULT_VERSION, null, List.of());
    }

    public CommandMetadata withModified(LocalDateTime modified) {
        return new CommandMetadata(created, modified, version, author, tags);
    }
}
