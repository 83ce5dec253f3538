package dev.flowcoder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared command argument. Its position in the command's argument list decides which
 * {@code $N} it binds to.
 */
public record CommandArgument(
    String name,
    String description,
    boolean required,
    String defaultValue // nullable
) {
    public CommandArgument {
        description = description == null ? "" : description;
    }

    public static CommandArgument required(String name, String description) {
        return new CommandArgument(name, description, true, null);
    }

    public static CommandArgument optional(String name, String description, String defaultValue) {
        return new CommandArgument(name, description, false, defaultValue);
    }

    public List<String> validate() {
        var errors = new ArrayList<String>();
        if (name == null || name.isEmpty()) {
            errors.add("Argument name is required");
            return errors;
        }
        if (!Names.isSlug(name)) {
            errors.add("Argument name '%s' should only contain letters, numbers, hyphens, and underscores"
                .formatted(name));
        }
        if (required && defaultValue != null) {
            errors.add("Argument '%s' cannot be required and have a default value".formatted(name));
        }
        return errors;
    }
}
