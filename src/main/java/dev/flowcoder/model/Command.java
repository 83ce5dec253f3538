package dev.flowcoder.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A named, invocable flowchart with declared positional arguments.
 */
public final class Command {

    private static final Logger log = LoggerFactory.getLogger(Command.class);

    private final String id;
    private final String name;
    private String description;
    private final Flowchart flowchart;
    private CommandMetadata metadata;
    private List<CommandArgument> arguments;

    public Command(String name) {
        this(null, name, "", null, null, List.of());
    }

    public Command(String id, String name, String description, Flowchart flowchart,
                   CommandMetadata metadata, List<CommandArgument> arguments) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Command name is required");
        }
        this.id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        this.name = name;
        this.description = description == null ? "" : description;
        this.flowchart = flowchart == null ? new Flowchart() : flowchart;
        this.metadata = metadata == null ? CommandMetadata.now() : metadata;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public String id() { return id; }
    public String name() { return name; }
    public String description() { return description; }
    public Flowchart flowchart() { return flowchart; }
    public CommandMetadata metadata() { return metadata; }
    public List<CommandArgument> arguments() { return arguments; }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public void setArguments(List<CommandArgument> arguments) {
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public void updateModified() {
        this.metadata = metadata.withModified(LocalDateTime.now());
    }

    /**
     * An independent copy of the flowchart that a run may annotate without touching the authored one.
     */
    public Flowchart createExecutionCopy() {
        return flowchart.copy();
    }

    /**
     * Bind raw invocation text to this command's arguments.
     * <p>
     * Each declared argument binds under both {@code $N} and its name, falling back to its default.
     * Words beyond the declared arguments still bind under {@code $N}, so a command accepts more
     * arguments than it declares.
     *
     * @throws ArgumentParseException if the text cannot be tokenized or a required argument is missing
     */
    public Map<String, String> parseArguments(String argString) {
        List<String> words = argString == null || argString.isBlank()
            ? List.of()
            : ArgumentTokenizer.split(argString);

        var bindings = new LinkedHashMap<String, String>();
        for (int i = 0; i < arguments.size(); i++) {
            CommandArgument declared = arguments.get(i);
            int position = i + 1;

            String value;
            if (i < words.size()) {
                value = words.get(i);
            } else if (declared.defaultValue() != null) {
                value = declared.defaultValue();
            } else if (declared.required()) {
                throw new ArgumentParseException(declared.name(), position);
            } else {
                continue;
            }
            bindings.put("$" + position, value);
            bindings.put(declared.name(), value);
        }
        for (int i = arguments.size(); i < words.size(); i++) {
            bindings.put("$" + (i + 1), words.get(i));
        }

        log.debug("Parsed {} word(s) for command '{}' into {} binding(s)", words.size(), name, bindings.size());
        return bindings;
    }

    /**
     * Flowchart findings plus command-level naming and argument-declaration rules.
     */
    public ValidationResult validate() {
        ValidationResult chart = flowchart.validate();
        var errors = new ArrayList<>(chart.errors());
        var warnings = new ArrayList<>(chart.warnings());

        if (name.isBlank()) {
            errors.add("Command name cannot be empty");
        }
        if (name.contains(" ")) {
            errors.add("Command name cannot contain spaces (use hyphens or underscores)");
        }
        if (!Names.isSlug(name)) {
            warnings.add("Command name should only contain letters, numbers, hyphens, and underscores");
        }
        for (CommandArgument argument : arguments) {
            errors.addAll(argument.validate());
        }

        return ValidationResult.of(errors, warnings);
    }

    @Override
    public String toString() {
        return "Command(name='%s', blocks=%d)".formatted(name, flowchart.blocks().size());
    }
}
