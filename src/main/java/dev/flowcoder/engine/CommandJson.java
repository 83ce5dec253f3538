package dev.flowcoder.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowcoder.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Stream;

/**
 * Reads and writes commands as JSON. Keys use the snake_case names of the command file format;
 * every block carries a {@code type} discriminator.
 */
public final class CommandJson {

    private static final Logger log = LoggerFactory.getLogger(CommandJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private CommandJson() {}

    /**
     * Load a single command from a JSON file.
     */
    public static Command loadFromFile(Path path) throws IOException {
        return fromJson(MAPPER.readTree(path.toFile()));
    }

    /**
     * Load a single command from a JSON string.
     */
    public static Command loadFromString(String json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    /**
     * Load every {@code *.json} command in a directory, keyed by command name.
     */
    public static Map<String, Command> loadFromDirectory(Path dir) throws IOException {
        var commands = new LinkedHashMap<String, Command>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(p -> {
                     try {
                         Command command = loadFromFile(p);
                         commands.put(command.name(), command);
                     } catch (IOException | IllegalArgumentException e) {
                         throw new IllegalStateException("Failed to load command from " + p, e);
                     }
                 });
        }
        log.info("Loaded {} command(s) from {}", commands.size(), dir);
        return commands;
    }

    public static String writeString(Command command) throws IOException {
        return MAPPER.writeValueAsString(toJson(command));
    }

    // ---- Command ----

    public static ObjectNode toJson(Command command) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", command.id());
        node.put("name", command.name());
        node.put("description", command.description());
        node.set("flowchart", toJson(command.flowchart()));
        node.set("metadata", toJson(command.metadata()));
        ArrayNode arguments = node.putArray("arguments");
        command.arguments().forEach(a -> arguments.add(toJson(a)));
        return node;
    }

    public static Command fromJson(JsonNode node) {
        String name = requiredText(node, "name", "command");
        JsonNode flowchart = node.get("flowchart");
        JsonNode metadata = node.get("metadata");

        List<CommandArgument> arguments = new ArrayList<>();
        if (node.has("arguments")) {
            node.get("arguments").forEach(a -> arguments.add(argumentFromJson(a)));
        }

        return new Command(
            optionalText(node, "id", null),
            name,
            optionalText(node, "description", ""),
            flowchart == null || flowchart.isNull() ? null : flowchartFromJson(flowchart),
            metadata == null || metadata.isNull() ? null : metadataFromJson(metadata),
            arguments
        );
    }

    // ---- CommandMetadata / CommandArgument ----

    public static ObjectNode toJson(CommandMetadata metadata) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("created", TIMESTAMP.format(metadata.created()));
        node.put("modified", TIMESTAMP.format(metadata.modified()));
        node.put("version", metadata.version());
        node.put("author", metadata.author());
        ArrayNode tags = node.putArray("tags");
        metadata.tags().forEach(tags::add);
        return node;
    }

    public static CommandMetadata metadataFromJson(JsonNode node) {
        List<String> tags = new ArrayList<>();
        if (node.has("tags")) {
            node.get("tags").forEach(t -> tags.add(t.asText()));
        }
        return new CommandMetadata(
            timestampFromJson(node, "created"),
            timestampFromJson(node, "modified"),
            optionalText(node, "version", CommandMetadata.DEFAULT_VERSION),
            optionalText(node, "author", null),
            tags
        );
    }

    private static LocalDateTime timestampFromJson(JsonNode node, String field) {
        String text = requiredText(node, field, "metadata");
        try {
            return LocalDateTime.parse(text, TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                "metadata field '%s' is not an ISO local date-time: %s".formatted(field, text), e);
        }
    }

    public static ObjectNode toJson(CommandArgument argument) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", argument.name());
        node.put("description", argument.description());
        node.put("required", argument.required());
        node.put("default", argument.defaultValue());
        return node;
    }

    public static CommandArgument argumentFromJson(JsonNode node) {
        return new CommandArgument(
            requiredText(node, "name", "argument"),
            optionalText(node, "description", ""),
            optionalBoolean(node, "required", true),
            optionalText(node, "default", null)
        );
    }

    // ---- Flowchart ----

    public static ObjectNode toJson(Flowchart flowchart) {
        ObjectNode node = MAPPER.createObjectNode();
        ObjectNode blocks = node.putObject("blocks");
        flowchart.blocks().forEach((id, block) -> blocks.set(id, toJson(block)));
        ArrayNode connections = node.putArray("connections");
        flowchart.connections().forEach(c -> connections.add(toJson(c)));
        node.put("start_block_id", flowchart.startBlockId());
        return node;
    }

    public static Flowchart flowchartFromJson(JsonNode node) {
        List<Block> blocks = new ArrayList<>();
        if (node.has("blocks")) {
            for (var entry : node.get("blocks").properties()) {
                blocks.add(blockFromJson(entry.getValue()));
            }
        }
        List<Connection> connections = new ArrayList<>();
        if (node.has("connections")) {
            node.get("connections").forEach(c -> connections.add(connectionFromJson(c)));
        }
        return Flowchart.restore(blocks, connections, optionalText(node, "start_block_id", null));
    }

    // ---- Connection ----

    public static ObjectNode toJson(Connection connection) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", connection.id());
        node.put("source_block_id", connection.sourceBlockId());
        node.put("target_block_id", connection.targetBlockId());
        node.put("source_port", connection.sourcePort());
        node.put("target_port", connection.targetPort());
        node.put("is_true_path", connection.isTruePath());
        node.put("condition", connection.condition());
        node.put("label", connection.label());
        return node;
    }

    public static Connection connectionFromJson(JsonNode node) {
        return new Connection(
            optionalText(node, "id", null),
            optionalText(node, "source_block_id", null),
            optionalText(node, "target_block_id", null),
            optionalText(node, "source_port", Connection.DEFAULT_SOURCE_PORT),
            optionalText(node, "target_port", Connection.DEFAULT_TARGET_PORT),
            optionalBoolean(node, "is_true_path", true),
            optionalText(node, "condition", null),
            optionalText(node, "label", null)
        );
    }

    // ---- Blocks ----

    public static ObjectNode toJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", block.id());
        node.put("type", block.type().value());
        node.put("name", block.name());
        ObjectNode position = node.putObject("position");
        position.put("x", block.position().x());
        position.put("y", block.position().y());

        switch (block.type()) {
            case PROMPT -> {
                PromptBlock prompt = (PromptBlock) block;
                node.put("prompt", prompt.prompt());
                node.set("output_schema", prompt.outputSchema());
                node.put("sound_effect", prompt.soundEffect());
            }
            case BRANCH -> node.put("condition", ((BranchBlock) block).condition());
            case VARIABLE -> {
                VariableBlock variable = (VariableBlock) block;
                node.put("variable_name", variable.variableName());
                node.put("variable_value", variable.variableValue());
                node.put("variable_type", variable.variableType());
            }
            case BASH -> {
                BashBlock bash = (BashBlock) block;
                node.put("command", bash.command());
                node.put("capture_output", bash.captureOutput());
                node.put("output_variable", bash.outputVariable());
                node.put("output_type", bash.outputType());
                node.put("working_directory", bash.workingDirectory());
                node.put("continue_on_error", bash.continueOnError());
                node.put("exit_code_variable", bash.exitCodeVariable());
            }
            case COMMAND -> {
                CommandBlock command = (CommandBlock) block;
                node.put("command_name", command.commandName());
                node.put("arguments", command.arguments());
                node.put("inherit_variables", command.inheritVariables());
                node.put("merge_output", command.mergeOutput());
            }
            default -> { }
        }
        return node;
    }

    public static Block blockFromJson(JsonNode node) {
        BlockType type = BlockType.fromValue(requiredText(node, "type", "block"));
        String id = requiredText(node, "id", "block");
        String name = optionalText(node, "name", null);
        Position position = positionFromJson(node.get("position"));

        return switch (type) {
            case START -> new StartBlock(id, name, position);
            case END -> new EndBlock(id, name, position);
            case REFRESH -> new RefreshBlock(id, name, position);
            case PROMPT -> {
                JsonNode schema = node.get("output_schema");
                yield new PromptBlock(id, name, position,
                    optionalText(node, "prompt", ""),
                    schema == null || schema.isNull() ? null : schema,
                    optionalText(node, "sound_effect", null));
            }
            case BRANCH -> new BranchBlock(id, name, position, optionalText(node, "condition", ""));
            case VARIABLE -> new VariableBlock(id, name, position,
                optionalText(node, "variable_name", ""),
                optionalText(node, "variable_value", ""),
                optionalText(node, "variable_type", VariableType.STRING.value()));
            case BASH -> new BashBlock(id, name, position,
                optionalText(node, "command", ""),
                optionalBoolean(node, "capture_output", true),
                optionalText(node, "output_variable", ""),
                optionalText(node, "output_type", VariableType.STRING.value()),
                optionalText(node, "working_directory", ""),
                optionalBoolean(node, "continue_on_error", false),
                optionalText(node, "exit_code_variable", ""));
            case COMMAND -> new CommandBlock(id, name, position,
                optionalText(node, "command_name", ""),
                optionalText(node, "arguments", ""),
                optionalBoolean(node, "inherit_variables", false),
                optionalBoolean(node, "merge_output", false));
        };
    }

    private static Position positionFromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Block is missing required field 'position'");
        }
        return new Position(node.path("x").asDouble(), node.path("y").asDouble());
    }

    private static String requiredText(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("%s is missing required field '%s'".formatted(owner, field));
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static boolean optionalBoolean(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asBoolean();
    }
}
