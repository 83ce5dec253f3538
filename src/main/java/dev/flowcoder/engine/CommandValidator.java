package dev.flowcoder.engine;

import dev.flowcoder.model.Block;
import dev.flowcoder.model.BlockType;
import dev.flowcoder.model.Command;
import dev.flowcoder.model.CommandBlock;
import dev.flowcoder.model.Flowchart;
import dev.flowcoder.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that need the whole command registry: command-block targets and invocation cycles.
 */
public final class CommandValidator {

    private static final Logger log = LoggerFactory.getLogger(CommandValidator.class);

    private CommandValidator() {}

    /**
     * Detect whether invoking {@code commandName} can recurse back into a command already on the
     * call path, directly or through other commands.
     *
     * @return the cycle as a readable chain, e.g.
     *         {@code A -> B -> Circular dependency detected: A calls itself}, or empty when there is none
     */
    public static Optional<String> checkCircularDependencies(String commandName, Flowchart flowchart,
                                                             Map<String, Command> allCommands) {
        return checkCircularDependencies(commandName, flowchart, allCommands, new HashSet<>());
    }

    private static Optional<String> checkCircularDependencies(String commandName, Flowchart flowchart,
                                                              Map<String, Command> allCommands,
                                                              Set<String> visiting) {
        if (visiting.contains(commandName)) {
            return Optional.of(selfCall(commandName));
        }
        visiting.add(commandName);

        for (Block block : flowchart.blocks().values()) {
            if (block.type() != BlockType.COMMAND) {
                continue;
            }
            String target = ((CommandBlock) block).targetCommandName();
            if (target.equals(commandName)) {
                return Optional.of(selfCall(commandName));
            }
            Command targetCommand = allCommands.get(target);
            if (targetCommand == null) {
                continue;
            }
            log.debug("Following {} -> {}", commandName, target);
            // each branch gets its own copy so siblings sharing a target are not mistaken for a cycle
            Optional<String> error = checkCircularDependencies(
                target, targetCommand.flowchart(), allCommands, new HashSet<>(visiting));
            if (error.isPresent()) {
                return Optional.of(commandName + " -> " + error.get());
            }
        }
        return Optional.empty();
    }

    private static String selfCall(String commandName) {
        return "Circular dependency detected: %s calls itself".formatted(commandName);
    }

    /**
     * Command blocks whose target is blank or not registered.
     */
    public static List<String> findMissingCommands(Flowchart flowchart, Map<String, Command> allCommands) {
        var errors = new ArrayList<String>();
        for (Block block : flowchart.blocks().values()) {
            if (block.type() != BlockType.COMMAND) {
                continue;
            }
            CommandBlock commandBlock = (CommandBlock) block;
            for (String error : commandBlock.validate()) {
                errors.add("Command block '%s': %s".formatted(block.name(), error));
            }
            if (!commandBlock.commandName().isEmpty() && !allCommands.containsKey(commandBlock.targetCommandName())) {
                errors.add("Command block '%s' references unknown command: %s"
                    .formatted(block.name(), commandBlock.commandName()));
            }
        }
        return errors;
    }

    /**
     * Validate every registered command: its own flowchart and naming rules, its command-block
     * targets, and invocation cycles.
     */
    public static Map<String, ValidationResult> validateAll(Map<String, Command> allCommands) {
        var results = new LinkedHashMap<String, ValidationResult>();
        for (Command command : allCommands.values()) {
            results.put(command.name(), validate(command, allCommands));
        }
        long failing = results.values().stream().filter(r -> !r.valid()).count();
        log.info("Validated {} command(s), {} with errors", results.size(), failing);
        return results;
    }

    public static ValidationResult validate(Command command, Map<String, Command> allCommands) {
        ValidationResult own = command.validate();
        var errors = new ArrayList<>(own.errors());
        errors.addAll(findMissingCommands(command.flowchart(), allCommands));
        checkCircularDependencies(command.name(), command.flowchart(), allCommands).ifPresent(errors::add);
        return ValidationResult.of(errors, own.warnings());
    }
}
