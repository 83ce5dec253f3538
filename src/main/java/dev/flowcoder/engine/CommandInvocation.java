package dev.flowcoder.engine;

import dev.flowcoder.model.Command;
import dev.flowcoder.model.CommandBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binding-table plumbing for a Command block: resolving its target, building the child's bindings,
 * and merging the child's results back into the caller.
 */
public final class CommandInvocation {

    private static final Logger log = LoggerFactory.getLogger(CommandInvocation.class);

    private CommandInvocation() {}

    /**
     * Look up the command a block invokes. A leading {@code /} on the block's command name is ignored.
     *
     * @throws IllegalArgumentException if the command is not registered
     */
    public static Command resolveTarget(CommandBlock block, Map<String, Command> allCommands) {
        Command target = allCommands.get(block.targetCommandName());
        if (target == null) {
            throw new IllegalArgumentException(
                "Command not found: %s. Ensure the command exists before invoking it.".formatted(block.commandName()));
        }
        return target;
    }

    /**
     * Bindings the invoked command starts with. The block's argument template is filled from the
     * caller's bindings and parsed against the target's declared arguments; when the block inherits
     * variables, the caller's named (non-positional) variables are visible too, beneath the arguments.
     *
     * @throws SubstitutionException if the argument template references something unbound
     * @throws dev.flowcoder.model.ArgumentParseException if the filled-in text does not satisfy the target's arguments
     */
    public static Map<String, Object> childBindings(CommandBlock block, Command target, Map<String, ?> parentBindings) {
        String rawArguments = block.arguments().isEmpty()
            ? ""
            : VariableSubstitution.substituteAll(block.arguments(), parentBindings);

        var child = new LinkedHashMap<String, Object>();
        if (block.inheritVariables()) {
            parentBindings.forEach((key, value) -> {
                if (!isPositional(key)) {
                    child.put(key, value);
                }
            });
        }
        child.putAll(target.parseArguments(rawArguments));

        log.debug("Prepared {} binding(s) for command '{}' (inherit={})",
            child.size(), target.name(), block.inheritVariables());
        return child;
    }

    /**
     * Copy the child's named variables into the caller's bindings when the block asks for it.
     * Positional arguments of the child are never merged.
     *
     * @return how many variables were merged
     */
    public static int mergeOutputs(CommandBlock block, Map<String, Object> parentBindings, Map<String, ?> childBindings) {
        if (!block.mergeOutput()) {
            return 0;
        }
        int merged = 0;
        for (var entry : childBindings.entrySet()) {
            if (isPositional(entry.getKey())) {
                continue;
            }
            parentBindings.put(entry.getKey(), entry.getValue());
            merged++;
        }
        log.debug("Merged {} variable(s) from '{}' into caller", merged, block.commandName());
        return merged;
    }

    private static boolean isPositional(String key) {
        return key.startsWith("$");
    }
}
