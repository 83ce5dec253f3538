package dev.flowcoder.cli;

import ch.qos.logback.classic.Level;
import dev.flowcoder.engine.CommandJson;
import dev.flowcoder.engine.CommandValidator;
import dev.flowcoder.engine.FlowchartSyntaxAnalyzer;
import dev.flowcoder.engine.SyntaxIssue;
import dev.flowcoder.engine.VariableSubstitution;
import dev.flowcoder.model.ArgumentParseException;
import dev.flowcoder.model.Block;
import dev.flowcoder.model.BashBlock;
import dev.flowcoder.model.BranchBlock;
import dev.flowcoder.model.Command;
import dev.flowcoder.model.CommandArgument;
import dev.flowcoder.model.CommandBlock;
import dev.flowcoder.model.PromptBlock;
import dev.flowcoder.model.ValidationResult;
import dev.flowcoder.model.VariableBlock;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for checking command files.
 */
@CommandLine.Command(
    name = "flowcoder",
    mixinStandardHelpOptions = true,
    description = "Validate flowchart commands and preview how invocation arguments bind."
)
public class FlowCoderCli implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Command name to check")
    private String commandName;

    @Option(names = "--commands-dir", defaultValue = "commands",
        description = "Directory holding command JSON files (default: ${DEFAULT-VALUE})")
    private Path commandsDir;

    @Option(names = "--list", description = "List all available commands")
    private boolean list;

    @Option(names = "--validate", description = "Validate the command (default when --args is not given)")
    private boolean validate;

    @Option(names = "--args", description = "Raw argument text to parse against the command's arguments")
    private String args;

    @Option(names = "--verbose", description = "Log validation and parsing details")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.flowcoder")).setLevel(Level.DEBUG);
        }

        if (!Files.isDirectory(commandsDir)) {
            System.err.println("Error: commands directory not found: " + commandsDir);
            return 1;
        }

        Map<String, Command> commands;
        try {
            commands = CommandJson.loadFromDirectory(commandsDir);
        } catch (IOException | IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (list) {
            printList(commands);
            return 0;
        }

        if (commandName == null) {
            System.err.println("Error: command name required. Use --list to see available commands.");
            return 1;
        }

        Command command = commands.get(commandName.startsWith("/")
            ? commandName.substring(1) : commandName);
        if (command == null) {
            System.err.println("Error: unknown command: " + commandName);
            return 1;
        }

        int status = 0;
        if (validate || args == null) {
            status = printValidation(command, commands);
        }
        if (args != null) {
            status = Math.max(status, printBindings(command, args));
        }
        return status;
    }

    private void printList(Map<String, Command> commands) {
        System.out.println("Available commands:");
        if (commands.isEmpty()) {
            System.out.println("  (none)");
        }
        for (var command : commands.values()) {
            var signature = new StringBuilder("/").append(command.name());
            for (CommandArgument argument : command.arguments()) {
                signature.append(argument.required() ? " <" : " [").append(argument.name())
                    .append(argument.required() ? ">" : "]");
            }
            System.out.printf("  %-40s %s%n", signature, command.description());
        }
    }

    private int printValidation(Command command, Map<String, Command> commands) {
        ValidationResult result = CommandValidator.validate(command, commands);
        List<SyntaxIssue> issues = FlowchartSyntaxAnalyzer.analyze(command.flowchart());

        System.out.println("Command /" + command.name() + ": " + (result.valid() ? "valid" : "INVALID"));
        result.errors().forEach(e -> System.out.println("  error:   " + e));
        result.warnings().forEach(w -> System.out.println("  warning: " + w));
        issues.forEach(i -> System.out.println("  %s: [%s] %s".formatted(i.level(), i.blockName(), i.message())));
        for (Block block : command.flowchart().blocks().values()) {
            for (String warning : VariableSubstitution.validateArgumentSyntax(templateOf(block))) {
                System.out.println("  warning: [%s] %s".formatted(block.name(), warning));
            }
        }
        return result.valid() ? 0 : 1;
    }

    private int printBindings(Command command, String rawArgs) {
        Map<String, String> bindings;
        try {
            bindings = command.parseArguments(rawArgs);
        } catch (ArgumentParseException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        System.out.println("Bindings:");
        bindings.forEach((key, value) -> System.out.println("  " + key + " = " + value));
        return 0;
    }

    private static String templateOf(Block block) {
        return switch (block.type()) {
            case PROMPT -> ((PromptBlock) block).prompt();
            case BASH -> ((BashBlock) block).command();
            case VARIABLE -> ((VariableBlock) block).variableValue();
            case BRANCH -> ((BranchBlock) block).condition();
            case COMMAND -> ((CommandBlock) block).arguments();
            default -> "";
        };
    }
}
