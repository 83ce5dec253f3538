package dev.flowcoder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Invokes another command by name. Whether the target exists, and whether the call can recurse,
 * is checked against the full command registry, not here.
 */
public final class CommandBlock extends Block {

    private String commandName;
    private String arguments;
    private boolean inheritVariables;
    private boolean mergeOutput;

    public CommandBlock() {
        this(null, "Command", new Position(100, 250), "", "", false, false);
    }

    public CommandBlock(String name, String commandName, String arguments) {
        this(null, name, new Position(100, 250), commandName, arguments, false, false);
    }

    public CommandBlock(String id, String name, Position position,
                        String commandName, String arguments, boolean inheritVariables, boolean mergeOutput) {
        super(id, BlockType.COMMAND, name, position);
        this.commandName = commandName == null ? "" : commandName;
        this.arguments = arguments == null ? "" : arguments;
        this.inheritVariables = inheritVariables;
        this.mergeOutput = mergeOutput;
    }

    public String commandName() { return commandName; }
    public String arguments() { return arguments; }
    public boolean inheritVariables() { return inheritVariables; }
    public boolean mergeOutput() { return mergeOutput; }

    /**
     * The referenced command name as registered, i.e. without a leading slash.
     */
    public String targetCommandName() {
        int i = 0;
        while (i < commandName.length() && commandName.charAt(i) == '/') {
            i++;
        }
        return commandName.substring(i);
    }

    public void setCommandName(String commandName) {
        this.commandName = commandName == null ? "" : commandName;
    }

    public void setArguments(String arguments) {
        this.arguments = arguments == null ? "" : arguments;
    }

    public void setInheritVariables(boolean inheritVariables) { this.inheritVariables = inheritVariables; }
    public void setMergeOutput(boolean mergeOutput) { this.mergeOutput = mergeOutput; }

    @Override
    public List<String> validate() {
        var errors = new ArrayList<String>();
        if (commandName.isEmpty()) {
            errors.add("Command name is required");
        }
        return errors;
    }

    @Override
    public CommandBlock copy() {
        return new CommandBlock(id(), name(), position(), commandName, arguments, inheritVariables, mergeOutput);
    }
}
