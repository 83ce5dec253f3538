package dev.flowcoder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a shell command. Output and exit code can be captured into variables.
 */
public final class BashBlock extends Block {

    private String command;
    private boolean captureOutput;
    private String outputVariable;
    private String outputType;
    private String workingDirectory;
    private boolean continueOnError;
    private String exitCodeVariable;

    public BashBlock() {
        this(null, "Bash", new Position(100, 250), "", true, "", VariableType.STRING.value(), "", false, "");
    }

    public BashBlock(String name, String command) {
        this(null, name, new Position(100, 250), command, true, "", VariableType.STRING.value(), "", false, "");
    }

    public BashBlock(String id, String name, Position position,
                     String command, boolean captureOutput, String outputVariable, String outputType,
                     String workingDirectory, boolean continueOnError, String exitCodeVariable) {
        super(id, BlockType.BASH, name, position);
        this.command = nullToEmpty(command);
        this.captureOutput = captureOutput;
        this.outputVariable = nullToEmpty(outputVariable);
        this.outputType = outputType == null ? VariableType.STRING.value() : outputType;
        this.workingDirectory = nullToEmpty(workingDirectory);
        this.continueOnError = continueOnError;
        this.exitCodeVariable = nullToEmpty(exitCodeVariable);
    }

    public String command() { return command; }
    public boolean captureOutput() { return captureOutput; }
    public String outputVariable() { return outputVariable; }
    public String outputType() { return outputType; }
    public String workingDirectory() { return workingDirectory; }
    public boolean continueOnError() { return continueOnError; }
    public String exitCodeVariable() { return exitCodeVariable; }

    public void setCommand(String command) { this.command = nullToEmpty(command); }
    public void setCaptureOutput(boolean captureOutput) { this.captureOutput = captureOutput; }
    public void setOutputVariable(String outputVariable) { this.outputVariable = nullToEmpty(outputVariable); }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = nullToEmpty(workingDirectory); }
    public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
    public void setExitCodeVariable(String exitCodeVariable) { this.exitCodeVariable = nullToEmpty(exitCodeVariable); }

    public void setOutputType(String outputType) {
        this.outputType = outputType == null ? VariableType.STRING.value() : outputType;
    }

    @Override
    public List<String> validate() {
        var errors = new ArrayList<String>();
        if (command.isBlank()) {
            errors.add("Bash command is required");
        }
        if (!outputVariable.isEmpty() && !Names.isIdentifier(outputVariable)) {
            errors.add("Output variable name must be alphanumeric (underscores allowed)");
        }
        if (!exitCodeVariable.isEmpty() && !Names.isIdentifier(exitCodeVariable)) {
            errors.add("Exit code variable name must be alphanumeric (underscores allowed)");
        }
        if (!VariableType.isValid(outputType)) {
            errors.add("Invalid output type: " + outputType);
        }
        return errors;
    }

    @Override
    public BashBlock copy() {
        return new BashBlock(id(), name(), position(), command, captureOutput, outputVariable, outputType,
            workingDirectory, continueOnError, exitCodeVariable);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
