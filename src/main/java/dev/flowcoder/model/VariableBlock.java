package dev.flowcoder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a value to a variable. The value is a template and may reference arguments and other variables.
 */
public final class VariableBlock extends Block {

    private String variableName;
    private String variableValue;
    private String variableType;

    public VariableBlock() {
        this(null, "Variable", new Position(100, 250), "", "", VariableType.STRING.value());
    }

    public VariableBlock(String name, String variableName, String variableValue) {
        this(null, name, new Position(100, 250), variableName, variableValue, VariableType.STRING.value());
    }

    public VariableBlock(String id, String name, Position position,
                         String variableName, String variableValue, String variableType) {
        super(id, BlockType.VARIABLE, name, position);
        this.variableName = variableName == null ? "" : variableName;
        this.variableValue = variableValue == null ? "" : variableValue;
        this.variableType = variableType == null ? VariableType.STRING.value() : variableType;
    }

    public String variableName() { return variableName; }
    public String variableValue() { return variableValue; }
    public String variableType() { return variableType; }

    public void setVariableName(String variableName) {
        this.variableName = variableName == null ? "" : variableName;
    }

    public void setVariableValue(String variableValue) {
        this.variableValue = variableValue == null ? "" : variableValue;
    }

    public void setVariableType(String variableType) {
        this.variableType = variableType == null ? VariableType.STRING.value() : variableType;
    }

    @Override
    public List<String> validate() {
        var errors = new ArrayList<String>();
        if (variableName.isEmpty()) {
            errors.add("Variable name is required");
        } else if (!Names.isIdentifier(variableName)) {
            errors.add("Variable name must be alphanumeric (underscores allowed)");
        }
        if (!VariableType.isValid(variableType)) {
            errors.add("Invalid variable type: " + variableType);
        }
        return errors;
    }

    @Override
    public VariableBlock copy() {
        return new VariableBlock(id(), name(), position(), variableName, variableValue, variableType);
    }
}
