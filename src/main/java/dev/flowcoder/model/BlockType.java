package dev.flowcoder.model;

/**
 * Discriminator for the block variants. The wire value is the {@code type} key in serialized blocks.
 */
public enum BlockType {
    START("start", "Start"),
    PROMPT("prompt", "Prompt"),
    BRANCH("branch", "Branch"),
    END("end", "End"),
    VARIABLE("variable", "Variable"),
    BASH("bash", "Bash"),
    COMMAND("command", "Command"),
    REFRESH("refresh", "Refresh");

    private final String value;
    private final String label;

    BlockType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String value() { return value; }

    /** Name given to a block of this type when none is supplied. */
    public String defaultName() {
        return label + " Block";
    }

    public static BlockType fromValue(String value) {
        for (BlockType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown block type: " + value);
    }
}
