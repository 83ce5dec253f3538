package dev.flowcoder.model;

/**
 * Raised when an invocation's raw argument text cannot be bound to a command's declared arguments,
 * either because the text is not valid shell-style input or because a required argument is missing.
 */
public class ArgumentParseException extends RuntimeException {

    private final String argumentName; // nullable
    private final int position; // 0 when not tied to a declared argument

    public ArgumentParseException(String message) {
        super(message);
        this.argumentName = null;
        this.position = 0;
    }

    public ArgumentParseException(String argumentName, int position) {
        super("Missing required argument: %s (position %d)".formatted(argumentName, position));
        this.argumentName = argumentName;
        this.position = position;
    }

    public String argumentName() { return argumentName; }
    public int position() { return position; }
}
