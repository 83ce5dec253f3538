package dev.flowcoder.engine;

/**
 * A placeholder in a template could not be resolved against the supplied bindings.
 */
public class SubstitutionException extends RuntimeException {

    private final String placeholder;
    private final String hint;

    public SubstitutionException(String placeholder, String hint, String message) {
        super(message);
        this.placeholder = placeholder;
        this.hint = hint;
    }

    public SubstitutionException(String placeholder, String hint, String message, Throwable cause) {
        super(message, cause);
        this.placeholder = placeholder;
        this.hint = hint;
    }

    /** The placeholder exactly as written in the template, e.g. {@code $2} or {@code {{user.name}}}. */
    public String placeholder() { return placeholder; }

    /** What was available instead: the argument position or the keys at the failing path segment. */
    public String hint() { return hint; }
}
