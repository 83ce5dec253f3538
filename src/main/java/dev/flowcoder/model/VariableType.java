package dev.flowcoder.model;

import java.util.Locale;
import java.util.Set;

/**
 * Scalar kinds a Variable block or a captured Bash output can be coerced to.
 */
public enum VariableType {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    BOOLEAN("boolean");

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "y");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "n", "");

    private final String value;

    VariableType(String value) {
        this.value = value;
    }

    public String value() { return value; }

    public static boolean isValid(String value) {
        for (VariableType type : values()) {
            if (type.value.equals(value)) {
                return true;
            }
        }
        return false;
    }

    public static VariableType fromValue(String value) {
        for (VariableType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: " + value);
    }

    /**
     * Convert raw text (typically command output) to this type.
     *
     * @throws IllegalArgumentException if the text cannot be represented as this type
     */
    public Object convert(String raw) {
        switch (this) {
            case INT -> {
                try {
                    return Long.parseLong(raw.strip());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Cannot convert '%s' to int".formatted(raw), e);
                }
            }
            case FLOAT -> {
                try {
                    return Double.parseDouble(raw.strip());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Cannot convert '%s' to float".formatted(raw), e);
                }
            }
            case BOOLEAN -> {
                String lowered = raw.strip().toLowerCase(Locale.ROOT);
                if (TRUE_WORDS.contains(lowered)) {
                    return Boolean.TRUE;
                }
                if (FALSE_WORDS.contains(lowered)) {
                    return Boolean.FALSE;
                }
                throw new IllegalArgumentException(
                    "Cannot convert '%s' to boolean. Use: true/false, 1/0, yes/no".formatted(raw));
            }
            default -> {
                return raw;
            }
        }
    }
}
