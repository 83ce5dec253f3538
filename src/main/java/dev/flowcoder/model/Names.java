package dev.flowcoder.model;

/**
 * Name-format checks shared by blocks, arguments and commands.
 */
final class Names {

    private Names() {}

    /** Letters and digits, underscores allowed, at least one letter or digit. */
    static boolean isIdentifier(String name) {
        return isAlphanumeric(name.replace("_", ""));
    }

    /** Letters and digits, hyphens and underscores allowed, at least one letter or digit. */
    static boolean isSlug(String name) {
        return isAlphanumeric(name.replace("-", "").replace("_", ""));
    }

    private static boolean isAlphanumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isLetterOrDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
