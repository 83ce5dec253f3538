package dev.flowcoder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits invocation text into words using POSIX shell quoting rules.
 * <p>
 * Whitespace separates words. Single quotes preserve everything literally. Inside double quotes a
 * backslash only escapes {@code "} and {@code \}; elsewhere it is kept. Outside quotes a backslash
 * escapes any character. Quoted and unquoted parts of one word are concatenated, and {@code ""}
 * yields an empty word. There is no comment syntax.
 */
public final class ArgumentTokenizer {

    private ArgumentTokenizer() {}

    public static List<String> split(String text) {
        var words = new ArrayList<String>();
        if (text == null) {
            return words;
        }

        var current = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw new ArgumentParseException("Failed to parse arguments: No escaped character");
                }
                current.append(text.charAt(i + 1));
                inWord = true;
                i += 2;
            } else if (c == '\'') {
                int close = text.indexOf('\'', i + 1);
                if (close < 0) {
                    throw new ArgumentParseException("Failed to parse arguments: No closing quotation");
                }
                current.append(text, i + 1, close);
                inWord = true;
                i = close + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(text, i + 1, current);
                inWord = true;
            } else {
                current.append(c);
                inWord = true;
                i++;
            }
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }

    /** Appends the body of a double-quoted section starting at {@code from}; returns the index after the closing quote. */
    private static int readDoubleQuoted(String text, int from, StringBuilder out) {
        int i = from;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < n) {
                char next = text.charAt(i + 1);
                if (next == '"' || next == '\\') {
                    out.append(next);
                } else {
                    out.append(c).append(next);
                }
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        throw new ArgumentParseException("Failed to parse arguments: No closing quotation");
    }
}
