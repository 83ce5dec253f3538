package dev.flowcoder.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills block templates from a binding table.
 * <p>
 * Two placeholder forms are supported: positional arguments ({@code $1}, {@code $2}, ...) and
 * structured variables ({@code {{status}}}, {@code {{user.name}}}, {@code {{files[0]}}}).
 * {@code $0} is never substituted so shell and awk snippets can keep it, and {@code $$} is an
 * escaped dollar sign that never starts a positional placeholder.
 */
public final class VariableSubstitution {

    private static final Logger log = LoggerFactory.getLogger(VariableSubstitution.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final Pattern ARG_PATTERN = Pattern.compile("\\$(\\d+)");
    public static final Pattern VAR_PATTERN = Pattern.compile("\\{\\{([a-zA-Z_][a-zA-Z0-9_.\\[\\]]*)}}");

    private static final long MAX_CHECKED_POSITION = 9_999;
    private static final String ESCAPED_DOLLAR = "$$";
    private static final String MARKER_OPEN = "\uE000ESC";
    private static final String MARKER_CLOSE = "\uE001";

    private VariableSubstitution() {}

    /**
     * Replace every {@code $N} (N >= 1) with its binding.
     *
     * @throws SubstitutionException if a referenced argument is not bound
     */
    public static String substituteArguments(String text, Map<String, ?> arguments) {
        EscapedText escaped = preprocessText(text);
        Matcher m = ARG_PATTERN.matcher(escaped.text());
        var out = new StringBuilder();
        while (m.find()) {
            String placeholder = m.group();
            String replacement = placeholder;
            if (!isZero(m.group(1))) {
                if (!arguments.containsKey(placeholder)) {
                    throw new SubstitutionException(placeholder, "argument " + argumentNumber(m.group(1)),
                        "Missing required argument: %s (argument %s)".formatted(placeholder, argumentNumber(m.group(1))));
                }
                replacement = String.valueOf(arguments.get(placeholder));
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return postprocessText(out.toString(), escaped.escapes());
    }

    /**
     * Replace every {@code {{path}}} with the value the path resolves to. Maps, lists and JSON
     * containers are inserted as compact JSON; everything else as its string form.
     *
     * @throws SubstitutionException if a path does not resolve
     */
    public static String substituteVariables(String text, Map<String, ?> variables) {
        Matcher m = VAR_PATTERN.matcher(text);
        var out = new StringBuilder();
        while (m.find()) {
            String path = m.group(1);
            Object value;
            try {
                value = resolveVariablePath(path, variables);
            } catch (SubstitutionException e) {
                throw new SubstitutionException(m.group(), e.hint(),
                    "Variable not found: %s - %s. Available variables: %s"
                        .formatted(m.group(), e.getMessage(), variables.keySet()));
            }
            m.appendReplacement(out, Matcher.quoteReplacement(stringify(m.group(), value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Positional arguments first, then structured variables. The variable pass only runs when
     * structured placeholders remain.
     */
    public static String substituteAll(String text, Map<String, ?> arguments, Map<String, ?> variables) {
        log.debug("Substituting template ({} chars, {} argument(s))", text.length(),
            arguments == null ? 0 : arguments.size());
        String result = text;
        if (arguments != null && !arguments.isEmpty()) {
            result = substituteArguments(result, arguments);
        }
        if (VAR_PATTERN.matcher(result).find()) {
            result = substituteVariables(result, variables == null ? Map.of() : variables);
        }
        return result;
    }

    /**
     * Substitute both forms from a single binding table holding {@code $N} keys and named variables.
     */
    public static String substituteAll(String text, Map<String, ?> bindings) {
        return substituteAll(text, bindings, bindings);
    }

    /**
     * Walk a dotted/indexed path such as {@code results.items[0].name} through nested maps, lists
     * and JSON nodes.
     *
     * @throws SubstitutionException if a key is absent, an index is invalid or out of range, or a
     *                               segment addresses a scalar
     */
    public static Object resolveVariablePath(String path, Map<String, ?> variables) {
        String placeholder = "{{" + path + "}}";
        String[] parts = path.replace('[', '.').replace("]", "").split("\\.", -1);

        Object value = variables;
        for (String part : parts) {
            if (value instanceof JsonNode node && node.isContainerNode()) {
                value = resolveJsonSegment(placeholder, node, part);
            } else if (value instanceof Map<?, ?> map) {
                if (!map.containsKey(part)) {
                    throw new SubstitutionException(placeholder, String.valueOf(map.keySet()),
                        "Key '%s' not found in %s".formatted(part, map.keySet()));
                }
                value = map.get(part);
            } else if (value instanceof List<?> list) {
                value = list.get(parseIndex(placeholder, part, list.size()));
            } else {
                String typeName = value == null ? "null" : value.getClass().getSimpleName();
                throw new SubstitutionException(placeholder, typeName,
                    "Cannot access '%s' on %s".formatted(part, typeName));
            }
        }
        return value;
    }

    /**
     * Unique {@code $N} references (N >= 1) in numeric order.
     */
    public static List<String> findArgumentReferences(String text) {
        Matcher m = ARG_PATTERN.matcher(preprocessText(text).text());
        Set<String> refs = new TreeSet<>(Comparator.comparingLong((String ref) -> argumentNumber(ref.substring(1)))
            .thenComparing(Comparator.naturalOrder()));
        while (m.find()) {
            if (!isZero(m.group(1))) {
                refs.add(m.group());
            }
        }
        return new ArrayList<>(refs);
    }

    /**
     * Unique structured variable paths in order of first appearance.
     */
    public static Set<String> findVariableReferences(String text) {
        var refs = new LinkedHashSet<String>();
        Matcher m = VAR_PATTERN.matcher(text);
        while (m.find()) {
            refs.add(m.group(1));
        }
        return refs;
    }

    /**
     * Warn about gaps in positional numbering, e.g. {@code $1} and {@code $3} without {@code $2}.
     */
    public static List<String> validateArgumentSyntax(String text) {
        var warnings = new ArrayList<String>();
        List<String> refs = findArgumentReferences(text);
        if (refs.isEmpty()) {
            return warnings;
        }

        var numbers = new TreeSet<Long>();
        for (String ref : refs) {
            long n = argumentNumber(ref.substring(1));
            if (n <= MAX_CHECKED_POSITION) {
                numbers.add(n);
            }
        }
        if (numbers.isEmpty()) {
            return warnings;
        }
        var missing = new ArrayList<String>();
        for (long n = 1; n < numbers.last(); n++) {
            if (!numbers.contains(n)) {
                missing.add("$" + n);
            }
        }
        if (!missing.isEmpty()) {
            warnings.add("Argument reference skips %s (found %s)"
                .formatted(String.join(", ", missing), String.join(", ", refs)));
        }
        return warnings;
    }

    /**
     * Collapse each {@code $$} into a literal {@code $}.
     */
    public static String escapeDollarSigns(String text) {
        return text.replace(ESCAPED_DOLLAR, "$");
    }

    /**
     * Swap every {@code $$} for an opaque marker so it cannot take part in {@code $N} matching.
     * {@link #postprocessText} restores the original text exactly.
     */
    public static EscapedText preprocessText(String text) {
        var escapes = new LinkedHashMap<String, String>();
        var out = new StringBuilder();
        int from = 0;
        int at;
        while ((at = text.indexOf(ESCAPED_DOLLAR, from)) >= 0) {
            String marker = MARKER_OPEN + escapes.size() + MARKER_CLOSE;
            escapes.put(marker, ESCAPED_DOLLAR);
            out.append(text, from, at).append(marker);
            from = at + ESCAPED_DOLLAR.length();
        }
        out.append(text, from, text.length());
        return new EscapedText(out.toString(), escapes);
    }

    public static String postprocessText(String text, Map<String, String> escapes) {
        String result = text;
        for (var entry : escapes.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static Object resolveJsonSegment(String placeholder, JsonNode node, String part) {
        if (node.isObject()) {
            if (!node.has(part)) {
                var keys = new ArrayList<String>();
                node.fieldNames().forEachRemaining(keys::add);
                throw new SubstitutionException(placeholder, String.valueOf(keys),
                    "Key '%s' not found in %s".formatted(part, keys));
            }
            return node.get(part);
        }
        return node.get(parseIndex(placeholder, part, node.size()));
    }

    private static int parseIndex(String placeholder, String part, int size) {
        int index;
        try {
            index = Integer.parseInt(part);
        } catch (NumberFormatException e) {
            throw new SubstitutionException(placeholder, "list of length " + size,
                "Invalid list index: '%s' (must be an integer)".formatted(part), e);
        }
        if (index < 0 || index >= size) {
            throw new SubstitutionException(placeholder, "list of length " + size,
                "Index %d out of range for list of length %d".formatted(index, size));
        }
        return index;
    }

    private static String stringify(String placeholder, Object value) {
        if (value instanceof JsonNode node) {
            return node.isTextual() ? node.asText() : node.toString();
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new SubstitutionException(placeholder, value.getClass().getSimpleName(),
                    "Cannot serialize value of " + placeholder, e);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isZero(String digits) {
        return digits.chars().allMatch(c -> c == '0');
    }

    private static long argumentNumber(String digits) {
        // overly long digit runs are not valid positions; sort them last
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
