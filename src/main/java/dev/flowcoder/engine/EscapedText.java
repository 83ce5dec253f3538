package dev.flowcoder.engine;

import java.util.Map;

/**
 * Text whose {@code $$} escapes were swapped out for opaque markers, with the markers needed to restore them.
 */
public record EscapedText(String text, Map<String, String> escapes) {

    public EscapedText {
        escapes = Map.copyOf(escapes);
    }
}
