package dev.flowcoder.engine;

import java.util.List;

/**
 * Result of {@link BashSafetyChecker#check(String)}.
 */
public record BashSafetyReport(boolean safe, List<String> warnings) {

    public BashSafetyReport {
        warnings = List.copyOf(warnings);
    }
}
