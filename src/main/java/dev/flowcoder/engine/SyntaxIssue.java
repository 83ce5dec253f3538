package dev.flowcoder.engine;

/**
 * A finding from {@link FlowchartSyntaxAnalyzer}, tied to the block it concerns.
 */
public record SyntaxIssue(String level, String message, String blockId, String blockName) {

    public static final String WARNING = "warning";

    public static SyntaxIssue warning(String message, String blockId, String blockName) {
        return new SyntaxIssue(WARNING, message, blockId, blockName);
    }
}
