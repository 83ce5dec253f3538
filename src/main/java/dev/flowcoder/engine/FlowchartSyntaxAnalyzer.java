package dev.flowcoder.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowcoder.model.BashBlock;
import dev.flowcoder.model.Block;
import dev.flowcoder.model.BlockType;
import dev.flowcoder.model.BranchBlock;
import dev.flowcoder.model.CommandBlock;
import dev.flowcoder.model.Flowchart;
import dev.flowcoder.model.PromptBlock;
import dev.flowcoder.model.VariableBlock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cross-checks where variables are defined against where they are used.
 * <p>
 * The check is graph-global: a variable defined by any block counts as defined for every block,
 * regardless of execution order or reachability. References are matched as written, so
 * {@code {{user.name}}} is only satisfied by a producer of exactly {@code user.name}.
 */
public final class FlowchartSyntaxAnalyzer {

    private FlowchartSyntaxAnalyzer() {}

    public static List<SyntaxIssue> analyze(Flowchart flowchart) {
        var issues = new ArrayList<SyntaxIssue>();
        Set<String> defined = collectDefinedVariables(flowchart, issues);

        for (Block block : flowchart.blocks().values()) {
            var undefined = new TreeSet<String>();
            for (String ref : collectVariableReferences(block)) {
                if (!defined.contains(ref)) {
                    undefined.add(ref);
                }
            }
            if (!undefined.isEmpty()) {
                issues.add(SyntaxIssue.warning(
                    "Uninitialized variables used: " + String.join(", ", undefined), block.id(), block.name()));
            }
        }

        for (Block block : flowchart.blocks().values()) {
            if (block.type() == BlockType.BASH) {
                BashSafetyReport report = BashSafetyChecker.check(((BashBlock) block).command());
                if (!report.warnings().isEmpty()) {
                    issues.add(SyntaxIssue.warning(
                        "Potentially unsafe command: " + String.join("; ", report.warnings()), block.id(), block.name()));
                }
            }
        }
        return issues;
    }

    private static Set<String> collectDefinedVariables(Flowchart flowchart, List<SyntaxIssue> issues) {
        var defined = new HashSet<String>();
        for (Block block : flowchart.blocks().values()) {
            switch (block.type()) {
                case VARIABLE -> {
                    String name = ((VariableBlock) block).variableName();
                    if (!name.isEmpty()) {
                        defined.add(name);
                    }
                }
                case BASH -> {
                    BashBlock bash = (BashBlock) block;
                    String name = bash.outputVariable().strip();
                    if (bash.captureOutput() && !name.isEmpty()) {
                        defined.add(name);
                    }
                }
                case PROMPT -> {
                    PromptBlock prompt = (PromptBlock) block;
                    if (prompt.outputSchema() != null && !prompt.outputSchema().isNull()) {
                        defined.addAll(schemaProperties(prompt, issues));
                    }
                }
                default -> { }
            }
        }
        return defined;
    }

    private static Set<String> schemaProperties(PromptBlock block, List<SyntaxIssue> issues) {
        JsonNode schema = block.outputSchema();
        if (!schema.isObject()) {
            issues.add(SyntaxIssue.warning(
                "Structured output schema must be a JSON object.", block.id(), block.name()));
            return Set.of();
        }
        JsonNode properties = schema.get("properties");
        if (!"object".equals(schema.path("type").asText(null)) || properties == null || !properties.isObject()) {
            issues.add(SyntaxIssue.warning(
                "Structured output schema should define type \"object\" with properties.", block.id(), block.name()));
            return Set.of();
        }
        var names = new HashSet<String>();
        properties.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static Set<String> collectVariableReferences(Block block) {
        String text = switch (block.type()) {
            case PROMPT -> ((PromptBlock) block).prompt();
            case VARIABLE -> ((VariableBlock) block).variableValue();
            case BASH -> ((BashBlock) block).command();
            case BRANCH -> ((BranchBlock) block).condition();
            case COMMAND -> ((CommandBlock) block).arguments();
            default -> "";
        };
        return VariableSubstitution.findVariableReferences(text);
    }
}
