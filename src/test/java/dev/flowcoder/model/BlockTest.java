package dev.flowcoder.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BlockTest {

    @Test
    void blankNameFallsBackToTypeDefault() {
        PromptBlock prompt = new PromptBlock(null, " ", new Position(0, 0), "hi", null, null);

        assertThat(prompt.name()).isEqualTo("Prompt Block");
    }

    @Test
    void idIsGeneratedWhenMissing() {
        assertThat(new EndBlock().id()).isNotBlank();
        assertThat(new EndBlock().id()).isNotEqualTo(new EndBlock().id());
    }

    @Test
    void variableBlockRejectsBadNameAndType() {
        VariableBlock block = new VariableBlock("Set", "my-var", "x");
        block.setVariableType("list");

        assertThat(block.validate()).containsExactly(
            "Variable name must be alphanumeric (underscores allowed)",
            "Invalid variable type: list");
    }

    @Test
    void variableBlockAcceptsUnderscores() {
        assertThat(new VariableBlock("Set", "file_count", "3").validate()).isEmpty();
    }

    @Test
    void bashBlockDefaultsCaptureOutput() {
        BashBlock bash = new BashBlock("Run", "ls");

        assertThat(bash.captureOutput()).isTrue();
        assertThat(bash.outputType()).isEqualTo("string");
        assertThat(bash.validate()).isEmpty();
    }

    @Test
    void bashBlockChecksVariableNames() {
        BashBlock bash = new BashBlock("Run", "ls");
        bash.setOutputVariable("out put");
        bash.setExitCodeVariable("code!");
        bash.setOutputType("bytes");

        assertThat(bash.validate()).containsExactly(
            "Output variable name must be alphanumeric (underscores allowed)",
            "Exit code variable name must be alphanumeric (underscores allowed)",
            "Invalid output type: bytes");
    }

    @Test
    void commandBlockRequiresName() {
        assertThat(new CommandBlock().validate()).containsExactly("Command name is required");
    }

    @Test
    void commandBlockStripsLeadingSlash() {
        assertThat(new CommandBlock("Call", "/review", "").targetCommandName()).isEqualTo("review");
        assertThat(new CommandBlock("Call", "review", "").targetCommandName()).isEqualTo("review");
    }

    @Test
    void copyKeepsIdAndDetachesSchema() {
        ObjectNode schema = new ObjectMapper().createObjectNode().put("type", "object");
        PromptBlock original = new PromptBlock("p1", "Ask", new Position(1, 2), "Hello", schema, "ding");

        PromptBlock copy = original.copy();
        schema.put("type", "array");
        copy.setName("Renamed");

        assertThat(copy.id()).isEqualTo("p1");
        assertThat(copy.outputSchema().get("type").asText()).isEqualTo("object");
        assertThat(original.name()).isEqualTo("Ask");
        assertThat(copy.soundEffect()).isEqualTo("ding");
    }

    @Test
    void blockTypeRoundTripsWireValue() {
        for (BlockType type : BlockType.values()) {
            assertThat(BlockType.fromValue(type.value())).isEqualTo(type);
        }
    }
}
