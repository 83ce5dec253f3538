package dev.flowcoder.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Sends a prompt to the agent. The optional output schema describes the structured output
 * the agent must return; its properties become variables for later blocks.
 */
public final class PromptBlock extends Block {

    private String prompt;
    private JsonNode outputSchema; // nullable
    private String soundEffect; // nullable

    public PromptBlock() {
        this(null, "Prompt", new Position(100, 150), "", null, null);
    }

    public PromptBlock(String name, String prompt) {
        this(null, name, new Position(100, 150), prompt, null, null);
    }

    public PromptBlock(String id, String name, Position position,
                       String prompt, JsonNode outputSchema, String soundEffect) {
        super(id, BlockType.PROMPT, name, position);
        this.prompt = prompt == null ? "" : prompt;
        this.outputSchema = outputSchema;
        this.soundEffect = soundEffect;
    }

    public String prompt() { return prompt; }
    public JsonNode outputSchema() { return outputSchema; }
    public String soundEffect() { return soundEffect; }

    public void setPrompt(String prompt) {
        this.prompt = prompt == null ? "" : prompt;
    }

    public void setOutputSchema(JsonNode outputSchema) {
        this.outputSchema = outputSchema;
    }

    public void setSoundEffect(String soundEffect) {
        this.soundEffect = soundEffect;
    }

    @Override
    public PromptBlock copy() {
        return new PromptBlock(id(), name(), position(), prompt,
            outputSchema == null ? null : outputSchema.deepCopy(), soundEffect);
    }
}
