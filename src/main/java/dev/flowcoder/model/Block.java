package dev.flowcoder.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A typed node of a flowchart. Identity ({@link #id()} and {@link #type()}) is fixed at construction;
 * name, position and the per-variant configuration stay editable.
 */
public abstract sealed class Block
    permits StartBlock, PromptBlock, BranchBlock, EndBlock, VariableBlock, BashBlock, CommandBlock, RefreshBlock {

    private final String id;
    private final BlockType type;
    private String name;
    private Position position;

    protected Block(String id, BlockType type, String name, Position position) {
        this.id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        this.type = Objects.requireNonNull(type, "type");
        this.position = Objects.requireNonNull(position, "position");
        setName(name);
    }

    public String id() { return id; }
    public BlockType type() { return type; }
    public String name() { return name; }
    public Position position() { return position; }

    public void setName(String name) {
        this.name = name == null || name.isBlank() ? type.defaultName() : name;
    }

    public void setPosition(Position position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    /**
     * Per-variant configuration checks. Returns an empty list when the block is well-formed.
     */
    public List<String> validate() {
        return List.of();
    }

    /**
     * An independent copy carrying the same id.
     */
    public abstract Block copy();

    @Override
    public String toString() {
        return "%s(id=%s, name=%s)".formatted(getClass().getSimpleName(), id, name);
    }
}
