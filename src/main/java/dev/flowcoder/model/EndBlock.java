package dev.flowcoder.model;

/**
 * Marks successful completion of a path.
 */
public final class EndBlock extends Block {

    public EndBlock() {
        this(null, "End", new Position(100, 350));
    }

    public EndBlock(String id, String name, Position position) {
        super(id, BlockType.END, name, position);
    }

    @Override
    public EndBlock copy() {
        return new EndBlock(id(), name(), position());
    }
}
