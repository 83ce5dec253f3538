package dev.flowcoder.model;

/**
 * Entry point of a flowchart. A flowchart holds exactly one.
 */
public final class StartBlock extends Block {

    public StartBlock() {
        this(null, "Start", new Position(100, 50));
    }

    public StartBlock(String id, String name, Position position) {
        super(id, BlockType.START, name, position);
    }

    @Override
    public StartBlock copy() {
        return new StartBlock(id(), name(), position());
    }
}
