package dev.flowcoder.model;

/**
 * Asks the execution controller to refresh the agent session.
 */
public final class RefreshBlock extends Block {

    public RefreshBlock() {
        this(null, "Refresh", new Position(100, 250));
    }

    public RefreshBlock(String id, String name, Position position) {
        super(id, BlockType.REFRESH, name, position);
    }

    @Override
    public RefreshBlock copy() {
        return new RefreshBlock(id(), name(), position());
    }
}
