package dev.flowcoder.model;

/**
 * Routes execution along its true-path or false-path connection depending on a condition.
 */
public final class BranchBlock extends Block {

    private String condition;

    public BranchBlock() {
        this(null, "Branch", new Position(100, 250), "");
    }

    public BranchBlock(String name, String condition) {
        this(null, name, new Position(100, 250), condition);
    }

    public BranchBlock(String id, String name, Position position, String condition) {
        super(id, BlockType.BRANCH, name, position);
        this.condition = condition == null ? "" : condition;
    }

    public String condition() { return condition; }

    public void setCondition(String condition) {
        this.condition = condition == null ? "" : condition;
    }

    @Override
    public BranchBlock copy() {
        return new BranchBlock(id(), name(), position(), condition);
    }
}
