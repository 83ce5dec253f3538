package dev.flowcoder.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * A graph of blocks joined by directed connections, entered through a single Start block.
 * <p>
 * Mutating operations keep the graph consistent: connection endpoints always exist, a
 * (source, target) pair is connected at most once, and the Start block cannot be removed.
 * {@link #validate()} reports everything else as findings.
 */
public final class Flowchart {

    private final Map<String, Block> blocks;
    private final List<Connection> connections;
    private String startBlockId; // nullable only for restored charts without a Start block

    /**
     * Create an empty flowchart holding just a Start block.
     */
    public Flowchart() {
        this.blocks = new LinkedHashMap<>();
        this.connections = new ArrayList<>();
        StartBlock start = new StartBlock();
        blocks.put(start.id(), start);
        this.startBlockId = start.id();
    }

    private Flowchart(Map<String, Block> blocks, List<Connection> connections, String startBlockId) {
        this.blocks = blocks;
        this.connections = connections;
        this.startBlockId = startBlockId;
    }

    /**
     * Rebuild a flowchart from stored data as-is. No Start block is created and connections are not
     * checked; {@link #validate()} reports any inconsistency.
     */
    public static Flowchart restore(Collection<Block> blocks, List<Connection> connections, String startBlockId) {
        var byId = new LinkedHashMap<String, Block>();
        for (Block block : blocks) {
            byId.put(block.id(), block);
        }
        String start = startBlockId;
        if (start == null) {
            start = byId.values().stream()
                .filter(b -> b.type() == BlockType.START)
                .map(Block::id)
                .findFirst()
                .orElse(null);
        }
        return new Flowchart(byId, new ArrayList<>(connections), start);
    }

    public Map<String, Block> blocks() { return Collections.unmodifiableMap(blocks); }
    public List<Connection> connections() { return Collections.unmodifiableList(connections); }
    public String startBlockId() { return startBlockId; }

    public Optional<Block> getBlock(String blockId) {
        return Optional.ofNullable(blocks.get(blockId));
    }

    public void addBlock(Block block) {
        if (blocks.containsKey(block.id())) {
            throw new IllegalArgumentException("Block with id %s already exists".formatted(block.id()));
        }
        if (block.type() == BlockType.START) {
            if (startBlockId != null) {
                throw new IllegalArgumentException("Flowchart already has a start block");
            }
            startBlockId = block.id();
        }
        blocks.put(block.id(), block);
    }

    /**
     * Remove a block together with every connection touching it.
     */
    public void removeBlock(String blockId) {
        Block block = blocks.get(blockId);
        if (block == null) {
            throw new IllegalArgumentException("Block %s not found".formatted(blockId));
        }
        if (block.type() == BlockType.START) {
            throw new IllegalArgumentException("Cannot remove start block");
        }
        connections.removeIf(c -> c.sourceBlockId().equals(blockId) || c.targetBlockId().equals(blockId));
        blocks.remove(blockId);
    }

    public void addConnection(Connection connection) {
        if (!blocks.containsKey(connection.sourceBlockId())) {
            throw new IllegalArgumentException("Source block %s not found".formatted(connection.sourceBlockId()));
        }
        if (!blocks.containsKey(connection.targetBlockId())) {
            throw new IllegalArgumentException("Target block %s not found".formatted(connection.targetBlockId()));
        }
        for (Connection existing : connections) {
            if (existing.sourceBlockId().equals(connection.sourceBlockId())
                && existing.targetBlockId().equals(connection.targetBlockId())) {
                throw new IllegalArgumentException("Connection from %s to %s already exists"
                    .formatted(connection.sourceBlockId(), connection.targetBlockId()));
            }
        }
        connections.add(connection);
    }

    /**
     * Remove a connection by id. Returns false when no such connection exists.
     */
    public boolean removeConnection(String connectionId) {
        return connections.removeIf(c -> c.id().equals(connectionId));
    }

    public List<Connection> getConnectionsFrom(String blockId) {
        return connections.stream().filter(c -> c.sourceBlockId().equals(blockId)).toList();
    }

    public List<Connection> getConnectionsTo(String blockId) {
        return connections.stream().filter(c -> c.targetBlockId().equals(blockId)).toList();
    }

    public Optional<Block> getStartBlock() {
        return startBlockId == null ? Optional.empty() : getBlock(startBlockId);
    }

    /**
     * The target of the first outgoing connection, for linear flow.
     */
    public Optional<Block> getNextBlock(String blockId) {
        List<Connection> outgoing = getConnectionsFrom(blockId);
        if (outgoing.isEmpty()) {
            return Optional.empty();
        }
        return getBlock(outgoing.get(0).targetBlockId());
    }

    /**
     * The target a branch block routes to for the given condition outcome.
     */
    public Optional<Block> getBranchTarget(String branchBlockId, boolean conditionResult) {
        return getConnectionsFrom(branchBlockId).stream()
            .filter(c -> c.isTruePath() == conditionResult)
            .findFirst()
            .flatMap(c -> getBlock(c.targetBlockId()));
    }

    /**
     * An independent copy of this flowchart. Blocks are copied; connections are immutable and shared.
     */
    public Flowchart copy() {
        var copiedBlocks = new LinkedHashMap<String, Block>();
        for (Block block : blocks.values()) {
            copiedBlocks.put(block.id(), block.copy());
        }
        return new Flowchart(copiedBlocks, new ArrayList<>(connections), startBlockId);
    }

    /**
     * Check the graph for structural problems. Read-only; all findings are collected.
     */
    public ValidationResult validate() {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        List<Block> startBlocks = blocksOfType(BlockType.START);
        if (startBlocks.isEmpty()) {
            errors.add("Flowchart must have a Start block. "
                + "Add a Start block to begin the flowchart.");
        } else if (startBlocks.size() > 1) {
            errors.add("Flowchart must have only one Start block (found %d). Remove the extra Start blocks."
                .formatted(startBlocks.size()));
        }

        if (blocksOfType(BlockType.END).isEmpty()) {
            warnings.add("Flowchart should have at least one End block "
                + "to properly terminate execution paths.");
        }

        if (!startBlocks.isEmpty()) {
            Set<String> reachable = reachableFrom(startBlocks.get(0).id());
            var unreachable = new ArrayList<String>();
            for (Block block : blocks.values()) {
                // isolated blocks get the disconnected warning instead
                if (!reachable.contains(block.id()) && !isDisconnected(block)) {
                    unreachable.add(block.name());
                }
            }
            if (!unreachable.isEmpty()) {
                warnings.add("Blocks unreachable from Start: %s. Connect these blocks to the main flow or remove them."
                    .formatted(String.join(", ", unreachable)));
            }
        }

        for (Block block : blocks.values()) {
            if (block.type() == BlockType.PROMPT && ((PromptBlock) block).prompt().isBlank()) {
                errors.add("Prompt block '%s' has an empty prompt.".formatted(block.name()));
            }
        }

        for (Block block : blocks.values()) {
            if (block.type() == BlockType.BRANCH) {
                validateBranch((BranchBlock) block, errors);
            }
        }

        for (Block block : blocks.values()) {
            switch (block.type()) {
                case VARIABLE -> block.validate()
                    .forEach(e -> errors.add("Variable block '%s': %s".formatted(block.name(), e)));
                case BASH -> block.validate()
                    .forEach(e -> errors.add("Bash block '%s': %s".formatted(block.name(), e)));
                default -> { }
            }
        }

        for (Connection conn : connections) {
            if (!blocks.containsKey(conn.sourceBlockId())) {
                errors.add("Connection references non-existent source block: " + conn.sourceBlockId());
            }
            if (!blocks.containsKey(conn.targetBlockId())) {
                errors.add("Connection references non-existent target block: " + conn.targetBlockId());
            }
        }

        for (Block block : blocks.values()) {
            if (isDisconnected(block)) {
                warnings.add("Block '%s' is completely disconnected (no incoming or outgoing connections)."
                    .formatted(block.name()));
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    private void validateBranch(BranchBlock branch, List<String> errors) {
        if (branch.condition().isBlank()) {
            errors.add("Branch block '%s' has no condition.".formatted(branch.name()));
        }
        List<Connection> outgoing = getConnectionsFrom(branch.id());
        if (outgoing.isEmpty()) {
            errors.add("Branch block '%s' has no outgoing connections. Add a True path and a False path."
                .formatted(branch.name()));
            return;
        }
        boolean hasTrue = outgoing.stream().anyMatch(Connection::isTruePath);
        boolean hasFalse = outgoing.stream().anyMatch(c -> !c.isTruePath());
        if (!hasFalse) {
            errors.add("Branch block '%s' only has a True path connection. Add a False path."
                .formatted(branch.name()));
        } else if (!hasTrue) {
            errors.add("Branch block '%s' only has a False path connection. Add a True path."
                .formatted(branch.name()));
        }
    }

    private List<Block> blocksOfType(BlockType type) {
        return blocks.values().stream().filter(b -> b.type() == type).toList();
    }

    private boolean isDisconnected(Block block) {
        if (block.type() == BlockType.START || block.type() == BlockType.END) {
            return false;
        }
        for (Connection conn : connections) {
            if (conn.sourceBlockId().equals(block.id()) || conn.targetBlockId().equals(block.id())) {
                return false;
            }
        }
        return true;
    }

    private Set<String> reachableFrom(String startId) {
        var visited = new HashSet<String>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (Connection conn : getConnectionsFrom(current)) {
                if (!visited.contains(conn.targetBlockId())) {
                    queue.add(conn.targetBlockId());
                }
            }
        }
        return visited;
    }
}
