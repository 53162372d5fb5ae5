package io.github.eutro.degoto.cfg;

import io.github.eutro.degoto.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A directed graph of {@link Block}s.
 * <p>
 * Nodes are keyed by {@link BlockId}, so {@link #replaceBlock(Block)} can swap in an edited
 * copy of a block without touching its edges. Node and edge iteration follow insertion order.
 * <p>
 * A graph is owned by one pass at a time. Passes edit a {@link #copy()} and hand it back
 * only once it has been validated.
 */
public final class ControlFlowGraph extends ExtHolder {
    private final Map<BlockId, Block> blocks = new LinkedHashMap<>();
    private final Map<BlockId, Set<BlockId>> succs = new HashMap<>();
    private final Map<BlockId, Set<BlockId>> preds = new HashMap<>();

    /**
     * Add a block, if no block with the same id is present.
     *
     * @param block The block.
     * @return Whether the block was added.
     */
    public boolean addBlock(Block block) {
        BlockId id = block.id();
        if (blocks.containsKey(id)) return false;
        blocks.put(id, block);
        succs.put(id, new LinkedHashSet<>());
        preds.put(id, new LinkedHashSet<>());
        return true;
    }

    /**
     * Replace the block with the same id as {@code block}, keeping its edges.
     *
     * @param block The new block.
     * @throws NoSuchElementException If there is no such block.
     */
    public void replaceBlock(Block block) {
        BlockId id = block.id();
        if (!blocks.containsKey(id)) {
            throw new NoSuchElementException("No block " + id);
        }
        blocks.put(id, block);
    }

    public void addEdge(Block from, Block to) {
        addBlock(from);
        addBlock(to);
        succs.get(from.id()).add(to.id());
        preds.get(to.id()).add(from.id());
    }

    public boolean removeEdge(Block from, Block to) {
        Set<BlockId> fromSuccs = succs.get(from.id());
        if (fromSuccs == null || !fromSuccs.remove(to.id())) return false;
        preds.get(to.id()).remove(from.id());
        return true;
    }

    public boolean hasEdge(Block from, Block to) {
        Set<BlockId> fromSuccs = succs.get(from.id());
        return fromSuccs != null && fromSuccs.contains(to.id());
    }

    public boolean removeBlock(Block block) {
        BlockId id = block.id();
        if (blocks.remove(id) == null) return false;
        for (BlockId succ : succs.remove(id)) {
            if (!succ.equals(id)) preds.get(succ).remove(id);
        }
        for (BlockId pred : preds.remove(id)) {
            if (!pred.equals(id)) succs.get(pred).remove(id);
        }
        return true;
    }

    public boolean contains(Block block) {
        return blocks.containsKey(block.id());
    }

    /**
     * Get the block currently stored under the id of {@code block}.
     *
     * @param block A block with the id to look up.
     * @return The stored block, or null if absent.
     */
    public @Nullable Block get(Block block) {
        return blocks.get(block.id());
    }

    public @Nullable Block get(BlockId id) {
        return blocks.get(id);
    }

    public List<Block> successors(Block block) {
        return resolve(succs.get(block.id()));
    }

    public List<Block> predecessors(Block block) {
        return resolve(preds.get(block.id()));
    }

    private List<Block> resolve(@Nullable Set<BlockId> ids) {
        if (ids == null) return Collections.emptyList();
        List<Block> ret = new ArrayList<>(ids.size());
        for (BlockId id : ids) {
            ret.add(blocks.get(id));
        }
        return ret;
    }

    public int inDegree(Block block) {
        Set<BlockId> ids = preds.get(block.id());
        return ids == null ? 0 : ids.size();
    }

    public int outDegree(Block block) {
        Set<BlockId> ids = succs.get(block.id());
        return ids == null ? 0 : ids.size();
    }

    /**
     * @return A snapshot of the blocks of this graph, in insertion order.
     */
    public List<Block> blocks() {
        return new ArrayList<>(blocks.values());
    }

    public List<Block> blocksAt(long addr) {
        List<Block> ret = new ArrayList<>();
        for (Block block : blocks.values()) {
            if (block.addr == addr) ret.add(block);
        }
        return ret;
    }

    /**
     * Resolve an address to the single block living there.
     *
     * @param addr The address.
     * @return The block, or null if there is none.
     * @throws AmbiguousAddressException If more than one block lives at the address.
     */
    public @Nullable Block blockAt(long addr) {
        List<Block> found = blocksAt(addr);
        switch (found.size()) {
            case 0:
                return null;
            case 1:
                return found.get(0);
            default:
                throw new AmbiguousAddressException(addr, found);
        }
    }

    /**
     * Find the smallest non-negative index that no block at {@code addr} uses.
     *
     * @param addr The address.
     * @return The index.
     */
    public int nextFreeIndex(long addr) {
        Set<Integer> used = new HashSet<>();
        for (BlockId id : blocks.keySet()) {
            if (id.addr == addr && id.idx != null) used.add(id.idx);
        }
        int i = 0;
        while (used.contains(i)) i++;
        return i;
    }

    /**
     * The entry block: the first block without predecessors, or the first block if every block has one.
     *
     * @return The entry, or null if the graph is empty.
     */
    public @Nullable Block entry() {
        for (Map.Entry<BlockId, Block> entry : blocks.entrySet()) {
            if (preds.get(entry.getKey()).isEmpty()) return entry.getValue();
        }
        return blocks.isEmpty() ? null : blocks.values().iterator().next();
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<BlockId> set : succs.values()) {
            count += set.size();
        }
        return count;
    }

    /**
     * Make a structural copy of this graph. Blocks are shared, edge sets and exts are not.
     *
     * @return The copy.
     */
    public ControlFlowGraph copy() {
        ControlFlowGraph copy = new ControlFlowGraph();
        copy.blocks.putAll(blocks);
        for (BlockId id : blocks.keySet()) {
            copy.succs.put(id, new LinkedHashSet<>(succs.get(id)));
            copy.preds.put(id, new LinkedHashSet<>(preds.get(id)));
        }
        copy.copyExtsFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg {\n");
        for (Block block : blocks.values()) {
            sb.append(' ').append(block.toTargetString()).append(" ->");
            for (BlockId succ : succs.get(block.id())) {
                sb.append(' ').append(succ);
            }
            sb.append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
