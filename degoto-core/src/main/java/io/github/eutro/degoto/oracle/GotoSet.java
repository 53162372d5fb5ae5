package io.github.eutro.degoto.oracle;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.BlockId;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The gotos left over after structuring a graph.
 */
public final class GotoSet implements Iterable<Goto> {
    public static final GotoSet EMPTY = new GotoSet(Collections.emptyList());

    private final Set<Goto> gotos;
    private final Map<BlockId, Set<Goto>> bySource = new HashMap<>();

    public GotoSet(Collection<Goto> gotos) {
        this.gotos = Collections.unmodifiableSet(new LinkedHashSet<>(gotos));
        for (Goto g : this.gotos) {
            bySource.computeIfAbsent(g.source.id(), $ -> new LinkedHashSet<>()).add(g);
        }
    }

    public int size() {
        return gotos.size();
    }

    public boolean isEmpty() {
        return gotos.isEmpty();
    }

    /**
     * @param block The block.
     * @return The gotos attributed to {@code block}, possibly empty.
     */
    public Set<Goto> gotosIn(Block block) {
        Set<Goto> found = bySource.get(block.id());
        return found == null ? Collections.emptySet() : Collections.unmodifiableSet(found);
    }

    public Set<Goto> asSet() {
        return gotos;
    }

    @NotNull
    @Override
    public Iterator<Goto> iterator() {
        return gotos.iterator();
    }

    @Override
    public String toString() {
        return gotos.toString();
    }
}
