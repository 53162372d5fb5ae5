package io.github.eutro.degoto.ir;

import io.github.eutro.degoto.cfg.Block;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A switch head whose cases have not been materialised as edges yet.
 * <p>
 * This replaces the last statement of the head of a collapsed comparison ladder.
 * It is never executed or emitted; a later stage must expand it with
 * {@link io.github.eutro.degoto.passes.switches.DispatchRestorer}.
 */
public final class DispatchPlaceholder extends Stmt {
    public final Expr expr;
    public final List<Entry> entries;

    public DispatchPlaceholder(Expr expr, List<Entry> entries) {
        this.expr = expr;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * One case of the dispatch, in ladder order.
     */
    public static final class Entry {
        /**
         * The block that tested this case, or a trimmed copy of it.
         */
        public final Block caseBlock;
        public final CaseValue value;
        public final long targetAddr;
        /**
         * The address of the next comparison of the ladder, null for the last case.
         */
        public final @Nullable Long nextAddr;

        public Entry(Block caseBlock, CaseValue value, long targetAddr, @Nullable Long nextAddr) {
            this.caseBlock = caseBlock;
            this.value = value;
            this.targetAddr = targetAddr;
            this.nextAddr = nextAddr;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry that = (Entry) o;
            return targetAddr == that.targetAddr
                    && caseBlock.equals(that.caseBlock)
                    && value.equals(that.value)
                    && Objects.equals(nextAddr, that.nextAddr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(caseBlock, value, targetAddr, nextAddr);
        }

        @Override
        public String toString() {
            return String.format("case %s @%#x -> %#x", value, caseBlock.addr, targetAddr);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DispatchPlaceholder)) return false;
        DispatchPlaceholder that = (DispatchPlaceholder) o;
        return expr.equals(that.expr) && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(DispatchPlaceholder.class, expr, entries);
    }

    @Override
    public String toString() {
        return "switch (" + expr + ") " + entries.stream()
                .map(Entry::toString)
                .collect(Collectors.joining("; ", "{", "}"));
    }
}
