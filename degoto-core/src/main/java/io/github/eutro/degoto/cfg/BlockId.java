package io.github.eutro.degoto.cfg;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The graph identity of a {@link Block}: its address, and an index telling apart
 * duplicates that share the address.
 */
public final class BlockId {
    public final long addr;
    public final @Nullable Integer idx;

    public BlockId(long addr, @Nullable Integer idx) {
        this.addr = addr;
        this.idx = idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockId)) return false;
        BlockId that = (BlockId) o;
        return addr == that.addr && Objects.equals(idx, that.idx);
    }

    @Override
    public int hashCode() {
        return Objects.hash(addr, idx);
    }

    @Override
    public String toString() {
        return String.format("%#x", addr) + (idx == null ? "" : "." + idx);
    }
}
