package io.github.eutro.degoto.oracle;

import io.github.eutro.degoto.cfg.Block;

import java.util.Objects;

/**
 * A control transfer that structuring could not express, attributed to the block containing it.
 */
public final class Goto {
    public final Block source;
    public final long targetAddr;

    public Goto(Block source, long targetAddr) {
        this.source = source;
        this.targetAddr = targetAddr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Goto)) return false;
        Goto that = (Goto) o;
        return targetAddr == that.targetAddr && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, targetAddr);
    }

    @Override
    public String toString() {
        return String.format("goto %#x in %s", targetAddr, source.toTargetString());
    }
}
