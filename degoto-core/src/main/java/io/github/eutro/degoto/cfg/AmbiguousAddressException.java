package io.github.eutro.degoto.cfg;

import java.util.List;

/**
 * Thrown when an address has to be resolved to a single block,
 * but several live blocks share it.
 */
public class AmbiguousAddressException extends RuntimeException {
    private final long addr;
    private final List<Block> blocks;

    public AmbiguousAddressException(long addr, List<Block> blocks) {
        super(String.format("%d blocks at address %#x", blocks.size(), addr));
        this.addr = addr;
        this.blocks = blocks;
    }

    public long getAddr() {
        return addr;
    }

    public List<Block> getBlocks() {
        return blocks;
    }
}
