package io.github.eutro.degoto.ext;

import io.github.eutro.degoto.cfg.BlockId;
import io.github.eutro.degoto.cfg.Function;

public class CommonExts {
    /**
     * On a graph: the function it was built for. Survives {@link io.github.eutro.degoto.cfg.ControlFlowGraph#copy()}.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");

    /**
     * On a block: the block it is a duplicate of.
     */
    public static final Ext<BlockId> DUPLICATED_FROM = Ext.create(BlockId.class, "DUPLICATED_FROM");

    /**
     * On a statement: the address of the machine instruction it was lifted from.
     */
    public static final Ext<Long> INS_ADDR = Ext.create(Long.class, "INS_ADDR");

    public static <T extends ExtContainer> T withInsAddr(T t, long insAddr) {
        t.attachExt(INS_ADDR, insAddr);
        return t;
    }
}
