package io.github.eutro.degoto.cfg;

import io.github.eutro.degoto.ext.CommonExts;
import io.github.eutro.degoto.ext.ExtHolder;

/**
 * A decompiled function, owning its current control flow graph.
 * <p>
 * Passes never edit {@link #getGraph()} in place; they replace it with {@link #setGraph(ControlFlowGraph)}
 * once a rewrite has been accepted.
 */
public final class Function extends ExtHolder {
    public final String name;
    public final long addr;
    public final String binaryName;
    public final String arch;
    public final String platform;
    private ControlFlowGraph graph;

    public Function(String name, long addr, String binaryName, String arch, String platform, ControlFlowGraph graph) {
        this.name = name;
        this.addr = addr;
        this.binaryName = binaryName;
        this.arch = arch;
        this.platform = platform;
        setGraph(graph);
    }

    public ControlFlowGraph getGraph() {
        return graph;
    }

    public void setGraph(ControlFlowGraph graph) {
        graph.attachExt(CommonExts.OWNING_FUNCTION, this);
        this.graph = graph;
    }

    /**
     * @return {@code binary.function}, used to identify the function in logs.
     */
    public String targetName() {
        return binaryName + "." + name;
    }

    @Override
    public String toString() {
        return String.format("fn %s@%#x %s", name, addr, graph);
    }
}
