package io.github.eutro.degoto.cfg;

import io.github.eutro.degoto.util.GraphWalker;

import java.util.*;

public class GraphUtils {
    /**
     * Sort the blocks of a graph so that every block comes before its successors,
     * except along edges inside a strongly connected component.
     * <p>
     * Components are emitted in topological order of the condensed graph; the blocks of one
     * component are emitted in depth-first pre-order from the member first entered from outside
     * (or the first inserted member, if none is).
     *
     * @param graph The graph.
     * @return The sorted blocks.
     */
    public static List<Block> quasiTopologicalSort(ControlFlowGraph graph) {
        List<List<Block>> sccs = stronglyConnectedComponents(graph);
        Collections.reverse(sccs);

        List<Block> sorted = new ArrayList<>(graph.size());
        for (List<Block> scc : sccs) {
            if (scc.size() == 1) {
                sorted.add(scc.get(0));
                continue;
            }
            Set<Block> members = new HashSet<>(scc);
            Block head = scc.get(0);
            outer:
            for (Block member : scc) {
                for (Block pred : graph.predecessors(member)) {
                    if (!members.contains(pred)) {
                        head = member;
                        break outer;
                    }
                }
            }
            GraphWalker<Block> walker = new GraphWalker<>(head, block -> {
                List<Block> inside = new ArrayList<>();
                for (Block succ : graph.successors(block)) {
                    if (members.contains(succ)) inside.add(succ);
                }
                return inside;
            });
            sorted.addAll(walker.preOrder().toList());
        }
        return sorted;
    }

    /**
     * Find the strongly connected components of a graph with Tarjan's algorithm.
     *
     * @param graph The graph.
     * @return The components, in reverse topological order, each in discovery order.
     */
    public static List<List<Block>> stronglyConnectedComponents(ControlFlowGraph graph) {
        Map<Block, Integer> index = new HashMap<>();
        Map<Block, Integer> lowLink = new HashMap<>();
        Deque<Block> sccStack = new ArrayDeque<>();
        Set<Block> onStack = new HashSet<>();
        List<List<Block>> result = new ArrayList<>();

        for (Block root : graph.blocks()) {
            if (index.containsKey(root)) continue;
            Deque<Frame> callStack = new ArrayDeque<>();
            callStack.push(new Frame(root, graph.successors(root).iterator()));
            index.put(root, index.size());
            lowLink.put(root, index.get(root));
            sccStack.push(root);
            onStack.add(root);

            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                if (frame.succs.hasNext()) {
                    Block succ = frame.succs.next();
                    if (!index.containsKey(succ)) {
                        index.put(succ, index.size());
                        lowLink.put(succ, index.get(succ));
                        sccStack.push(succ);
                        onStack.add(succ);
                        callStack.push(new Frame(succ, graph.successors(succ).iterator()));
                    } else if (onStack.contains(succ)) {
                        lowLink.put(frame.block, Math.min(lowLink.get(frame.block), index.get(succ)));
                    }
                    continue;
                }

                callStack.pop();
                if (lowLink.get(frame.block).equals(index.get(frame.block))) {
                    List<Block> scc = new ArrayList<>();
                    Block member;
                    do {
                        member = sccStack.pop();
                        onStack.remove(member);
                        scc.add(member);
                    } while (!member.equals(frame.block));
                    Collections.reverse(scc);
                    result.add(scc);
                }
                Frame parent = callStack.peek();
                if (parent != null) {
                    lowLink.put(parent.block, Math.min(lowLink.get(parent.block), lowLink.get(frame.block)));
                }
            }
        }
        return result;
    }

    private static class Frame {
        final Block block;
        final Iterator<Block> succs;

        Frame(Block block, Iterator<Block> succs) {
            this.block = block;
            this.succs = succs;
        }
    }

    /**
     * Collect the addresses of every block reachable from the graph's entry.
     *
     * @param graph The graph.
     * @return The addresses.
     */
    public static Set<Long> reachableAddresses(ControlFlowGraph graph) {
        Set<Long> addrs = new TreeSet<>();
        if (graph.isEmpty()) return addrs;
        for (Block block : GraphWalker.blockWalker(graph).preOrder()) {
            addrs.add(block.addr);
        }
        return addrs;
    }
}
