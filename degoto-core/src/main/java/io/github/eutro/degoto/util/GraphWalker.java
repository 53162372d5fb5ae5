package io.github.eutro.degoto.util;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.cfg.ControlFlowGraph;

import java.util.*;

/**
 * A depth-first walk over any graph given by a root and a child function.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    final T root;
    final F<T, ? extends Iterable<T>> getChildren;

    public GraphWalker(T root, F<T, ? extends Iterable<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    public static GraphWalker<Block> blockWalker(ControlFlowGraph graph, Block root) {
        return new GraphWalker<>(root, graph::successors);
    }

    /**
     * Walk the blocks reachable from the graph's {@link ControlFlowGraph#entry() entry}.
     *
     * @param graph The graph, which must not be empty.
     * @return The walker.
     */
    public static GraphWalker<Block> blockWalker(ControlFlowGraph graph) {
        Block entry = graph.entry();
        if (entry == null) throw new IllegalArgumentException("empty graph");
        return blockWalker(graph, entry);
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            List<T> children = new ArrayList<>();
            for (T next : getChildren.apply(top)) {
                children.add(next);
            }
            // push in reverse so the first child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                T next = children.get(i);
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
