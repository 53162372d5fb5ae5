package io.github.eutro.degoto.passes.switches;

import io.github.eutro.degoto.cfg.Block;
import io.github.eutro.degoto.ir.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A recognised switch ladder: its cases in ladder order (the default case, if any, last),
 * and the range-split blocks that only route between cases.
 */
public final class SwitchChain {
    public final List<Case> cases;
    public final List<Block> redundantNodes;

    public SwitchChain(List<Case> cases, List<Block> redundantNodes) {
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.redundantNodes = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(redundantNodes)));
    }

    public ExprKey exprKey() {
        return cases.get(cases.size() - 1).exprKey;
    }

    /**
     * @return The switched expression, taken from the first case.
     */
    public Expr expr() {
        Expr expr = cases.get(0).expr;
        if (expr == null) throw new IllegalStateException("chain starts with a default case");
        return expr;
    }

    public List<Case> nonDefaultCases() {
        List<Case> ret = new ArrayList<>();
        for (Case c : cases) {
            if (!c.isDefault()) ret.add(c);
        }
        return ret;
    }

    public Set<Block> caseNodes() {
        Set<Block> nodes = new LinkedHashSet<>();
        for (Case c : cases) {
            nodes.add(c.originalNode);
        }
        return nodes;
    }

    /**
     * Whether every case of this chain is also a case of {@code other}.
     *
     * @param other The other chain.
     * @return The above.
     */
    public boolean isSubsetOf(SwitchChain other) {
        return isSubset(cases, other.cases);
    }

    static boolean isSubset(List<Case> cases, List<Case> of) {
        return cases.size() <= of.size() && of.containsAll(cases);
    }

    @Override
    public String toString() {
        return "SwitchChain" + cases;
    }
}
