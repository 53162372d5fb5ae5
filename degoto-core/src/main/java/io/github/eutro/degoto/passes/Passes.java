package io.github.eutro.degoto.passes;

import io.github.eutro.degoto.cfg.Function;
import io.github.eutro.degoto.oracle.StructuringOracle;
import io.github.eutro.degoto.passes.dup.CrossJumpReverter;
import io.github.eutro.degoto.passes.switches.LoweredSwitchSimplifier;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * The goto-reducing rewrites, in the order they are meant to run: cross-jump reverting, then
     * switch collapsing.
     * <p>
     * Graphs rewritten by the switch pass may hold dispatch placeholders.
     *
     * @param oracle The oracle both passes measure with.
     * @param config The configuration of both passes.
     * @return The composed pass.
     */
    public static IRPass<Function, Function> gotoReduction(StructuringOracle oracle, PassConfig config) {
        return new CrossJumpReverter(oracle, config)
                .then(new LoweredSwitchSimplifier(oracle, config));
    }

    public static IRPass<Function, Function> gotoReduction(StructuringOracle oracle) {
        return gotoReduction(oracle, PassConfig.DEFAULT);
    }
}
