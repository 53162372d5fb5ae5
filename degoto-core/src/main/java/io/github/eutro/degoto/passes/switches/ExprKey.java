package io.github.eutro.degoto.passes.switches;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The identity of a compared expression, as computed by {@link StableExprHasher}.
 * <p>
 * Two keys are equal exactly when their token sequences are, so distinct accesses never
 * share a key even if their hash codes collide.
 */
public final class ExprKey {
    private final List<Object> tokens;

    ExprKey(List<Object> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExprKey)) return false;
        return tokens.equals(((ExprKey) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "ExprKey" + tokens;
    }
}
