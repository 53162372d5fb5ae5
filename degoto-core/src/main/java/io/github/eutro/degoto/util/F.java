package io.github.eutro.degoto.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, but doesn't collide with
 * {@link io.github.eutro.degoto.cfg.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
