/**
 * Exts: typed, optional metadata attached to IR objects.
 * <p>
 * An {@link io.github.eutro.degoto.ext.Ext} is a key; an {@link io.github.eutro.degoto.ext.ExtContainer}
 * maps keys to values. Passes use exts to remember provenance (which block a duplicate came from,
 * which instruction a statement was lifted from) without widening the IR classes themselves.
 * Exts never take part in equality.
 */
package io.github.eutro.degoto.ext;
