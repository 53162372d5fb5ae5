package io.github.eutro.degoto.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * A container for {@link Ext}s. See the {@link io.github.eutro.degoto.ext package-level documentation} for more info.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value the ext has in this container.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Disassociate the value of {@code ext} (if any) in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value associated with {@code ext} in this container, or null if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with ext in this container.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get every ext attached to this container, in ext order.
     *
     * @return A read-only view of the attached exts.
     */
    Map<Ext<?>, Object> getExts();

    /**
     * Get the value associated with {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @see #getNullable(Ext)
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value associated with {@code ext} in this container, or throw an exception if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @see #getNullable(Ext)
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext);
    }

    /**
     * Copy every ext of {@code other} into this container, overwriting existing associations.
     *
     * @param other The container to copy from.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    default void copyExtsFrom(ExtContainer other) {
        for (Map.Entry<Ext<?>, Object> entry : other.getExts().entrySet()) {
            attachExt((Ext) entry.getKey(), entry.getValue());
        }
    }
}
