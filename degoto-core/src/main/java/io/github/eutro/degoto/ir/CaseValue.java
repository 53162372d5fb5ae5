package io.github.eutro.degoto.ir;

/**
 * The value a switch case matches: either a constant, or {@link #DEFAULT}.
 */
public final class CaseValue {
    public static final CaseValue DEFAULT = new CaseValue(0, true);

    private final long value;
    private final boolean isDefault;

    private CaseValue(long value, boolean isDefault) {
        this.value = value;
        this.isDefault = isDefault;
    }

    public static CaseValue of(long value) {
        return new CaseValue(value, false);
    }

    public boolean isDefault() {
        return isDefault;
    }

    /**
     * @return The matched constant.
     * @throws IllegalStateException If this is the default case.
     */
    public long value() {
        if (isDefault) throw new IllegalStateException("default case has no value");
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseValue)) return false;
        CaseValue that = (CaseValue) o;
        return isDefault == that.isDefault && value == that.value;
    }

    @Override
    public int hashCode() {
        return isDefault ? -1 : Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isDefault ? "default" : Long.toString(value);
    }
}
