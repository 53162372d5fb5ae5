package io.github.eutro.degoto.passes;

import java.util.Properties;

/**
 * Settings shared by the goto-reducing passes.
 * <p>
 * Use {@link #builder()} to construct one, or {@link #fromProperties(Properties)} to read one
 * from {@code degoto.*} properties. Every setting has a default.
 */
public final class PassConfig {
    public static final String PREFIX = "degoto.";

    public static final PassConfig DEFAULT = builder().build();

    /**
     * The maximum number of duplication rounds of the cross-jump reverter.
     */
    public final int maxLevel;
    /**
     * The in-degree from which a block counts as shared. Informational.
     */
    public final int minIndegree;
    /**
     * How deep goto-driven re-evaluation may go. Informational.
     */
    public final int maxLevelGotoCheck;
    /**
     * The first index given to duplicated blocks.
     */
    public final int nodeIndexStart;

    private PassConfig(Builder builder) {
        this.maxLevel = builder.maxLevel;
        this.minIndegree = builder.minIndegree;
        this.maxLevelGotoCheck = builder.maxLevelGotoCheck;
        this.nodeIndexStart = builder.nodeIndexStart;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .setMaxLevel(maxLevel)
                .setMinIndegree(minIndegree)
                .setMaxLevelGotoCheck(maxLevelGotoCheck)
                .setNodeIndexStart(nodeIndexStart);
    }

    /**
     * Read a config from {@code degoto.maxLevel}, {@code degoto.minIndegree},
     * {@code degoto.maxLevelGotoCheck} and {@code degoto.nodeIndexStart}.
     * Missing properties keep their defaults.
     *
     * @param props The properties.
     * @return The config.
     * @throws IllegalArgumentException If a property is not a valid integer, or out of range.
     */
    public static PassConfig fromProperties(Properties props) {
        Builder builder = builder();
        builder.setMaxLevel(readInt(props, "maxLevel", builder.maxLevel));
        builder.setMinIndegree(readInt(props, "minIndegree", builder.minIndegree));
        builder.setMaxLevelGotoCheck(readInt(props, "maxLevelGotoCheck", builder.maxLevelGotoCheck));
        builder.setNodeIndexStart(readInt(props, "nodeIndexStart", builder.nodeIndexStart));
        return builder.build();
    }

    public static PassConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int readInt(Properties props, String key, int dflt) {
        String value = props.getProperty(PREFIX + key);
        if (value == null) return dflt;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "PassConfig{" +
                "maxLevel=" + maxLevel +
                ", minIndegree=" + minIndegree +
                ", maxLevelGotoCheck=" + maxLevelGotoCheck +
                ", nodeIndexStart=" + nodeIndexStart +
                '}';
    }

    public static class Builder {
        private int maxLevel = 10;
        private int minIndegree = 2;
        private int maxLevelGotoCheck = 2;
        private int nodeIndexStart = 0;

        public Builder setMaxLevel(int maxLevel) {
            this.maxLevel = atLeast("maxLevel", maxLevel, 1);
            return this;
        }

        public Builder setMinIndegree(int minIndegree) {
            this.minIndegree = atLeast("minIndegree", minIndegree, 1);
            return this;
        }

        public Builder setMaxLevelGotoCheck(int maxLevelGotoCheck) {
            this.maxLevelGotoCheck = atLeast("maxLevelGotoCheck", maxLevelGotoCheck, 0);
            return this;
        }

        public Builder setNodeIndexStart(int nodeIndexStart) {
            this.nodeIndexStart = atLeast("nodeIndexStart", nodeIndexStart, 0);
            return this;
        }

        private static int atLeast(String name, int value, int min) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be at least " + min + ", got " + value);
            }
            return value;
        }

        public PassConfig build() {
            return new PassConfig(this);
        }
    }
}
