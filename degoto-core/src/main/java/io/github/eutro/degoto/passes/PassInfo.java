package io.github.eutro.degoto.passes;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static description of a pass, used by the pipeline to decide whether and when to run it.
 */
public final class PassInfo {
    public final String name;
    public final String description;
    public final PassStage stage;
    /**
     * Supported architectures; empty means any.
     */
    public final Set<String> arches;
    /**
     * Supported platforms; empty means any.
     */
    public final Set<String> platforms;
    /**
     * Structuring algorithms the pass relies on; empty means any.
     */
    public final Set<String> structurers;

    public PassInfo(String name, String description, PassStage stage,
                    Set<String> arches, Set<String> platforms, Set<String> structurers) {
        this.name = name;
        this.description = description;
        this.stage = stage;
        this.arches = Collections.unmodifiableSet(new LinkedHashSet<>(arches));
        this.platforms = Collections.unmodifiableSet(new LinkedHashSet<>(platforms));
        this.structurers = Collections.unmodifiableSet(new LinkedHashSet<>(structurers));
    }

    public static Set<String> setOf(String... values) {
        return new LinkedHashSet<>(Arrays.asList(values));
    }

    public boolean supports(String arch, String platform) {
        return (arches.isEmpty() || arches.contains(arch))
                && (platforms.isEmpty() || platforms.contains(platform));
    }

    @Override
    public String toString() {
        return name + " (" + stage + ")";
    }
}
