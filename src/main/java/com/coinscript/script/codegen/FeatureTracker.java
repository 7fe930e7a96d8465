package com.coinscript.script.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.coinscript.tree.IncludeLibrary;

/**
 * Names a program uses that some include library exports. Owned by one
 * {@link ProgramBuilder}; decides which includes that program gets.
 */
public final class FeatureTracker {

    private final Set<String> features = new LinkedHashSet<>();

    public FeatureTracker use(String feature) {
        features.add(feature);
        return this;
    }

    public boolean uses(String feature) {
        return features.contains(feature);
    }

    public Set<String> features() {
        return Collections.unmodifiableSet(features);
    }

    /** Libraries exporting a used name, in library declaration order. */
    public List<IncludeLibrary> requiredIncludes() {
        Set<IncludeLibrary> needed = new LinkedHashSet<>();
        for (String f : features) {
            IncludeLibrary lib = IncludeLibrary.providerOf(f);
            if (lib != null) needed.add(lib);
        }
        List<IncludeLibrary> out = new ArrayList<>();
        for (IncludeLibrary lib : IncludeLibrary.values()) {
            if (needed.contains(lib)) out.add(lib);
        }
        return out;
    }
}
