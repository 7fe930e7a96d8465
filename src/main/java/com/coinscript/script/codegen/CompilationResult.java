package com.coinscript.script.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.coinscript.layer.StateActionLayer;
import com.coinscript.layer.StateSchema;
import com.coinscript.tree.Program;

/**
 * Everything one coin compiles to. {@link #getMainProgram()} is the puzzle a coin is
 * created with; the other programs are its building blocks.
 */
public final class CompilationResult {

    private final String coinName;
    private final Program mainProgram;
    private final Program innerProgram;
    private final Program launcherProgram;
    private final Map<String, Program> actionPrograms;
    private final StateActionLayer layer;
    private final StateSchema stateSchema;
    private final byte[] launcherId;

    CompilationResult(String coinName, Program mainProgram, Program innerProgram, Program launcherProgram,
                      Map<String, Program> actionPrograms, StateActionLayer layer, StateSchema stateSchema,
                      byte[] launcherId) {
        this.coinName = coinName;
        this.mainProgram = mainProgram;
        this.innerProgram = innerProgram;
        this.launcherProgram = launcherProgram;
        this.actionPrograms = Collections.unmodifiableMap(new LinkedHashMap<>(actionPrograms));
        this.layer = layer;
        this.stateSchema = stateSchema;
        this.launcherId = launcherId == null ? null : launcherId.clone();
    }

    public String getCoinName() { return coinName; }
    public Program getMainProgram() { return mainProgram; }

    /** Program wrapped by the singleton layer; null for coins without {@code @singleton}. */
    public Program getInnerProgram() { return innerProgram; }

    public Program getLauncherProgram() { return launcherProgram; }

    /** Per-action programs of a stateful coin, in declaration order; empty otherwise. */
    public Map<String, Program> getActionPrograms() { return actionPrograms; }

    public StateActionLayer getLayer() { return layer; }
    public StateSchema getStateSchema() { return stateSchema; }

    public byte[] getLauncherId() {
        return launcherId == null ? null : launcherId.clone();
    }

    public boolean isStateful() {
        return layer != null;
    }

    public boolean isSingleton() {
        return launcherProgram != null;
    }

    /** Main program first, then inner, launcher, layer template and actions. */
    public List<Program> allPrograms() {
        List<Program> out = new ArrayList<>();
        out.add(mainProgram);
        if (innerProgram != null) out.add(innerProgram);
        if (launcherProgram != null) out.add(launcherProgram);
        if (layer != null) out.add(layer.getTemplate());
        out.addAll(actionPrograms.values());
        return out;
    }
}
