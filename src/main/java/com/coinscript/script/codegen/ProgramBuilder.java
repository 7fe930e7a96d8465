package com.coinscript.script.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.coinscript.tree.Atom;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Program;
import com.coinscript.tree.Substitution;

/**
 * Accumulates one program: parameters, includes, definitions, conditions and the body.
 * Finalized exactly once by {@link #build()} into {@code (mod params include* defs* body)}.
 *
 * <p>Curried values registered with {@link #withCurriedParam} are substituted into the
 * tree at build time and do not appear among the parameters.
 */
public final class ProgramBuilder {

    private final String name;
    private final FeatureTracker features = new FeatureTracker();
    private final Map<String, Node> bakedValues = new LinkedHashMap<>();
    private final List<String> solutionParams = new ArrayList<>();
    private String restParam;
    private final Set<String> manualIncludes = new LinkedHashSet<>();
    private final Map<String, Node> definitions = new LinkedHashMap<>();
    private final List<Node> conditions = new ArrayList<>();
    private Node returnValue;
    private final Map<Node, String> comments = new IdentityHashMap<>();
    private String pendingComment;
    private boolean built = false;

    public ProgramBuilder(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // -------------------------
    // Parameters
    // -------------------------

    /** Binds a compile-time value; every occurrence of {@code param} is replaced by {@code value}. */
    public ProgramBuilder withCurriedParam(String param, Node value) {
        checkOpen();
        bakedValues.put(param, value);
        return this;
    }

    public ProgramBuilder withSolutionParam(String param) {
        checkOpen();
        checkUnique(param);
        solutionParams.add(param);
        return this;
    }

    /** Names the dotted tail of the parameter list: {@code (a b . rest)}. */
    public ProgramBuilder withRestParam(String param) {
        checkOpen();
        if (restParam != null) throw new IllegalStateException("rest parameter already set to " + restParam);
        checkUnique(param);
        restParam = param;
        return this;
    }

    /** Solution parameters in order, then the rest parameter when set. */
    public List<String> parameterNames() {
        return restParam == null ? Collections.unmodifiableList(new ArrayList<>(solutionParams))
                : withRest(solutionParams, restParam);
    }

    private void checkUnique(String param) {
        if (solutionParams.contains(param) || param.equals(restParam)) {
            throw new IllegalArgumentException("duplicate parameter " + param);
        }
    }

    // -------------------------
    // Includes and features
    // -------------------------

    public ProgramBuilder include(String fileName) {
        checkOpen();
        manualIncludes.add(fileName);
        return this;
    }

    /** Records use of a name exported by an include library. */
    public ProgramBuilder useFeature(String feature) {
        checkOpen();
        features.use(feature);
        return this;
    }

    public FeatureTracker features() {
        return features;
    }

    // -------------------------
    // Content
    // -------------------------

    public ProgramBuilder define(String defName, Node definition) {
        checkOpen();
        if (definitions.containsKey(defName)) throw new IllegalStateException(defName + " is already defined");
        definitions.put(defName, definition);
        attachPending(definition);
        return this;
    }

    public boolean hasDefinition(String defName) {
        return definitions.containsKey(defName);
    }

    public ProgramBuilder addCondition(Node condition) {
        checkOpen();
        conditions.add(condition);
        attachPending(condition);
        return this;
    }

    /**
     * The program's result. With conditions added as well, they are consed in front of it
     * in insertion order.
     */
    public ProgramBuilder returnValue(Node body) {
        checkOpen();
        returnValue = body;
        attachPending(body);
        return this;
    }

    /** Comment for the next definition, condition or body added. */
    public ProgramBuilder comment(String text) {
        checkOpen();
        pendingComment = text;
        return this;
    }

    private void attachPending(Node node) {
        if (pendingComment != null) {
            comments.put(node, pendingComment);
            pendingComment = null;
        }
    }

    private void checkOpen() {
        if (built) throw new IllegalStateException("program " + name + " was already built");
    }

    // -------------------------
    // Finalize
    // -------------------------

    public Program build() {
        checkOpen();
        built = true;

        Substitution subst = new Substitution(bakedValues);
        Map<Node, String> finalComments = new IdentityHashMap<>();

        List<Node> params = new ArrayList<>();
        for (String p : solutionParams) params.add(Atom.symbol(p));
        Node paramSpec = restParam == null
                ? Nodes.list(params)
                : Nodes.dotted(params, Atom.symbol(restParam));

        Set<String> includes = new LinkedHashSet<>(manualIncludes);
        for (IncludeLibrary lib : features.requiredIncludes()) {
            includes.add(lib.fileName());
        }

        List<Node> items = new ArrayList<>();
        items.add(Atom.symbol("mod"));
        items.add(paramSpec);
        for (String inc : includes) {
            items.add(Nodes.form("include", Atom.symbol(inc)));
        }
        for (Node def : definitions.values()) {
            items.add(rekey(subst, def, finalComments));
        }

        List<Node> conds = new ArrayList<>(conditions.size());
        for (Node c : conditions) conds.add(rekey(subst, c, finalComments));
        Node body;
        if (returnValue == null) {
            body = conds.isEmpty() ? Atom.NIL : Nodes.form("list", conds);
        } else {
            body = rekey(subst, returnValue, finalComments);
            for (int i = conds.size() - 1; i >= 0; i--) {
                body = Nodes.form("c", conds.get(i), body);
            }
        }
        items.add(body);

        return new Program(name, Nodes.list(items), Collections.<String>emptyList(),
                restParam == null ? solutionParams : withRest(solutionParams, restParam),
                includes, finalComments, bakedValues);
    }

    private Node rekey(Substitution subst, Node node, Map<Node, String> out) {
        Node after = subst.apply(node);
        String text = comments.get(node);
        if (text != null) out.put(after, text);
        return after;
    }

    private static List<String> withRest(List<String> params, String rest) {
        List<String> out = new ArrayList<>(params);
        out.add(rest);
        return Collections.unmodifiableList(out);
    }
}
