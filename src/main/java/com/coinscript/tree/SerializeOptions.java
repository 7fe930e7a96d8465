package com.coinscript.tree;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Rendering switches for {@link Serializer}. The defaults render every atom
 * faithfully on one line, so the output parses back to an equal tree.
 */
public final class SerializeOptions {

    private boolean indent = false;
    private String indentUnit = "  ";
    private boolean keywords = false;
    private final Set<String> includes = new LinkedHashSet<>();
    private final Map<Node, String> comments = new IdentityHashMap<>();

    public static SerializeOptions defaults() {
        return new SerializeOptions();
    }

    public static SerializeOptions pretty() {
        return new SerializeOptions().setIndent(true);
    }

    public SerializeOptions setIndent(boolean indent) {
        this.indent = indent;
        return this;
    }

    public SerializeOptions setIndentUnit(String indentUnit) {
        this.indentUnit = indentUnit == null ? "  " : indentUnit;
        return this;
    }

    /** Render integer opcodes in operator position as their keywords: 2 as a, 1 as q. */
    public SerializeOptions setKeywords(boolean keywords) {
        this.keywords = keywords;
        return this;
    }

    /**
     * Libraries considered included when rendering. condition_codes.clib turns
     * numeric condition codes into names; opcodes.clib turns numeric operators into
     * constant names and takes precedence over keyword rendering.
     */
    public SerializeOptions setIncludes(Set<String> includes) {
        this.includes.clear();
        if (includes != null) this.includes.addAll(includes);
        return this;
    }

    /** Attaches a comment to one node instance; comments are only rendered when indenting. */
    public SerializeOptions comment(Node node, String text) {
        comments.put(node, text);
        return this;
    }

    public SerializeOptions setComments(Map<Node, String> comments) {
        this.comments.clear();
        if (comments != null) this.comments.putAll(comments);
        return this;
    }

    public boolean isIndent() { return indent; }
    public String getIndentUnit() { return indentUnit; }
    public boolean isKeywords() { return keywords; }
    public Set<String> getIncludes() { return Collections.unmodifiableSet(includes); }
    Map<Node, String> comments() { return comments; }
}
