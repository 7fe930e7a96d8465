package com.coinscript.script.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.coinscript.error.GenerationError;
import com.coinscript.script.parser.Declaration.TypeRef;
import com.coinscript.script.parser.Token;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;

/** Coin-level names: storage, constants and state fields. Read-only once generation starts. */
public final class SymbolTable {

    public enum Category { CURRIED, CONSTANT, STATE }

    public static final class Symbol {
        public final String name;
        public final Category category;
        public final TypeRef type;
        /** Compile-time value for curried and constant symbols. */
        public final Node value;
        /** Position in the state tuple, -1 for other categories. */
        public final int index;
        /** ALL-CAPS name the value is bound under in emitted programs. */
        public final String curriedName;

        Symbol(String name, Category category, TypeRef type, Node value, int index) {
            this.name = name;
            this.category = category;
            this.type = type;
            this.value = value;
            this.index = index;
            this.curriedName = category == Category.STATE ? null : curriedName(name);
        }
    }

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    void defineCurried(Token name, TypeRef type, Node value) {
        define(name, new Symbol(name.lexeme, Category.CURRIED, type, value, -1));
    }

    void defineConstant(Token name, TypeRef type, Node value) {
        define(name, new Symbol(name.lexeme, Category.CONSTANT, type, value, -1));
    }

    void defineState(Token name, TypeRef type, int index) {
        define(name, new Symbol(name.lexeme, Category.STATE, type, null, index));
    }

    private void define(Token token, Symbol symbol) {
        Symbol existing = symbols.get(symbol.name);
        if (existing != null) {
            throw new GenerationError(token.position(), symbol.name,
                    "'" + symbol.name + "' is already declared as " + existing.category.name().toLowerCase());
        }
        if (symbol.curriedName != null && IncludeLibrary.providerOf(symbol.curriedName) != null) {
            throw new GenerationError(token.position(), symbol.name,
                    "'" + symbol.name + "' binds " + symbol.curriedName + ", a name exported by "
                            + IncludeLibrary.providerOf(symbol.curriedName).fileName());
        }
        for (Symbol s : symbols.values()) {
            if (s.curriedName != null && s.curriedName.equals(symbol.curriedName)) {
                throw new GenerationError(token.position(), symbol.name,
                        "'" + symbol.name + "' and '" + s.name + "' both bind " + s.curriedName);
            }
        }
        symbols.put(symbol.name, symbol);
    }

    public Symbol lookup(String name) {
        return symbols.get(name);
    }

    /** Lookup restricted to non-state names; state fields are only reachable through state. */
    public Symbol lookupValue(String name) {
        Symbol s = symbols.get(name);
        return s == null || s.category == Category.STATE ? null : s;
    }

    /** Storage or constant whose compiled name is {@code curriedName}, or null. */
    public Symbol boundTo(String curriedName) {
        for (Symbol s : symbols.values()) {
            if (curriedName.equals(s.curriedName)) return s;
        }
        return null;
    }

    public Symbol stateField(String name) {
        Symbol s = symbols.get(name);
        return s != null && s.category == Category.STATE ? s : null;
    }

    public List<Symbol> ofCategory(Category category) {
        List<Symbol> out = new ArrayList<>();
        for (Symbol s : symbols.values()) {
            if (s.category == category) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }

    /** {@code minAmount} to {@code MIN_AMOUNT}. */
    public static String curriedName(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && !Character.isUpperCase(name.charAt(i - 1)) && name.charAt(i - 1) != '_') {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }
}
