package com.coinscript.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.coinscript.script.parser.SourceExpression.ExprInterface;
import com.coinscript.script.parser.Statement.Stmt;

/** Coin-level declarations. */
public class Declaration {

    /** {@code uint256}, {@code mapping(address => uint256)} or {@code T[]}. */
    public static final class TypeRef {
        public final String name;
        public final TypeRef keyType;
        public final TypeRef valueType;
        public final TypeRef elementType;

        private TypeRef(String name, TypeRef keyType, TypeRef valueType, TypeRef elementType) {
            this.name = name;
            this.keyType = keyType;
            this.valueType = valueType;
            this.elementType = elementType;
        }

        public static TypeRef simple(String name) {
            return new TypeRef(name, null, null, null);
        }

        public static TypeRef mapping(TypeRef key, TypeRef value) {
            return new TypeRef("mapping", key, value, null);
        }

        public static TypeRef array(TypeRef element) {
            return new TypeRef(element.name + "[]", null, null, element);
        }

        public boolean isMapping() { return keyType != null; }
        public boolean isArray() { return elementType != null; }
        public boolean isInteger() { return name.startsWith("uint") || name.startsWith("int"); }

        @Override
        public String toString() {
            if (isMapping()) return "mapping(" + keyType + " => " + valueType + ")";
            if (isArray()) return elementType + "[]";
            return name;
        }
    }

    public static final class Param {
        public final TypeRef type;
        public final Token name;

        public Param(TypeRef type, Token name) {
            this.type = type;
            this.name = name;
        }
    }

    /** Curried storage value, substituted into the program at compile time. */
    public static final class StorageDecl {
        public final TypeRef type;
        public final Token name;
        public final ExprInterface initializer;

        StorageDecl(TypeRef type, Token name, ExprInterface initializer) {
            this.type = type;
            this.name = name;
            this.initializer = initializer;
        }
    }

    /** One mutable field of the state tuple; position is its declaration index. */
    public static final class StateField {
        public final TypeRef type;
        public final Token name;

        StateField(TypeRef type, Token name) {
            this.type = type;
            this.name = name;
        }
    }

    public static final class ConstantDecl {
        public final TypeRef type;
        public final Token name;
        public final ExprInterface value;

        ConstantDecl(TypeRef type, Token name, ExprInterface value) {
            this.type = type;
            this.name = name;
            this.value = value;
        }
    }

    public static final class FunctionDecl {
        public final Token name;
        public final List<Param> params;
        public final TypeRef returnType;
        public final boolean inline;
        public final List<Stmt> body;

        FunctionDecl(Token name, List<Param> params, TypeRef returnType, boolean inline, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.returnType = returnType;
            this.inline = inline;
            this.body = body;
        }
    }

    public static final class ModifierDecl {
        public final Token name;
        public final List<Param> params;
        public final List<Stmt> body;

        ModifierDecl(Token name, List<Param> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }
    }

    public static final class EventDecl {
        public final Token name;
        public final List<Param> params;

        EventDecl(Token name, List<Param> params) {
            this.name = name;
            this.params = params;
        }

        /** Canonical signature {@code Name(type1,type2)}; its sha256 identifies the event. */
        public String signature() {
            StringBuilder sb = new StringBuilder(name.lexeme).append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(params.get(i).type);
            }
            return sb.append(')').toString();
        }
    }

    public static final class ActionDecl {
        public final Token name;
        public final List<Param> params;
        public final ActionDecorator decorator;
        public final List<Token> modifiers;
        public final List<Stmt> body;

        ActionDecl(Token name, List<Param> params, ActionDecorator decorator, List<Token> modifiers, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.decorator = decorator;
            this.modifiers = modifiers;
            this.body = body;
        }

        public boolean isDefault() {
            return "default".equals(name.lexeme);
        }
    }

    /** A whole coin declaration, plus the includes and decorators in front of it. */
    public static final class CoinDecl {
        public final Token name;
        public final List<String> includes = new ArrayList<>();
        /** Non-null when the coin carries {@code @singleton}; holds the optional launcher id argument. */
        public SingletonDecorator singleton;
        public final List<StorageDecl> storage = new ArrayList<>();
        public boolean hasStateBlock = false;
        public final List<StateField> stateFields = new ArrayList<>();
        public final List<ConstantDecl> constants = new ArrayList<>();
        public final List<FunctionDecl> functions = new ArrayList<>();
        public final List<ModifierDecl> modifiers = new ArrayList<>();
        public final List<EventDecl> events = new ArrayList<>();
        public final List<ActionDecl> actions = new ArrayList<>();

        CoinDecl(Token name) {
            this.name = name;
        }

        public EventDecl event(String name) {
            for (EventDecl e : events) {
                if (e.name.lexeme.equals(name)) return e;
            }
            return null;
        }

        public ModifierDecl modifier(String name) {
            for (ModifierDecl m : modifiers) {
                if (m.name.lexeme.equals(name)) return m;
            }
            return null;
        }

        public FunctionDecl function(String name) {
            for (FunctionDecl f : functions) {
                if (f.name.lexeme.equals(name)) return f;
            }
            return null;
        }

        public List<String> stateFieldNames() {
            List<String> out = new ArrayList<>();
            for (StateField f : stateFields) out.add(f.name.lexeme);
            return Collections.unmodifiableList(out);
        }
    }

    /** {@code @singleton} or {@code @singleton(launcherId)}. */
    public static final class SingletonDecorator {
        public final Token token;
        public final ExprInterface launcherId;

        SingletonDecorator(Token token, ExprInterface launcherId) {
            this.token = token;
            this.launcherId = launcherId;
        }
    }
}
