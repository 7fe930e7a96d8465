package com.coinscript.script.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.coinscript.debug.Debug;
import com.coinscript.error.GenerationError;
import com.coinscript.layer.SingletonLayer;
import com.coinscript.layer.StateActionLayer;
import com.coinscript.layer.StateSchema;
import com.coinscript.script.parser.ActionDecorator;
import com.coinscript.script.parser.Declaration.ActionDecl;
import com.coinscript.script.parser.Declaration.CoinDecl;
import com.coinscript.script.parser.Declaration.ConstantDecl;
import com.coinscript.script.parser.Declaration.EventDecl;
import com.coinscript.script.parser.Declaration.FunctionDecl;
import com.coinscript.script.parser.Declaration.ModifierDecl;
import com.coinscript.script.parser.Declaration.Param;
import com.coinscript.script.parser.Declaration.StateField;
import com.coinscript.script.parser.Declaration.StorageDecl;
import com.coinscript.script.parser.SourceExpression.Binary;
import com.coinscript.script.parser.SourceExpression.Call;
import com.coinscript.script.parser.SourceExpression.ExprInterface;
import com.coinscript.script.parser.SourceExpression.ExprVisitor;
import com.coinscript.script.parser.SourceExpression.Identifier;
import com.coinscript.script.parser.SourceExpression.Index;
import com.coinscript.script.parser.SourceExpression.Literal;
import com.coinscript.script.parser.SourceExpression.Member;
import com.coinscript.script.parser.SourceExpression.Unary;
import com.coinscript.script.parser.Statement;
import com.coinscript.script.parser.Statement.Stmt;
import com.coinscript.script.parser.Statement.StmtVisitor;
import com.coinscript.script.parser.Token;
import com.coinscript.tree.Atom;
import com.coinscript.tree.AtomKind;
import com.coinscript.tree.ConditionCode;
import com.coinscript.tree.Converters;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.Opcode;
import com.coinscript.tree.Program;

/**
 * Lowers a parsed coin into programs.
 *
 * <p>Coins without {@code @stateful} actions compile into one routed program: with a
 * single {@code default} action its parameters are the solution directly, otherwise the
 * solution is {@code (selector . action_args)} and the body is an equality chain over
 * the action names ending in failure (or in the {@code default} action). Coins with a
 * {@code @stateful} action compile every action into its own program and wrap them in a
 * {@link StateActionLayer}. {@code @singleton} wraps the result in a {@link SingletonLayer}.
 */
public final class CodeGenerator {

    private static final String TAG = "CodeGenerator";

    private final CompilerOptions options;

    public CodeGenerator() {
        this(new CompilerOptions());
    }

    public CodeGenerator(CompilerOptions options) {
        this.options = options;
    }

    public CompilationResult generate(CoinDecl coin) {
        String coinName = coin.name.lexeme;
        validate(coin);
        SymbolTable symbols = buildSymbols(coin);
        checkBindings(coin, symbols);

        boolean layered = false;
        for (ActionDecl a : coin.actions) {
            if (a.decorator.accept(STATEFUL)) {
                if (!coin.hasStateBlock) {
                    throw new GenerationError(a.name.position(), a.name.lexeme,
                            "@stateful action '" + a.name.lexeme + "' needs a state block in coin '" + coinName + "'");
                }
                layered = true;
            }
        }
        if (layered && coin.singleton != null) {
            // the finalizer recreates the bare layer, which would drop the singleton wrapper
            throw new GenerationError(coin.singleton.token.position(), "singleton",
                    "@singleton coin '" + coinName + "' cannot have @stateful actions");
        }

        Program main;
        Map<String, Program> actionPrograms = new LinkedHashMap<>();
        StateActionLayer layer = null;
        StateSchema schema = null;
        if (layered) {
            schema = schemaOf(coin);
            for (ActionDecl action : coin.actions) {
                actionPrograms.put(action.name.lexeme, layerAction(coin, symbols, action));
            }
            layer = new StateActionLayer(coinName, schema, actionPrograms);
            main = new Program(coinName, layer.programFor(schema.defaults()));
            Debug.get().d(TAG, coinName + ": " + actionPrograms.size() + " layer actions");
        } else {
            main = routedProgram(coin, symbols);
        }

        Program inner = null;
        Program launcher = null;
        byte[] launcherId = null;
        if (coin.singleton != null) {
            launcherId = launcherId(coin, symbols);
            inner = rename(main, coinName + "_inner");
            main = new Program(coinName, SingletonLayer.wrap(inner.getTree(), launcherId));
            launcher = SingletonLayer.launcher();
            Debug.get().d(TAG, coinName + ": singleton launcher id " + Converters.toHex(launcherId));
        }

        Debug.get().i(TAG, coinName + " compiled, puzzle hash " + main.hashHex());
        return new CompilationResult(coinName, main, inner, launcher, actionPrograms, layer, schema, launcherId);
    }

    // -------------------------
    // Declarations
    // -------------------------

    private void validate(CoinDecl coin) {
        if (coin.actions.isEmpty()) {
            throw new GenerationError(coin.name.position(), coin.name.lexeme,
                    "Coin '" + coin.name.lexeme + "' declares no actions");
        }
        Set<String> seen = new HashSet<>();
        for (ActionDecl a : coin.actions) {
            if (!seen.add(a.name.lexeme)) {
                throw new GenerationError(a.name.position(), a.name.lexeme, "Duplicate action '" + a.name.lexeme + "'");
            }
            checkParams(a.params);
        }
        seen.clear();
        for (FunctionDecl f : coin.functions) {
            String n = f.name.lexeme;
            if (!seen.add(n)) {
                throw new GenerationError(f.name.position(), n, "Duplicate function '" + n + "'");
            }
            if (Opcode.byKeyword(n) != null || BodyLowering.isExpressionBuiltin(n)
                    || IncludeLibrary.providerOf(n) != null || n.equals("map-get") || n.equals("map-set")) {
                throw new GenerationError(f.name.position(), n, "Function name '" + n + "' is a builtin");
            }
            checkParams(f.params);
        }
        seen.clear();
        for (ModifierDecl m : coin.modifiers) {
            if (!seen.add(m.name.lexeme)) {
                throw new GenerationError(m.name.position(), m.name.lexeme, "Duplicate modifier '" + m.name.lexeme + "'");
            }
        }
        seen.clear();
        for (EventDecl e : coin.events) {
            if (!seen.add(e.name.lexeme)) {
                throw new GenerationError(e.name.position(), e.name.lexeme, "Duplicate event '" + e.name.lexeme + "'");
            }
        }
    }

    private static void checkParams(List<Param> params) {
        Set<String> names = new HashSet<>();
        for (Param p : params) {
            BodyLowering.checkName(p.name);
            if (!names.add(p.name.lexeme)) {
                throw new GenerationError(p.name.position(), p.name.lexeme, "Duplicate parameter '" + p.name.lexeme + "'");
            }
        }
    }

    /** Parameters and function names must not be spelled like a baked storage or constant name. */
    private static void checkBindings(CoinDecl coin, SymbolTable symbols) {
        for (ActionDecl a : coin.actions) {
            for (Param p : a.params) BodyLowering.checkBinding(p.name, symbols);
        }
        for (FunctionDecl f : coin.functions) {
            BodyLowering.checkBinding(f.name, symbols);
            for (Param p : f.params) BodyLowering.checkBinding(p.name, symbols);
        }
    }

    private SymbolTable buildSymbols(CoinDecl coin) {
        SymbolTable symbols = new SymbolTable();
        BodyLowering values = new BodyLowering(coin, symbols, options, new ProgramBuilder(coin.name.lexeme + "_values"));
        // constants first: storage initializers may refer to them
        for (ConstantDecl c : coin.constants) {
            BodyLowering.checkName(c.name);
            symbols.defineConstant(c.name, c.type, values.constant(c.value));
        }
        for (StorageDecl s : coin.storage) {
            BodyLowering.checkName(s.name);
            symbols.defineCurried(s.name, s.type, values.constant(s.initializer));
        }
        int index = 0;
        for (StateField f : coin.stateFields) {
            BodyLowering.checkName(f.name);
            symbols.defineState(f.name, f.type, index++);
        }
        return symbols;
    }

    private static StateSchema schemaOf(CoinDecl coin) {
        List<StateSchema.Field> fields = new ArrayList<>();
        for (StateField f : coin.stateFields) {
            fields.add(new StateSchema.Field(f.name.lexeme, f.type.toString()));
        }
        return new StateSchema(fields);
    }

    private byte[] launcherId(CoinDecl coin, SymbolTable symbols) {
        if (options.getLauncherId() != null) {
            return Converters.requireLength(Converters.hexToBytes(options.getLauncherId()), 32, "launcher id");
        }
        ExprInterface declared = coin.singleton.launcherId;
        if (declared == null) return SingletonLayer.defaultLauncherId(coin.name.lexeme);
        BodyLowering values = new BodyLowering(coin, symbols, options, new ProgramBuilder(coin.name.lexeme + "_values"));
        Node value = values.constant(declared);
        if (value instanceof Atom && ((Atom) value).getKind() == AtomKind.BYTES && ((Atom) value).length() == 32) {
            return ((Atom) value).getBytes();
        }
        throw new GenerationError(coin.singleton.token.position(), "singleton",
                "@singleton launcher id must be a 32-byte value, got " + value);
    }

    private static Program rename(Program p, String name) {
        return new Program(name, p.getTree(), p.getCurriedParams(), p.getSolutionParams(), p.getIncludes(),
                p.getComments(), p.getBakedValues());
    }

    // -------------------------
    // Routed program
    // -------------------------

    private Program routedProgram(CoinDecl coin, SymbolTable symbols) {
        ProgramBuilder builder = new ProgramBuilder(coin.name.lexeme);
        for (String inc : coin.includes) builder.include(inc);
        BodyLowering lowering = new BodyLowering(coin, symbols, options, builder);

        Node myAmount = null;
        if (options.isConservationCheck()) {
            builder.withSolutionParam("my_amount");
            myAmount = Atom.symbol("my_amount");
        }

        Node body;
        String mode;
        if (coin.actions.size() == 1 && coin.actions.get(0).isDefault()) {
            ActionDecl action = coin.actions.get(0);
            Node sender = null;
            if (usesSender(coin, action)) {
                builder.withSolutionParam("sender");
                sender = Atom.symbol("sender");
            }
            Map<String, Node> params = new LinkedHashMap<>();
            for (Param p : action.params) {
                builder.withSolutionParam(p.name.lexeme);
                params.put(p.name.lexeme, Atom.symbol(p.name.lexeme));
            }
            body = lowerPlain(lowering, action, params, sender, myAmount);
            mode = "direct";
        } else {
            builder.withSolutionParam("selector");
            builder.withRestParam("action_args");
            Node selector = Atom.symbol("selector");
            ActionDecl fallback = null;
            for (ActionDecl a : coin.actions) {
                if (a.isDefault()) fallback = a;
            }
            body = fallback == null
                    ? Nodes.form("x", Atom.string("Unknown action"))
                    : lowerPositional(lowering, coin, fallback, myAmount);
            List<String> names = new ArrayList<>();
            for (int i = coin.actions.size() - 1; i >= 0; i--) {
                ActionDecl a = coin.actions.get(i);
                if (a.isDefault()) continue;
                names.add(0, a.name.lexeme);
                body = Nodes.form("if", Nodes.form("=", selector, Atom.string(a.name.lexeme)),
                        lowerPositional(lowering, coin, a, myAmount), body);
            }
            mode = "selector over " + names + (fallback == null ? "" : " with default");
        }

        if (myAmount != null) {
            builder.useFeature(ConditionCode.ASSERT_MY_AMOUNT.name());
            builder.addCondition(Nodes.form("list", Atom.symbol(ConditionCode.ASSERT_MY_AMOUNT.name()), myAmount));
        }
        builder.comment(coin.actions.size() == 1 ? "action " + coin.actions.get(0).name.lexeme : "action router");
        builder.returnValue(body);
        Program program = builder.build();
        Debug.get().d(TAG, coin.name.lexeme + ": routing " + mode + ", includes " + program.getIncludes());
        return program;
    }

    /** Action parameters read from {@code action_args}, after an implicit sender when one is used. */
    private Node lowerPositional(BodyLowering lowering, CoinDecl coin, ActionDecl action, Node myAmount) {
        Node args = Atom.symbol("action_args");
        int offset = 0;
        Node sender = null;
        if (usesSender(coin, action)) {
            sender = StateSchema.accessor(args, 0);
            offset = 1;
        }
        Map<String, Node> params = new LinkedHashMap<>();
        for (int i = 0; i < action.params.size(); i++) {
            params.put(action.params.get(i).name.lexeme, StateSchema.accessor(args, i + offset));
        }
        return lowerPlain(lowering, action, params, sender, myAmount);
    }

    private Node lowerPlain(BodyLowering lowering, ActionDecl action, Map<String, Node> params, Node sender,
                            Node myAmount) {
        BodyLowering.Scope scope = new BodyLowering.Scope(action.name.lexeme, params, false, true, sender);
        BodyLowering.Terminal terminal = (st, returned) -> {
            Node result = lowering.conditionList(st, returned);
            if (myAmount != null && st.sendTotal != null) {
                result = Nodes.form("if", Nodes.form(">", st.sendTotal, myAmount),
                        Nodes.form("x", Atom.string("Sends exceed coin amount")), result);
            }
            return result;
        };
        return lowering.lowerAction(action, scope, identitiesOf(action), lowering.initialState(null), terminal);
    }

    // -------------------------
    // Layer actions
    // -------------------------

    private Program layerAction(CoinDecl coin, SymbolTable symbols, ActionDecl action) {
        String name = action.name.lexeme;
        ProgramBuilder builder = new ProgramBuilder(coin.name.lexeme + "_" + name);
        for (String inc : coin.includes) builder.include(inc);
        builder.withSolutionParam("current_state");
        builder.withRestParam("action_args");
        BodyLowering lowering = new BodyLowering(coin, symbols, options, builder);

        Node currentState = Atom.symbol("current_state");
        Node args = Atom.symbol("action_args");
        int offset = 0;
        Node sender = null;
        if (usesSender(coin, action)) {
            sender = StateSchema.accessor(args, 0);
            offset = 1;
        }
        Map<String, Node> params = new LinkedHashMap<>();
        for (int i = 0; i < action.params.size(); i++) {
            params.put(action.params.get(i).name.lexeme, StateSchema.accessor(args, i + offset));
        }

        boolean stateful = action.decorator.accept(STATEFUL);
        BodyLowering.Scope scope = new BodyLowering.Scope(name, params, stateful, true, sender);
        BodyLowering.Terminal terminal = (st, returned) -> {
            Node state = currentState;
            if (st.stateChanged) state = Nodes.form("list", new ArrayList<>(st.state.values()));
            return Nodes.form("c", state, lowering.conditionList(st, returned));
        };
        Node body = lowering.lowerAction(action, scope, identitiesOf(action),
                lowering.initialState(stateful ? currentState : null), terminal);
        builder.comment((stateful ? "stateful action " : "action ") + name);
        builder.returnValue(body);
        Program program = builder.build();
        Debug.get().d(TAG, program.getName() + " hash " + program.hashHex());
        return program;
    }

    // -------------------------
    // Decorators
    // -------------------------

    private static final ActionDecorator.Visitor<Boolean> STATEFUL = new ActionDecorator.Visitor<Boolean>() {
        @Override public Boolean visitPlain(ActionDecorator.Plain d) { return false; }
        @Override public Boolean visitAccessRestricted(ActionDecorator.AccessRestricted d) { return false; }
        @Override public Boolean visitStateful(ActionDecorator.Stateful d) { return true; }
    };

    private static final ActionDecorator.Visitor<List<ExprInterface>> IDENTITIES =
            new ActionDecorator.Visitor<List<ExprInterface>>() {
        @Override public List<ExprInterface> visitPlain(ActionDecorator.Plain d) { return Collections.emptyList(); }
        @Override public List<ExprInterface> visitAccessRestricted(ActionDecorator.AccessRestricted d) { return d.identities; }
        @Override public List<ExprInterface> visitStateful(ActionDecorator.Stateful d) { return Collections.emptyList(); }
    };

    private static List<ExprInterface> identitiesOf(ActionDecl action) {
        return action.decorator.accept(IDENTITIES);
    }

    /** True when the action's solution must carry the sender: restricted, or reads msg.sender. */
    private static boolean usesSender(CoinDecl coin, ActionDecl action) {
        if (!identitiesOf(action).isEmpty()) return true;
        SenderScan scan = new SenderScan();
        if (scan.any(action.body)) return true;
        for (Token m : action.modifiers) {
            ModifierDecl decl = coin.modifier(m.lexeme);
            if (decl != null && scan.any(decl.body)) return true;
        }
        return false;
    }

    /** Finds {@code msg.sender} anywhere in a block. */
    private static final class SenderScan implements StmtVisitor<Boolean>, ExprVisitor<Boolean> {

        boolean any(List<Stmt> stmts) {
            for (Stmt s : stmts) {
                if (s.accept(this)) return true;
            }
            return false;
        }

        private boolean any(ExprInterface... exprs) {
            for (ExprInterface e : exprs) {
                if (e != null && e.accept(this)) return true;
            }
            return false;
        }

        private boolean anyOf(List<ExprInterface> exprs) {
            return any(exprs.toArray(new ExprInterface[0]));
        }

        @Override public Boolean visitVarStmt(Statement.VarStmt s) { return any(s.initializer); }
        @Override public Boolean visitAssignStmt(Statement.AssignStmt s) { return any(s.target, s.value); }
        @Override public Boolean visitIfStmt(Statement.If s) {
            return any(s.condition) || any(s.thenBranch) || any(s.elseBranch);
        }
        @Override public Boolean visitRequireStmt(Statement.RequireStmt s) { return any(s.condition, s.message); }
        @Override public Boolean visitExceptionStmt(Statement.ExceptionStmt s) { return any(s.message); }
        @Override public Boolean visitEmitStmt(Statement.EmitStmt s) { return anyOf(s.arguments); }
        @Override public Boolean visitSendStmt(Statement.SendStmt s) { return any(s.recipient, s.amount, s.memo); }
        @Override public Boolean visitReturnStmt(Statement.ReturnStmt s) { return any(s.value); }
        @Override public Boolean visitExprStmt(Statement.ExprStmt s) { return any(s.expression); }
        @Override public Boolean visitPlaceholderStmt(Statement.PlaceholderStmt s) { return false; }

        @Override public Boolean visitBinaryExpr(Binary e) { return any(e.left, e.right); }
        @Override public Boolean visitUnaryExpr(Unary e) { return any(e.right); }
        @Override public Boolean visitLiteralExpr(Literal e) { return false; }
        @Override public Boolean visitIdentifierExpr(Identifier e) { return false; }
        @Override public Boolean visitMemberExpr(Member e) {
            if (e.object instanceof Identifier && ((Identifier) e.object).name.lexeme.equals("msg")
                    && e.name.lexeme.equals("sender")) {
                return true;
            }
            return any(e.object);
        }
        @Override public Boolean visitIndexExpr(Index e) { return any(e.target, e.index); }
        @Override public Boolean visitCallExpr(Call e) { return any(e.callee) || anyOf(e.arguments); }
    }
}
