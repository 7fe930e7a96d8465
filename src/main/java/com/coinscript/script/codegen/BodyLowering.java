package com.coinscript.script.codegen;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.coinscript.error.ExpressionTooDeepError;
import com.coinscript.error.GenerationError;
import com.coinscript.layer.StateSchema;
import com.coinscript.script.parser.Declaration.ActionDecl;
import com.coinscript.script.parser.Declaration.CoinDecl;
import com.coinscript.script.parser.Declaration.EventDecl;
import com.coinscript.script.parser.Declaration.FunctionDecl;
import com.coinscript.script.parser.Declaration.ModifierDecl;
import com.coinscript.script.parser.Declaration.Param;
import com.coinscript.script.parser.SourceExpression.Binary;
import com.coinscript.script.parser.SourceExpression.Call;
import com.coinscript.script.parser.SourceExpression.ExprInterface;
import com.coinscript.script.parser.SourceExpression.ExprVisitor;
import com.coinscript.script.parser.SourceExpression.HexLiteral;
import com.coinscript.script.parser.SourceExpression.Identifier;
import com.coinscript.script.parser.SourceExpression.Index;
import com.coinscript.script.parser.SourceExpression.Literal;
import com.coinscript.script.parser.SourceExpression.Member;
import com.coinscript.script.parser.SourceExpression.Unary;
import com.coinscript.script.parser.Statement;
import com.coinscript.script.parser.Statement.Stmt;
import com.coinscript.script.parser.Statement.StmtVisitor;
import com.coinscript.script.parser.Token;
import com.coinscript.script.parser.TokenType;
import com.coinscript.tree.Atom;
import com.coinscript.tree.Bech32m;
import com.coinscript.tree.ConditionCode;
import com.coinscript.tree.IncludeLibrary;
import com.coinscript.tree.Node;
import com.coinscript.tree.Nodes;
import com.coinscript.tree.TreeHash;
import com.coinscript.tree.TreeParser;

/**
 * Lowers statement blocks of one program into a single expression tree.
 *
 * <p>Lowering is continuation-passing: each statement receives the rest of its path and
 * the per-path accumulator ({@link PathState}), and every path ends in a {@link Terminal}.
 * When only one branch of an {@code if} can reach the following statements they are
 * lowered into that branch. When both can, the following statements are lowered once
 * into a join function that both branches call with their locals, state values,
 * conditions and send total. Locals declared inside a branch end with it.
 */
final class BodyLowering {

    /** Names the generator puts into parameter lists itself. */
    static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "selector", "action_args", "my_amount", "sender", "current_state", "msg", "state")));

    private static final Map<String, ConditionBuiltin> CONDITION_BUILTINS = new HashMap<>();
    private static final Map<String, String> EXPRESSION_BUILTINS = new HashMap<>();

    static {
        condition("requireSignature", ConditionCode.AGG_SIG_ME, 1, 2);
        condition("requireSignatureUnsafe", ConditionCode.AGG_SIG_UNSAFE, 2, 2);
        condition("reserveFee", ConditionCode.RESERVE_FEE, 1, 1);
        condition("createAnnouncement", ConditionCode.CREATE_COIN_ANNOUNCEMENT, 1, 1);
        condition("assertAnnouncement", ConditionCode.ASSERT_COIN_ANNOUNCEMENT, 1, 1);
        condition("createPuzzleAnnouncement", ConditionCode.CREATE_PUZZLE_ANNOUNCEMENT, 1, 1);
        condition("assertPuzzleAnnouncement", ConditionCode.ASSERT_PUZZLE_ANNOUNCEMENT, 1, 1);
        condition("assertMyCoinId", ConditionCode.ASSERT_MY_COIN_ID, 1, 1);
        condition("assertMyParentId", ConditionCode.ASSERT_MY_PARENT_ID, 1, 1);
        condition("assertMyPuzzleHash", ConditionCode.ASSERT_MY_PUZZLEHASH, 1, 1);
        condition("assertMyAmount", ConditionCode.ASSERT_MY_AMOUNT, 1, 1);
        condition("assertSecondsRelative", ConditionCode.ASSERT_SECONDS_RELATIVE, 1, 1);
        condition("assertSecondsAbsolute", ConditionCode.ASSERT_SECONDS_ABSOLUTE, 1, 1);
        condition("assertHeightRelative", ConditionCode.ASSERT_HEIGHT_RELATIVE, 1, 1);
        condition("assertHeightAbsolute", ConditionCode.ASSERT_HEIGHT_ABSOLUTE, 1, 1);
        condition("remark", ConditionCode.REMARK, 0, Integer.MAX_VALUE);

        for (String op : Arrays.asList("sha256", "keccak256", "coinid", "concat", "strlen", "substr",
                "pubkey_for_exp", "point_add", "g1_subtract", "g1_multiply", "g1_negate", "bls_verify",
                "secp256k1_verify", "secp256r1_verify", "divmod", "modpow")) {
            EXPRESSION_BUILTINS.put(op, op);
        }
        EXPRESSION_BUILTINS.put("g1_add", "point_add");
    }

    private static final class ConditionBuiltin {
        final ConditionCode code;
        final int minArgs;
        final int maxArgs;

        ConditionBuiltin(ConditionCode code, int minArgs, int maxArgs) {
            this.code = code;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }
    }

    private static void condition(String name, ConditionCode code, int min, int max) {
        CONDITION_BUILTINS.put(name, new ConditionBuiltin(code, min, max));
    }

    static boolean isConditionBuiltin(String name) {
        return CONDITION_BUILTINS.containsKey(name);
    }

    static boolean isExpressionBuiltin(String name) {
        return EXPRESSION_BUILTINS.containsKey(name);
    }

    private static final Node MAP_GET = TreeParser.parse(
            "(defun map-get (entries key) (if entries (if (= (f (f entries)) key) (r (f entries)) "
                    + "(map-get (r entries) key)) ()))");
    private static final Node MAP_SET = TreeParser.parse(
            "(defun map-set (entries key value) (if entries (if (= (f (f entries)) key) "
                    + "(c (c key value) (r entries)) (c (f entries) (map-set (r entries) key value))) "
                    + "(list (c key value))))");
    private static final Node MERGE_LIST = TreeParser.parse(
            "(defun merge-list (a b) (if a (c (f a) (merge-list (r a) b)) b))");

    // -------------------------
    // Scopes, paths, terminals
    // -------------------------

    /** What the lowered code of one action or function may see. */
    static final class Scope {
        final String owner;
        final Map<String, Node> params;
        final boolean stateful;
        final boolean conditions;
        /** Node reading msg.sender, or null when unavailable. */
        final Node sender;

        Scope(String owner, Map<String, Node> params, boolean stateful, boolean conditions, Node sender) {
            this.owner = owner;
            this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
            this.stateful = stateful;
            this.conditions = conditions;
            this.sender = sender;
        }
    }

    /** Accumulator of one execution path. */
    static final class PathState {
        final Map<String, Node> locals;
        final Map<String, Node> state;
        final List<Node> conditions;
        /** Runtime list of the conditions emitted before a join, or null. */
        Node conditionPrefix;
        Node sendTotal;
        boolean stateChanged;

        PathState() {
            this(new HashMap<>(), new LinkedHashMap<>(), new ArrayList<>(), null, false);
        }

        private PathState(Map<String, Node> locals, Map<String, Node> state, List<Node> conditions,
                          Node sendTotal, boolean stateChanged) {
            this.locals = locals;
            this.state = state;
            this.conditions = conditions;
            this.sendTotal = sendTotal;
            this.stateChanged = stateChanged;
        }

        PathState copy() {
            PathState copy = new PathState(new HashMap<>(locals), new LinkedHashMap<>(state),
                    new ArrayList<>(conditions), sendTotal, stateChanged);
            copy.conditionPrefix = conditionPrefix;
            return copy;
        }
    }

    /** Produces the value of a path that ran to its end or hit {@code return}. */
    interface Terminal {
        Node finish(PathState state, Node returned);
    }

    /** Statements of a body, plus the body a modifier's {@code _;} stands for. */
    private static final class Body {
        final List<Stmt> stmts;
        final Body inner;

        Body(List<Stmt> stmts, Body inner) {
            this.stmts = stmts;
            this.inner = inner;
        }
    }

    private static final class Rest {
        final List<Stmt> stmts;
        final int index;
        final Body body;
        final Rest next;
        /** Locals that stay visible when a branch rejoins, or null. */
        final Set<String> visible;
        /** Join the path calls when it gets here, or null. */
        final Run.Join join;

        Rest(List<Stmt> stmts, int index, Body body, Rest next) {
            this(stmts, index, body, next, null, null);
        }

        Rest(Set<String> visible, Rest next) {
            this(Collections.<Stmt>emptyList(), 0, null, next, visible, null);
        }

        Rest(Run.Join join) {
            this(Collections.<Stmt>emptyList(), 0, null, null, null, join);
        }

        private Rest(List<Stmt> stmts, int index, Body body, Rest next, Set<String> visible, Run.Join join) {
            this.stmts = stmts;
            this.index = index;
            this.body = body;
            this.next = next;
            this.visible = visible;
            this.join = join;
        }

        Rest advance() {
            return new Rest(stmts, index + 1, body, next);
        }
    }

    /** What a block may do to its path beyond its own locals. */
    private static final class Effects {
        boolean sends;
        boolean writesState;

        Effects scan(List<Stmt> stmts) {
            for (Stmt s : stmts) {
                if (s instanceof Statement.SendStmt) {
                    sends = true;
                } else if (s instanceof Statement.AssignStmt) {
                    ExprInterface target = ((Statement.AssignStmt) s).target;
                    if (target instanceof Member || target instanceof Index) writesState = true;
                } else if (s instanceof Statement.If) {
                    scan(((Statement.If) s).thenBranch);
                    scan(((Statement.If) s).elseBranch);
                } else if (s instanceof Statement.PlaceholderStmt) {
                    // the spliced body is not visible here
                    sends = true;
                    writesState = true;
                }
            }
            return this;
        }
    }

    /** False when every path through the block ends in {@code return} or a raise. */
    private static boolean fallsThrough(List<Stmt> stmts) {
        for (Stmt s : stmts) {
            if (s instanceof Statement.ReturnStmt || s instanceof Statement.ExceptionStmt) return false;
            if (s instanceof Statement.If) {
                Statement.If i = (Statement.If) s;
                if (!fallsThrough(i.thenBranch) && !fallsThrough(i.elseBranch)) return false;
            }
        }
        return true;
    }

    // -------------------------
    // Lowering entry points
    // -------------------------

    private final CoinDecl coin;
    private final SymbolTable symbols;
    private final ProgramBuilder builder;
    private final int maxDepth;
    private final Set<String> definingFunctions = new HashSet<>();
    private int depth = 0;
    private int joins = 0;

    BodyLowering(CoinDecl coin, SymbolTable symbols, CompilerOptions options, ProgramBuilder builder) {
        this.coin = coin;
        this.symbols = symbols;
        this.builder = builder;
        this.maxDepth = options.getMaxExpressionDepth();
    }

    /** Initial path state of an action; state fields read from {@code tuple} when given. */
    PathState initialState(Node tuple) {
        PathState st = new PathState();
        if (tuple != null) {
            for (SymbolTable.Symbol field : symbols.ofCategory(SymbolTable.Category.STATE)) {
                st.state.put(field.name, StateSchema.accessor(tuple, field.index));
            }
        }
        return st;
    }

    /**
     * Lowers an action body wrapped in its modifiers. With {@code identities} non-empty the
     * body only runs when the sender is one of them, and the path starts with an
     * AGG_SIG_ME condition binding the sender to the action arguments.
     */
    Node lowerAction(ActionDecl action, Scope scope, List<ExprInterface> identities, PathState st, Terminal terminal) {
        Body body = new Body(action.body, null);
        for (int i = action.modifiers.size() - 1; i >= 0; i--) {
            Token m = action.modifiers.get(i);
            ModifierDecl decl = coin.modifier(m.lexeme);
            if (decl == null) {
                throw new GenerationError(m.position(), m.lexeme, "Unknown modifier '" + m.lexeme + "'");
            }
            for (Param p : decl.params) {
                if (!scope.params.containsKey(p.name.lexeme)) {
                    throw new GenerationError(p.name.position(), p.name.lexeme, "Modifier parameter '" + p.name.lexeme
                            + "' must name a parameter of action '" + action.name.lexeme + "'");
                }
            }
            body = new Body(decl.body, body);
        }

        Run run = new Run(scope, terminal, builder.parameterNames());
        if (identities.isEmpty()) {
            return run.lowerFrom(run.entry(body, null), st);
        }

        List<Node> checks = new ArrayList<>();
        for (ExprInterface id : identities) {
            checks.add(Nodes.form("=", scope.sender, run.expression(id, st)));
        }
        Node allowed = checks.size() == 1 ? checks.get(0) : Nodes.form("any", checks);
        st.conditions.add(condition(ConditionCode.AGG_SIG_ME, scope.sender, argumentDigest(scope)));
        Node inner = run.lowerFrom(run.entry(body, null), st);
        return Nodes.form("if", allowed, inner, Nodes.form("x", Atom.string("Unauthorized")));
    }

    /**
     * Value of a compile-time expression: literals and earlier storage or constants,
     * folded to their values.
     */
    Node constant(ExprInterface expr) {
        Scope scope = new Scope("storage", Collections.<String, Node>emptyMap(), false, false, null);
        Run run = new Run(scope, null, Collections.<String>emptyList());
        run.inlineConstants = true;
        return run.expression(expr, new PathState());
    }

    private Node condition(ConditionCode code, Node... args) {
        builder.useFeature(code.name());
        List<Node> items = new ArrayList<>();
        items.add(Atom.symbol(code.name()));
        items.addAll(Arrays.asList(args));
        return Nodes.form("list", items);
    }

    /** {@code (sha256tree (list params...))}: what a default signature commits to. */
    private Node argumentDigest(Scope scope) {
        builder.useFeature("sha256tree");
        List<Node> params = new ArrayList<>(scope.params.values());
        return Nodes.form("sha256tree", params.isEmpty() ? Atom.NIL : Nodes.form("list", params));
    }

    private void enter(Token at) {
        if (++depth > maxDepth) {
            throw new ExpressionTooDeepError(at.position(), maxDepth);
        }
    }

    private void exit() {
        depth--;
    }

    /** Conditions of a path in emission order, consed in front of {@code tail} when given. */
    Node conditionList(PathState st, Node tail) {
        Node out;
        if (tail == null) {
            out = st.conditions.isEmpty() ? Atom.NIL : Nodes.form("list", st.conditions);
        } else {
            out = tail;
            for (int i = st.conditions.size() - 1; i >= 0; i--) {
                out = Nodes.form("c", st.conditions.get(i), out);
            }
        }
        if (st.conditionPrefix == null) return out;
        if (out.isNil()) return st.conditionPrefix;
        if (!builder.hasDefinition("merge-list")) builder.define("merge-list", MERGE_LIST);
        return Nodes.form("merge-list", st.conditionPrefix, out);
    }

    // -------------------------
    // Functions
    // -------------------------

    private void ensureFunction(FunctionDecl f, Token at) {
        String name = f.name.lexeme;
        if (builder.hasDefinition(name)) return;
        if (definingFunctions.contains(name)) {
            if (f.inline) {
                throw new GenerationError(at.position(), name, "Inline function '" + name + "' cannot call itself");
            }
            return;
        }
        definingFunctions.add(name);

        Map<String, Node> params = new LinkedHashMap<>();
        List<Node> paramNodes = new ArrayList<>();
        List<String> paramNames = new ArrayList<>();
        for (Param p : f.params) {
            checkName(p.name);
            if (params.containsKey(p.name.lexeme)) {
                throw new GenerationError(p.name.position(), p.name.lexeme, "Duplicate parameter '" + p.name.lexeme + "'");
            }
            params.put(p.name.lexeme, Atom.symbol(p.name.lexeme));
            paramNodes.add(Atom.symbol(p.name.lexeme));
            paramNames.add(p.name.lexeme);
        }
        Scope scope = new Scope(name, params, false, false, null);
        Terminal terminal = (st, returned) -> {
            if (returned == null && f.returnType != null) {
                throw new GenerationError(f.name.position(), name,
                        "Function '" + name + "' can end without returning a " + f.returnType);
            }
            return returned == null ? Atom.NIL : returned;
        };

        int saved = depth;
        depth = 0;
        Run run = new Run(scope, terminal, paramNames);
        Node body = run.lowerFrom(run.entry(new Body(f.body, null), null), new PathState());
        depth = saved;

        definingFunctions.remove(name);
        builder.define(name, Nodes.form(f.inline ? "defun-inline" : "defun",
                Atom.symbol(name), Nodes.list(paramNodes), body));
    }

    private void ensureMapHelpers() {
        if (!builder.hasDefinition("map-get")) builder.define("map-get", MAP_GET);
        if (!builder.hasDefinition("map-set")) builder.define("map-set", MAP_SET);
    }

    static void checkName(Token name) {
        if (RESERVED.contains(name.lexeme)) {
            throw new GenerationError(name.position(), name.lexeme, "'" + name.lexeme + "' is a reserved name");
        }
    }

    /** Rejects a name spelled like the compiled name of storage or a constant; it would be replaced by the value. */
    static void checkBinding(Token name, SymbolTable symbols) {
        SymbolTable.Symbol bound = symbols.boundTo(name.lexeme);
        if (bound != null) {
            throw new GenerationError(name.position(), name.lexeme, "'" + name.lexeme + "' is the compiled name of "
                    + (bound.category == SymbolTable.Category.CURRIED ? "storage" : "constant") + " '" + bound.name + "'");
        }
    }

    // -------------------------
    // One lowering run
    // -------------------------

    private final class Run {
        final Scope scope;
        final Terminal terminal;
        /** Parameters of the enclosing program or function; join functions take them first. */
        final List<String> env;
        boolean inlineConstants = false;

        Run(Scope scope, Terminal terminal, List<String> env) {
            this.scope = scope;
            this.terminal = terminal;
            this.env = env;
        }

        /** Where execution of {@code body} starts; a modifier without {@code _;} runs before its inner body. */
        Rest entry(Body body, Rest next) {
            if (body.inner != null && !containsPlaceholder(body.stmts)) {
                return new Rest(body.stmts, 0, body, entry(body.inner, next));
            }
            return new Rest(body.stmts, 0, body, next);
        }

        /**
         * Lowers one path. Statements that only update the path state are taken in a loop;
         * {@code require} and dropped expression values wrap everything after them and
         * count one nesting level each.
         */
        Node lowerFrom(Rest rest, PathState st) {
            List<UnaryOperator<Node>> wraps = new ArrayList<>();
            Node result = null;
            while (result == null) {
                if (rest == null) {
                    result = terminal.finish(st, null);
                } else if (rest.join != null) {
                    result = rest.join.call(st);
                } else if (rest.visible != null) {
                    st.locals.keySet().retainAll(rest.visible);
                    rest = rest.next;
                } else if (rest.index >= rest.stmts.size()) {
                    rest = rest.next;
                } else {
                    StmtLowering step = new StmtLowering(rest.body, rest.advance(), st);
                    result = rest.stmts.get(rest.index).accept(step);
                    if (step.wrap != null) {
                        enter(step.at);
                        wraps.add(step.wrap);
                    }
                    rest = step.continueAt;
                }
            }
            for (int i = wraps.size() - 1; i >= 0; i--) {
                result = wraps.get(i).apply(result);
                exit();
            }
            return result;
        }

        private boolean reachesStatement(Rest rest) {
            for (Rest r = rest; r != null && r.join == null; r = r.next) {
                if (r.visible == null && r.index < r.stmts.size()) return true;
            }
            return false;
        }

        Node expression(ExprInterface expr, PathState st) {
            return expr.accept(new ExprLowering(st)).node();
        }

        private void requireConditions(Token at, String what) {
            if (!scope.conditions) {
                throw new GenerationError(at.position(), what,
                        "'" + what + "' is not allowed in function '" + scope.owner + "'");
            }
        }

        // -------------------------
        // Joins
        // -------------------------

        /**
         * Statements after an {@code if} whose branches both fall through, emitted once as
         * {@code (defun join-N (env... locals... state... conditions [sent]) body)}.
         */
        private final class Join {
            final String name;
            final List<String> locals;
            final List<String> fields;
            final boolean sends;
            final boolean stateChanged;

            Join(Statement.If stmt, PathState st) {
                this.name = "join-" + (++joins);
                this.locals = new ArrayList<>(st.locals.keySet());
                Collections.sort(locals);
                this.fields = new ArrayList<>(st.state.keySet());
                Effects effects = new Effects().scan(stmt.thenBranch).scan(stmt.elseBranch);
                this.sends = st.sendTotal != null || effects.sends;
                this.stateChanged = st.stateChanged || (scope.stateful && effects.writesState);
            }

            Node call(PathState st) {
                List<Node> args = new ArrayList<>();
                for (String e : env) args.add(Atom.symbol(e));
                for (String l : locals) args.add(st.locals.get(l));
                for (String f : fields) args.add(st.state.get(f));
                args.add(conditionList(st, null));
                if (sends) args.add(st.sendTotal == null ? Atom.integer(0) : st.sendTotal);
                return Nodes.form(name, args);
            }

            void define(Rest after) {
                PathState st = new PathState();
                List<Node> params = new ArrayList<>();
                for (String e : env) params.add(Atom.symbol(e));
                for (String l : locals) {
                    Node p = Atom.symbol("local-" + l);
                    params.add(p);
                    st.locals.put(l, p);
                }
                for (String f : fields) {
                    Node p = Atom.symbol("state-" + f);
                    params.add(p);
                    st.state.put(f, p);
                }
                st.conditionPrefix = Atom.symbol("path-conditions");
                params.add(st.conditionPrefix);
                if (sends) {
                    st.sendTotal = Atom.symbol("path-sent");
                    params.add(st.sendTotal);
                }
                st.stateChanged = stateChanged;
                Node body = lowerFrom(after, st);
                builder.define(name, Nodes.form("defun", Atom.symbol(name), Nodes.list(params), body));
            }
        }

        // -------------------------
        // Statements
        // -------------------------

        /** Lowers one statement: returns the finished path, or null to go on at {@link #continueAt}. */
        private final class StmtLowering implements StmtVisitor<Node> {
            final Body body;
            final Rest after;
            final PathState st;
            Rest continueAt;
            UnaryOperator<Node> wrap;
            Token at;

            StmtLowering(Body body, Rest after, PathState st) {
                this.body = body;
                this.after = after;
                this.st = st;
                this.continueAt = after;
            }

            private Node lower(ExprInterface expr) {
                return expression(expr, st);
            }

            private void wrapRest(Token token, UnaryOperator<Node> wrapper) {
                this.at = token;
                this.wrap = wrapper;
            }

            @Override
            public Node visitVarStmt(Statement.VarStmt stmt) {
                String name = stmt.name.lexeme;
                checkName(stmt.name);
                if (scope.params.containsKey(name) || st.locals.containsKey(name)) {
                    throw new GenerationError(stmt.name.position(), name, "'" + name + "' is already declared");
                }
                if (symbols.lookup(name) != null) {
                    throw new GenerationError(stmt.name.position(), name,
                            "'" + name + "' shadows a coin-level declaration");
                }
                checkBinding(stmt.name, symbols);
                st.locals.put(name, lower(stmt.initializer));
                return null;
            }

            @Override
            public Node visitAssignStmt(Statement.AssignStmt stmt) {
                Node value = lower(stmt.value);
                ExprInterface target = stmt.target;
                if (target instanceof Identifier) {
                    Token name = ((Identifier) target).name;
                    String n = name.lexeme;
                    if (st.locals.containsKey(n)) {
                        st.locals.put(n, value);
                        return null;
                    }
                    if (scope.params.containsKey(n)) {
                        throw new GenerationError(name.position(), n, "Cannot assign to parameter '" + n + "'");
                    }
                    SymbolTable.Symbol symbol = symbols.lookup(n);
                    if (symbol != null && symbol.category != SymbolTable.Category.STATE) {
                        throw new GenerationError(name.position(), n, "Cannot assign to "
                                + (symbol.category == SymbolTable.Category.CURRIED ? "storage" : "constant")
                                + " '" + n + "'; it is fixed at compile time");
                    }
                    if (symbol != null) {
                        throw new GenerationError(name.position(), n, "State field '" + n + "' must be written as state." + n);
                    }
                    throw new GenerationError(name.position(), n, "Assignment to undeclared variable '" + n + "'");
                }
                if (target instanceof Member && isStateRef(((Member) target).object)) {
                    SymbolTable.Symbol field = stateField((Member) target);
                    st.state.put(field.name, value);
                    st.stateChanged = true;
                    return null;
                }
                if (target instanceof Index) {
                    Index index = (Index) target;
                    SymbolTable.Symbol field = mappingField(index);
                    ensureMapHelpers();
                    Node key = lower(index.index);
                    st.state.put(field.name, Nodes.form("map-set", st.state.get(field.name), key, value));
                    st.stateChanged = true;
                    return null;
                }
                throw new GenerationError(stmt.equals.position(), null, "Invalid assignment target");
            }

            @Override
            public Node visitIfStmt(Statement.If stmt) {
                enter(stmt.keyword);
                Node condition = lower(stmt.condition);
                Node then;
                Node otherwise;
                if (fallsThrough(stmt.thenBranch) && fallsThrough(stmt.elseBranch) && reachesStatement(after)) {
                    Join join = new Join(stmt, st);
                    Rest jump = new Rest(join);
                    then = lowerFrom(new Rest(stmt.thenBranch, 0, body, jump), st.copy());
                    otherwise = lowerFrom(new Rest(stmt.elseBranch, 0, body, jump), st.copy());
                    join.define(after);
                } else {
                    Rest rejoin = new Rest(new HashSet<>(st.locals.keySet()), after);
                    then = lowerFrom(new Rest(stmt.thenBranch, 0, body, rejoin), st.copy());
                    otherwise = lowerFrom(new Rest(stmt.elseBranch, 0, body, rejoin), st.copy());
                }
                exit();
                return Nodes.form("if", condition, then, otherwise);
            }

            @Override
            public Node visitRequireStmt(Statement.RequireStmt stmt) {
                Node condition = lower(stmt.condition);
                Node failure = stmt.message == null ? Nodes.form("x") : Nodes.form("x", lower(stmt.message));
                wrapRest(stmt.keyword, rest -> Nodes.form("if", condition, rest, failure));
                return null;
            }

            @Override
            public Node visitExceptionStmt(Statement.ExceptionStmt stmt) {
                return stmt.message == null ? Nodes.form("x") : Nodes.form("x", lower(stmt.message));
            }

            @Override
            public Node visitEmitStmt(Statement.EmitStmt stmt) {
                requireConditions(stmt.keyword, "emit");
                EventDecl event = coin.event(stmt.event.lexeme);
                if (event == null) {
                    throw new GenerationError(stmt.event.position(), stmt.event.lexeme,
                            "Unknown event '" + stmt.event.lexeme + "'");
                }
                if (event.params.size() != stmt.arguments.size()) {
                    throw new GenerationError(stmt.event.position(), stmt.event.lexeme, "Event '" + stmt.event.lexeme
                            + "' takes " + event.params.size() + " arguments, got " + stmt.arguments.size());
                }
                Node topic = Atom.bytes(TreeHash.sha256(event.signature().getBytes(StandardCharsets.UTF_8)));
                Node message = topic;
                if (!stmt.arguments.isEmpty()) {
                    List<Node> args = new ArrayList<>();
                    for (ExprInterface a : stmt.arguments) args.add(lower(a));
                    builder.useFeature("sha256tree");
                    message = Nodes.form("concat", topic, Nodes.form("sha256tree", Nodes.form("list", args)));
                }
                st.conditions.add(condition(ConditionCode.CREATE_PUZZLE_ANNOUNCEMENT, message));
                return null;
            }

            @Override
            public Node visitSendStmt(Statement.SendStmt stmt) {
                requireConditions(stmt.keyword, "send");
                Node recipient = lower(stmt.recipient);
                Node amount = lower(stmt.amount);
                if (stmt.memo == null) {
                    st.conditions.add(condition(ConditionCode.CREATE_COIN, recipient, amount));
                } else {
                    st.conditions.add(condition(ConditionCode.CREATE_COIN, recipient, amount,
                            Nodes.form("list", lower(stmt.memo))));
                }
                st.sendTotal = st.sendTotal == null ? amount : Nodes.form("+", st.sendTotal, amount);
                return null;
            }

            @Override
            public Node visitReturnStmt(Statement.ReturnStmt stmt) {
                return terminal.finish(st, stmt.value == null ? null : lower(stmt.value));
            }

            @Override
            public Node visitExprStmt(Statement.ExprStmt stmt) {
                if (stmt.expression instanceof Call) {
                    Call call = (Call) stmt.expression;
                    String name = call.calleeName();
                    if (name != null && CONDITION_BUILTINS.containsKey(name) && coin.function(name) == null) {
                        requireConditions(call.token(), name);
                        st.conditions.add(conditionCall(call, name, st));
                        return null;
                    }
                }
                Node value = lower(stmt.expression);
                // evaluated for its failure, result dropped
                wrapRest(stmt.expression.token(), rest -> Nodes.form("f", Nodes.form("c", rest, value)));
                return null;
            }

            @Override
            public Node visitPlaceholderStmt(Statement.PlaceholderStmt stmt) {
                if (body == null || body.inner == null) {
                    throw new GenerationError(stmt.token.position(), "_", "'_' is only allowed in a modifier body");
                }
                continueAt = entry(body.inner, after);
                return null;
            }
        }

        private Node conditionCall(Call call, String name, PathState st) {
            ConditionBuiltin builtin = CONDITION_BUILTINS.get(name);
            int n = call.arguments.size();
            if (n < builtin.minArgs || n > builtin.maxArgs) {
                throw new GenerationError(call.token().position(), name, "'" + name + "' takes "
                        + (builtin.minArgs == builtin.maxArgs ? String.valueOf(builtin.minArgs)
                        : builtin.minArgs + " to " + builtin.maxArgs) + " arguments, got " + n);
            }
            List<Node> args = new ArrayList<>();
            for (ExprInterface a : call.arguments) args.add(expression(a, st));
            if (builtin.code == ConditionCode.AGG_SIG_ME && args.size() == 1) {
                args.add(argumentDigest(scope));
            }
            return condition(builtin.code, args.toArray(new Node[0]));
        }

        private boolean isStateRef(ExprInterface expr) {
            return expr instanceof Identifier && ((Identifier) expr).name.type == TokenType.STATE;
        }

        private SymbolTable.Symbol stateField(Member member) {
            String field = member.name.lexeme;
            if (!scope.stateful) {
                throw new GenerationError(member.name.position(), field, "state." + field
                        + " is only accessible in a @stateful action, not in '" + scope.owner + "'");
            }
            SymbolTable.Symbol symbol = symbols.stateField(field);
            if (symbol == null) {
                throw new GenerationError(member.name.position(), field, "Unknown state field '" + field + "'");
            }
            return symbol;
        }

        private SymbolTable.Symbol mappingField(Index index) {
            if (index.target instanceof Member && isStateRef(((Member) index.target).object)) {
                SymbolTable.Symbol field = stateField((Member) index.target);
                if (field.type.isMapping()) return field;
                throw new GenerationError(index.bracket.position(), field.name,
                        "state." + field.name + " is not a mapping");
            }
            throw new GenerationError(index.bracket.position(), null,
                    "Indexing is only supported on mapping state fields");
        }

        private boolean containsPlaceholder(List<Stmt> stmts) {
            for (Stmt s : stmts) {
                if (s instanceof Statement.PlaceholderStmt) return true;
                if (s instanceof Statement.If) {
                    Statement.If i = (Statement.If) s;
                    if (containsPlaceholder(i.thenBranch) || containsPlaceholder(i.elseBranch)) return true;
                }
            }
            return false;
        }

        // -------------------------
        // Expressions
        // -------------------------

        private final class ExprLowering implements ExprVisitor<TargetExpression> {
            final PathState st;

            ExprLowering(PathState st) {
                this.st = st;
            }

            private TargetExpression lower(ExprInterface expr) {
                enter(expr.token());
                try {
                    return expr.accept(this);
                } finally {
                    exit();
                }
            }

            @Override
            public TargetExpression visitBinaryExpr(Binary expr) {
                TargetExpression a = lower(expr.left);
                TargetExpression b = lower(expr.right);
                switch (expr.operator.type) {
                    case PLUS: return TargetExpression.call("+", a, b);
                    case MINUS: return TargetExpression.call("-", a, b);
                    case STAR: return TargetExpression.call("*", a, b);
                    case SLASH: return TargetExpression.call("/", a, b);
                    // floor remainder, sign follows the divisor
                    case PERCENT: return TargetExpression.call("r", TargetExpression.call("divmod", a, b));
                    case EQUAL_EQUAL: return TargetExpression.call("=", a, b);
                    case BANG_EQUAL: return TargetExpression.call("not", TargetExpression.call("=", a, b));
                    case GREATER: return TargetExpression.call(">", a, b);
                    case LESS: return TargetExpression.call(">", b, a);
                    case GREATER_EQUAL: return TargetExpression.call("not", TargetExpression.call(">", b, a));
                    case LESS_EQUAL: return TargetExpression.call("not", TargetExpression.call(">", a, b));
                    case GREATER_S: return TargetExpression.call(">s", a, b);
                    case AMP_AMP: return TargetExpression.call("all", a, b);
                    case PIPE_PIPE: return TargetExpression.call("any", a, b);
                    case AMP: return TargetExpression.call("logand", a, b);
                    case PIPE: return TargetExpression.call("logior", a, b);
                    case CARET: return TargetExpression.call("logxor", a, b);
                    case LESS_LESS: return TargetExpression.call("ash", a, b);
                    case GREATER_GREATER:
                        if (b.isIntegerLiteral()) {
                            return TargetExpression.call("ash", a, TargetExpression.integer(b.integerValue().negate()));
                        }
                        return TargetExpression.call("ash", a, TargetExpression.call("-", TargetExpression.integer(0), b));
                    default:
                        throw new GenerationError(expr.operator.position(), expr.operator.lexeme,
                                "Unsupported operator '" + expr.operator.lexeme + "'");
                }
            }

            @Override
            public TargetExpression visitUnaryExpr(Unary expr) {
                TargetExpression operand = lower(expr.right);
                switch (expr.operator.type) {
                    case BANG: return TargetExpression.call("not", operand);
                    case TILDE: return TargetExpression.call("lognot", operand);
                    case MINUS:
                        if (operand.isIntegerLiteral()) return TargetExpression.integer(operand.integerValue().negate());
                        return TargetExpression.call("-", TargetExpression.integer(0), operand);
                    default:
                        throw new GenerationError(expr.operator.position(), expr.operator.lexeme,
                                "Unsupported operator '" + expr.operator.lexeme + "'");
                }
            }

            @Override
            public TargetExpression visitLiteralExpr(Literal expr) {
                Object v = expr.value;
                if (v instanceof BigInteger) return TargetExpression.integer((BigInteger) v);
                if (v instanceof Boolean) return ((Boolean) v) ? TargetExpression.integer(1) : TargetExpression.nil();
                if (v instanceof HexLiteral) return TargetExpression.of(Atom.hex(((HexLiteral) v).text));
                String text = (String) v;
                if (Bech32m.isAddress(text)) return TargetExpression.of(Atom.bytes(Bech32m.decodeAddress(text)));
                return TargetExpression.of(Atom.string(text));
            }

            @Override
            public TargetExpression visitIdentifierExpr(Identifier expr) {
                Token token = expr.name;
                String n = token.lexeme;
                if (token.type == TokenType.STATE) {
                    throw new GenerationError(token.position(), n, "'state' must be followed by a field name");
                }
                Node local = st.locals.get(n);
                if (local != null) return TargetExpression.of(local);
                Node param = scope.params.get(n);
                if (param != null) return TargetExpression.of(param);
                SymbolTable.Symbol symbol = symbols.lookupValue(n);
                if (symbol != null) {
                    if (inlineConstants) return TargetExpression.of(symbol.value);
                    builder.withCurriedParam(symbol.curriedName, symbol.value);
                    return TargetExpression.symbol(symbol.curriedName);
                }
                if (symbols.stateField(n) != null) {
                    throw new GenerationError(token.position(), n, "State field '" + n + "' must be read as state." + n);
                }
                throw new GenerationError(token.position(), n, "Unknown identifier '" + n + "'");
            }

            @Override
            public TargetExpression visitMemberExpr(Member expr) {
                if (expr.object instanceof Identifier) {
                    Token object = ((Identifier) expr.object).name;
                    if (object.type == TokenType.STATE) {
                        SymbolTable.Symbol field = stateField(expr);
                        return TargetExpression.of(st.state.get(field.name));
                    }
                    if (object.lexeme.equals("msg") && expr.name.lexeme.equals("sender")) {
                        if (scope.sender == null) {
                            throw new GenerationError(expr.name.position(), "msg.sender",
                                    "msg.sender is not available in '" + scope.owner + "'");
                        }
                        return TargetExpression.of(scope.sender);
                    }
                }
                throw new GenerationError(expr.name.position(), expr.name.lexeme,
                        "Unsupported member access '." + expr.name.lexeme + "'");
            }

            @Override
            public TargetExpression visitIndexExpr(Index expr) {
                SymbolTable.Symbol field = mappingField(expr);
                ensureMapHelpers();
                TargetExpression key = lower(expr.index);
                return TargetExpression.call("map-get", TargetExpression.of(st.state.get(field.name)), key);
            }

            @Override
            public TargetExpression visitCallExpr(Call expr) {
                String name = expr.calleeName();
                Token at = expr.token();
                if (name == null) {
                    throw new GenerationError(at.position(), null, "Only named functions can be called");
                }
                List<TargetExpression> args = new ArrayList<>();
                for (ExprInterface a : expr.arguments) args.add(lower(a));

                if (at.type == TokenType.TYPE) {
                    if (args.size() != 1) {
                        throw new GenerationError(at.position(), name, "Cast to " + name + " takes one argument");
                    }
                    return args.get(0);
                }
                FunctionDecl f = coin.function(name);
                if (f != null) {
                    if (inlineConstants) {
                        throw new GenerationError(at.position(), name, "Function '" + name + "' cannot be called in a compile-time value");
                    }
                    if (f.params.size() != args.size()) {
                        throw new GenerationError(at.position(), name, "Function '" + name + "' takes "
                                + f.params.size() + " arguments, got " + args.size());
                    }
                    ensureFunction(f, at);
                    return TargetExpression.call(name, args);
                }
                String op = EXPRESSION_BUILTINS.get(name);
                if (op != null) return TargetExpression.call(op, args);
                if (CONDITION_BUILTINS.containsKey(name)) {
                    throw new GenerationError(at.position(), name, "'" + name + "' can only be used as a statement");
                }
                if (IncludeLibrary.providerOf(name) != null) {
                    builder.useFeature(name);
                    return TargetExpression.call(name, args);
                }
                throw new GenerationError(at.position(), name, "Unknown function '" + name + "'");
            }
        }
    }
}
