import org.junit.jupiter.api.Test;

import com.coinscript.error.ErrorKind;
import com.coinscript.error.ExpressionTooDeepError;
import com.coinscript.error.ParseError;
import com.coinscript.script.parser.ActionDecorator;
import com.coinscript.script.parser.Declaration.ActionDecl;
import com.coinscript.script.parser.Declaration.CoinDecl;
import com.coinscript.script.parser.Lexer;
import com.coinscript.script.parser.Parser;
import com.coinscript.script.parser.SourceExpression.Binary;
import com.coinscript.script.parser.SourceExpression.Call;
import com.coinscript.script.parser.SourceExpression.Identifier;
import com.coinscript.script.parser.SourceExpression.Index;
import com.coinscript.script.parser.SourceExpression.Literal;
import com.coinscript.script.parser.SourceExpression.Member;
import com.coinscript.script.parser.Statement;
import com.coinscript.script.parser.TokenType;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static final String TOKEN = String.join("\n",
            "include utility_macros.clib;",
            "coin Token {",
            "  storage {",
            "    address owner = 0x" + "11".repeat(32) + ";",
            "    uint256 cap = 1000;",
            "  }",
            "  state {",
            "    uint256 supply;",
            "    mapping(address => uint256) balances;",
            "  }",
            "  const FEE = 10;",
            "  event Minted(address to, uint256 amount);",
            "  modifier onlyOwner { require(msg.sender == owner, \"not owner\"); _; }",
            "  inline function double(uint256 x) -> uint256 { return x * 2; }",
            "  @stateful",
            "  action mint(address to, uint256 amount) onlyOwner {",
            "    state.supply += amount;",
            "    state.balances[to] = amount;",
            "    emit Minted(to, amount);",
            "  }",
            "  @onlyAddress(owner)",
            "  action withdraw(uint256 amount) {",
            "    if (amount > cap) { exception(\"too much\"); } else send(owner, amount);",
            "  }",
            "}");

    private static String wrap(String actionBody) {
        return "coin C { action a(uint256 x) { " + actionBody + " } }";
    }

    private static Statement.Stmt firstStatement(String actionBody) {
        return Parser.parse(wrap(actionBody)).actions.get(0).body.get(0);
    }

    @Test
    void parsesEveryMemberKind() {
        CoinDecl coin = Parser.parse(TOKEN);

        assertEquals("Token", coin.name.lexeme);
        assertEquals(1, coin.includes.size());
        assertEquals("utility_macros.clib", coin.includes.get(0));
        assertEquals(2, coin.storage.size());
        assertTrue(coin.hasStateBlock);
        assertEquals(2, coin.stateFields.size());
        assertTrue(coin.stateFields.get(1).type.isMapping());
        assertEquals(1, coin.constants.size());
        assertEquals(1, coin.events.size());
        assertEquals(1, coin.modifiers.size());
        assertEquals(1, coin.functions.size());
        assertTrue(coin.functions.get(0).inline);
        assertEquals("uint256", coin.functions.get(0).returnType.name);
        assertEquals(2, coin.actions.size());
    }

    @Test
    void actionDecorators_areTaggedVariants() {
        CoinDecl coin = Parser.parse(TOKEN);
        ActionDecl mint = coin.actions.get(0);
        ActionDecl withdraw = coin.actions.get(1);

        assertTrue(mint.decorator instanceof ActionDecorator.Stateful);
        assertEquals(1, mint.modifiers.size());
        assertEquals("onlyOwner", mint.modifiers.get(0).lexeme);
        assertTrue(withdraw.decorator instanceof ActionDecorator.AccessRestricted);
        assertEquals(1, ((ActionDecorator.AccessRestricted) withdraw.decorator).identities.size());

        CoinDecl plain = Parser.parse(wrap("x;"));
        assertSame(ActionDecorator.plain(), plain.actions.get(0).decorator);
    }

    @Test
    void modifierPlaceholder_isItsOwnStatement() {
        CoinDecl coin = Parser.parse(TOKEN);

        assertTrue(coin.modifiers.get(0).body.get(1) instanceof Statement.PlaceholderStmt);
    }

    @Test
    void compoundAssignment_desugarsToBinary() {
        Statement.AssignStmt assign = (Statement.AssignStmt) Parser.parse(TOKEN).actions.get(0).body.get(0);

        assertTrue(assign.target instanceof Member);
        Binary value = (Binary) assign.value;
        assertEquals(TokenType.PLUS, value.operator.type);
        assertTrue(value.left instanceof Member);
    }

    @Test
    void mappingWrite_targetsIndexOfStateMember() {
        Statement.AssignStmt assign = (Statement.AssignStmt) Parser.parse(TOKEN).actions.get(0).body.get(1);

        Index index = (Index) assign.target;
        Member member = (Member) index.target;
        assertEquals("balances", member.name.lexeme);
        assertEquals(TokenType.STATE, ((Identifier) member.object).name.type);
    }

    @Test
    void precedence_multiplicationBindsTighterThanAddition() {
        Statement.ExprStmt stmt = (Statement.ExprStmt) firstStatement("1 + 2 * 3;");
        Binary top = (Binary) stmt.expression;

        assertEquals(TokenType.PLUS, top.operator.type);
        assertEquals(BigInteger.ONE, ((Literal) top.left).value);
        assertEquals(TokenType.STAR, ((Binary) top.right).operator.type);
    }

    @Test
    void precedence_comparisonBelowShiftAndLogicalAndAboveOr() {
        Binary or = (Binary) ((Statement.ExprStmt) firstStatement("a < b << 1 || c && d;")).expression;

        assertEquals(TokenType.PIPE_PIPE, or.operator.type);
        Binary lt = (Binary) or.left;
        assertEquals(TokenType.LESS, lt.operator.type);
        assertEquals(TokenType.LESS_LESS, ((Binary) lt.right).operator.type);
        assertEquals(TokenType.AMP_AMP, ((Binary) or.right).operator.type);
    }

    @Test
    void castReadsAsCall() {
        Statement.VarStmt var = (Statement.VarStmt) firstStatement("let h = bytes32(x);");
        Call call = (Call) var.initializer;

        assertEquals("bytes32", call.calleeName());
        assertEquals(1, call.arguments.size());
    }

    @Test
    void typedLocalAndElseIfChain() {
        Statement.VarStmt var = (Statement.VarStmt) firstStatement("uint256 y = x;");
        assertEquals("uint256", var.type.name);

        Statement.If chain = (Statement.If) firstStatement("if (x > 1) { send(0x01, 1); } else if (x > 0) send(0x01, 2); else { exception; }");
        assertEquals(1, chain.elseBranch.size());
        Statement.If nested = (Statement.If) chain.elseBranch.get(0);
        assertEquals(1, nested.elseBranch.size());
        assertTrue(nested.elseBranch.get(0) instanceof Statement.ExceptionStmt);
    }

    @Test
    void emit_acceptsBothCallForms() {
        String src = "coin C { event E(uint256 v); action a(uint256 x) { emit E(x); emit(E, x); } }";
        CoinDecl coin = Parser.parse(src);

        Statement.EmitStmt first = (Statement.EmitStmt) coin.actions.get(0).body.get(0);
        Statement.EmitStmt second = (Statement.EmitStmt) coin.actions.get(0).body.get(1);
        assertEquals("E", first.event.lexeme);
        assertEquals(1, first.arguments.size());
        assertEquals("E", second.event.lexeme);
        assertEquals(1, second.arguments.size());
    }

    @Test
    void singletonDecorator_withLauncherId() {
        CoinDecl coin = Parser.parse("@singleton(0x" + "ab".repeat(32) + ") coin S { action a() { } }");

        assertNotNull(coin.singleton);
        assertNotNull(coin.singleton.launcherId);
    }

    @Test
    void missingToken_reportsExpectedAndFound() {
        ParseError e = assertThrows(ParseError.class, () -> Parser.parse("coin C { action a() { send(0x01 100); } }"));

        assertEquals(ErrorKind.PARSE, e.getKind());
        assertEquals("',' between recipient and amount", e.getExpected());
        assertEquals("'100'", e.getFound());
    }

    @Test
    void structuralErrors() {
        assertThrows(ParseError.class, () -> Parser.parse("coin C { action a() { } "));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { storage address owner; }"));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { state { uint256 a; } state { uint256 b; } }"));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { @stateful @stateful action a() { } }"));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { @payable action a() { } }"));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { @singleton action a() { } }"));
        assertThrows(ParseError.class, () -> Parser.parse(wrap("1 + 2 = 3;")));
        assertThrows(ParseError.class, () -> Parser.parse("coin C { } coin D { }"));
    }

    @Test
    void deepNesting_raisesExpressionTooDeep() {
        StringBuilder expr = new StringBuilder();
        for (int i = 0; i < 40; i++) expr.append('(');
        expr.append('1');
        for (int i = 0; i < 40; i++) expr.append(')');
        String src = wrap("let y = " + expr + ";");

        Parser shallow = new Parser(new Lexer(src).tokenize()).setMaxDepth(16);
        ExpressionTooDeepError e = assertThrows(ExpressionTooDeepError.class, shallow::parseCoin);
        assertEquals(16, e.getLimit());
        assertEquals(ErrorKind.EXPRESSION_TOO_DEEP, e.getKind());

        assertNotNull(new Parser(new Lexer(src).tokenize()).setMaxDepth(64).parseCoin());
    }

    @Test
    void deepUnaryChain_isBounded() {
        String src = wrap("let y = " + "-".repeat(5000) + "1;");

        assertThrows(ExpressionTooDeepError.class, () -> Parser.parse(src));
    }
}
