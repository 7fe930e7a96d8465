package com.coinscript.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.coinscript.debug.Debug;
import com.coinscript.error.ExpressionTooDeepError;
import com.coinscript.error.ParseError;
import com.coinscript.script.parser.Declaration.ActionDecl;
import com.coinscript.script.parser.Declaration.CoinDecl;
import com.coinscript.script.parser.Declaration.ConstantDecl;
import com.coinscript.script.parser.Declaration.EventDecl;
import com.coinscript.script.parser.Declaration.FunctionDecl;
import com.coinscript.script.parser.Declaration.ModifierDecl;
import com.coinscript.script.parser.Declaration.Param;
import com.coinscript.script.parser.Declaration.SingletonDecorator;
import com.coinscript.script.parser.Declaration.StateField;
import com.coinscript.script.parser.Declaration.StorageDecl;
import com.coinscript.script.parser.Declaration.TypeRef;
import com.coinscript.script.parser.SourceExpression.Binary;
import com.coinscript.script.parser.SourceExpression.Call;
import com.coinscript.script.parser.SourceExpression.ExprInterface;
import com.coinscript.script.parser.SourceExpression.HexLiteral;
import com.coinscript.script.parser.SourceExpression.Identifier;
import com.coinscript.script.parser.SourceExpression.Index;
import com.coinscript.script.parser.SourceExpression.Literal;
import com.coinscript.script.parser.SourceExpression.Member;
import com.coinscript.script.parser.SourceExpression.Unary;
import com.coinscript.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser for one coin. Fails fast on the first problem; no partial
 * declaration is returned.
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public Parser setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }

    public static CoinDecl parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseCoin();
    }

    public CoinDecl parseCoin() {
        List<String> includes = new ArrayList<>();
        while (match(TokenType.INCLUDE)) {
            includes.add(includePath());
        }

        SingletonDecorator singleton = null;
        while (match(TokenType.AT)) {
            Token at = previous();
            Token name = consume(TokenType.IDENTIFIER, "decorator name after '@'");
            if (!name.lexeme.equals("singleton")) {
                throw error(name, "coin decorator '@singleton'");
            }
            if (singleton != null) throw error(name, "a single '@singleton' decorator");
            ExprInterface launcherId = null;
            if (match(TokenType.LEFT_PAREN)) {
                if (!check(TokenType.RIGHT_PAREN)) launcherId = expression();
                consume(TokenType.RIGHT_PAREN, "')' after decorator argument");
            }
            singleton = new SingletonDecorator(at, launcherId);
        }

        consume(TokenType.COIN, "'coin'");
        CoinDecl coin = new CoinDecl(consume(TokenType.IDENTIFIER, "coin name"));
        coin.includes.addAll(includes);
        coin.singleton = singleton;
        consume(TokenType.LEFT_BRACE, "'{' after coin name");

        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            member(coin);
        }
        consume(TokenType.RIGHT_BRACE, "'}' after coin body");
        if (!isAtEnd()) throw error(peek(), "end of input after coin");

        Debug.get().d("Parser", "coin " + coin.name.lexeme + ": " + coin.actions.size() + " actions, "
                + coin.stateFields.size() + " state fields");
        return coin;
    }

    // -------------------------
    // Coin members
    // -------------------------

    private String includePath() {
        String path;
        if (match(TokenType.STRING)) {
            path = (String) previous().literal;
        } else {
            StringBuilder sb = new StringBuilder(consume(TokenType.IDENTIFIER, "include file name").lexeme);
            while (match(TokenType.DOT, TokenType.MINUS)) {
                sb.append(previous().lexeme);
                sb.append(consumeName("include file name part").lexeme);
            }
            path = sb.toString();
        }
        match(TokenType.SEMICOLON);
        return path;
    }

    private void member(CoinDecl coin) {
        if (match(TokenType.STORAGE)) {
            if (match(TokenType.LEFT_BRACE)) {
                while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                    coin.storage.add(storageItem());
                }
                consume(TokenType.RIGHT_BRACE, "'}' after storage block");
            } else {
                coin.storage.add(storageItem());
            }
            return;
        }
        if (match(TokenType.STATE)) {
            Token keyword = previous();
            if (coin.hasStateBlock) throw error(keyword, "a single state block");
            coin.hasStateBlock = true;
            consume(TokenType.LEFT_BRACE, "'{' after 'state'");
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                TypeRef type = type();
                Token name = consume(TokenType.IDENTIFIER, "state field name");
                consume(TokenType.SEMICOLON, "';' after state field");
                coin.stateFields.add(new StateField(type, name));
            }
            consume(TokenType.RIGHT_BRACE, "'}' after state block");
            return;
        }
        if (match(TokenType.CONST)) {
            TypeRef type = isTypeStart() ? type() : null;
            Token name = consume(TokenType.IDENTIFIER, "constant name");
            consume(TokenType.EQUAL, "'=' after constant name");
            ExprInterface value = expression();
            consume(TokenType.SEMICOLON, "';' after constant");
            coin.constants.add(new ConstantDecl(type, name, value));
            return;
        }
        if (match(TokenType.INLINE)) {
            consume(TokenType.FUNCTION, "'function' after 'inline'");
            coin.functions.add(function(true));
            return;
        }
        if (match(TokenType.FUNCTION)) {
            coin.functions.add(function(false));
            return;
        }
        if (match(TokenType.MODIFIER)) {
            Token name = consume(TokenType.IDENTIFIER, "modifier name");
            List<Param> params = new ArrayList<>();
            if (match(TokenType.LEFT_PAREN)) params = params();
            consume(TokenType.LEFT_BRACE, "'{' before modifier body");
            coin.modifiers.add(new ModifierDecl(name, params, block()));
            return;
        }
        if (match(TokenType.EVENT)) {
            Token name = consume(TokenType.IDENTIFIER, "event name");
            consume(TokenType.LEFT_PAREN, "'(' after event name");
            List<Param> params = params();
            consume(TokenType.SEMICOLON, "';' after event");
            coin.events.add(new EventDecl(name, params));
            return;
        }
        if (check(TokenType.AT) || check(TokenType.ACTION)) {
            coin.actions.add(action());
            return;
        }
        throw error(peek(), "storage, state, const, function, modifier, event or action");
    }

    private StorageDecl storageItem() {
        TypeRef type;
        Token name;
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.COLON)) {
            name = advance();
            advance(); // :
            type = type();
        } else {
            type = type();
            name = consume(TokenType.IDENTIFIER, "storage variable name");
        }
        consume(TokenType.EQUAL, "'=' and an initial value for storage '" + name.lexeme + "'");
        ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "';' after storage variable");
        return new StorageDecl(type, name, value);
    }

    private FunctionDecl function(boolean inline) {
        Token name = consume(TokenType.IDENTIFIER, "function name");
        consume(TokenType.LEFT_PAREN, "'(' after function name");
        List<Param> params = params();
        TypeRef returnType = null;
        if (match(TokenType.ARROW, TokenType.COLON)) returnType = type();
        consume(TokenType.LEFT_BRACE, "'{' before function body");
        return new FunctionDecl(name, params, returnType, inline, block());
    }

    private ActionDecl action() {
        ActionDecorator decorator = ActionDecorator.plain();
        while (match(TokenType.AT)) {
            Token name = consume(TokenType.IDENTIFIER, "decorator name after '@'");
            ActionDecorator next;
            switch (name.lexeme) {
                case "stateful":
                    next = new ActionDecorator.Stateful(name);
                    break;
                case "onlyAddress": {
                    consume(TokenType.LEFT_PAREN, "'(' with allowed addresses after '@onlyAddress'");
                    List<ExprInterface> identities = new ArrayList<>();
                    do {
                        identities.add(expression());
                    } while (match(TokenType.COMMA));
                    consume(TokenType.RIGHT_PAREN, "')' after allowed addresses");
                    next = new ActionDecorator.AccessRestricted(name, identities);
                    break;
                }
                case "singleton":
                    throw error(name, "'@singleton' only before 'coin'");
                default:
                    throw error(name, "action decorator '@stateful' or '@onlyAddress'");
            }
            if (decorator != ActionDecorator.plain()) {
                throw error(name, "at most one action decorator");
            }
            decorator = next;
        }
        consume(TokenType.ACTION, "'action' after decorator");
        Token name = consume(TokenType.IDENTIFIER, "action name");
        consume(TokenType.LEFT_PAREN, "'(' after action name");
        List<Param> params = params();

        List<Token> modifiers = new ArrayList<>();
        while (check(TokenType.IDENTIFIER)) {
            modifiers.add(advance());
        }
        consume(TokenType.LEFT_BRACE, "'{' before action body");
        return new ActionDecl(name, params, decorator, modifiers, block());
    }

    /** Parameter list after '(' through ')'. */
    private List<Param> params() {
        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= 64) {
                    throw error(peek(), "at most 64 parameters");
                }
                TypeRef type = type();
                params.add(new Param(type, consume(TokenType.IDENTIFIER, "parameter name")));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after parameters");
        return params;
    }

    private boolean isTypeStart() {
        return check(TokenType.TYPE) || check(TokenType.MAPPING);
    }

    private TypeRef type() {
        TypeRef type;
        if (match(TokenType.MAPPING)) {
            consume(TokenType.LEFT_PAREN, "'(' after 'mapping'");
            TypeRef key = type();
            consume(TokenType.FAT_ARROW, "'=>' in mapping type");
            TypeRef value = type();
            consume(TokenType.RIGHT_PAREN, "')' after mapping type");
            type = TypeRef.mapping(key, value);
        } else {
            type = TypeRef.simple(consume(TokenType.TYPE, "type name").lexeme);
        }
        while (check(TokenType.LEFT_BRACKET) && checkNext(TokenType.RIGHT_BRACKET)) {
            advance();
            advance();
            type = TypeRef.array(type);
        }
        return type;
    }

    // -------------------------
    // Statements
    // -------------------------

    /** Statements after '{' through '}'. */
    private List<Stmt> block() {
        Token open = previous();
        enter(open);
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "'}' after block");
        depth--;
        return statements;
    }

    private List<Stmt> blockOrStatement() {
        if (match(TokenType.LEFT_BRACE)) return block();
        List<Stmt> single = new ArrayList<>();
        single.add(statement());
        return single;
    }

    private Stmt statement() {
        if (match(TokenType.LET)) return letStatement();
        if (startsTypedDeclaration()) return typedVarStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.REQUIRE)) return requireStatement();
        if (match(TokenType.EXCEPTION)) return exceptionStatement();
        if (match(TokenType.EMIT)) return emitStatement();
        if (match(TokenType.SEND)) return sendStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.IDENTIFIER) && peek().lexeme.equals("_") && checkNext(TokenType.SEMICOLON)) {
            Token token = advance();
            advance();
            return new Statement.PlaceholderStmt(token);
        }
        return expressionStatement();
    }

    // uint256 x = ...;  mapping(...) m = ...;  bytes32[] xs = ...;  but not a cast like bytes32(x);
    private boolean startsTypedDeclaration() {
        if (check(TokenType.MAPPING)) return true;
        return check(TokenType.TYPE) && (checkNext(TokenType.IDENTIFIER) || checkNext(TokenType.LEFT_BRACKET));
    }

    private Stmt letStatement() {
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        TypeRef type = null;
        if (match(TokenType.COLON)) type = type();
        consume(TokenType.EQUAL, "'=' after variable name");
        ExprInterface initializer = expression();
        consume(TokenType.SEMICOLON, "';' after variable declaration");
        return new Statement.VarStmt(name, type, initializer);
    }

    private Stmt typedVarStatement() {
        TypeRef type = type();
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consume(TokenType.EQUAL, "'=' after variable name");
        ExprInterface initializer = expression();
        consume(TokenType.SEMICOLON, "';' after variable declaration");
        return new Statement.VarStmt(name, type, initializer);
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "'(' after 'if'");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "')' after if condition");
        List<Stmt> thenBranch = blockOrStatement();
        List<Stmt> elseBranch = new ArrayList<>();
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch.add(ifStatement());
            } else {
                elseBranch = blockOrStatement();
            }
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt requireStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "'(' after 'require'");
        ExprInterface condition = expression();
        ExprInterface message = null;
        if (match(TokenType.COMMA)) message = expression();
        consume(TokenType.RIGHT_PAREN, "')' after require arguments");
        consume(TokenType.SEMICOLON, "';' after require");
        return new Statement.RequireStmt(keyword, condition, message);
    }

    private Stmt exceptionStatement() {
        Token keyword = previous();
        ExprInterface message = null;
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) message = expression();
            consume(TokenType.RIGHT_PAREN, "')' after exception message");
        }
        consume(TokenType.SEMICOLON, "';' after exception");
        return new Statement.ExceptionStmt(keyword, message);
    }

    // emit Transfer(a, b);  or  emit(Transfer, a, b);
    private Stmt emitStatement() {
        Token keyword = previous();
        Token event;
        List<ExprInterface> args = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            event = consume(TokenType.IDENTIFIER, "event name");
            while (match(TokenType.COMMA)) {
                args.add(expression());
            }
            consume(TokenType.RIGHT_PAREN, "')' after emit arguments");
        } else {
            event = consume(TokenType.IDENTIFIER, "event name after 'emit'");
            consume(TokenType.LEFT_PAREN, "'(' after event name");
            args = arguments();
        }
        consume(TokenType.SEMICOLON, "';' after emit");
        return new Statement.EmitStmt(keyword, event, args);
    }

    private Stmt sendStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "'(' after 'send'");
        ExprInterface recipient = expression();
        consume(TokenType.COMMA, "',' between recipient and amount");
        ExprInterface amount = expression();
        ExprInterface memo = null;
        if (match(TokenType.COMMA)) memo = expression();
        consume(TokenType.RIGHT_PAREN, "')' after send arguments");
        consume(TokenType.SEMICOLON, "';' after send");
        return new Statement.SendStmt(keyword, recipient, amount, memo);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "';' after return value");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt expressionStatement() {
        ExprInterface expr = expression();
        if (match(TokenType.EQUAL, TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL)) {
            Token equals = previous();
            if (!(expr instanceof Identifier || expr instanceof Member || expr instanceof Index)) {
                throw error(equals, "assignable target before '" + equals.lexeme + "'");
            }
            ExprInterface value = expression();
            if (equals.type != TokenType.EQUAL) {
                // x op= v  =>  x = x op v
                Token op = new Token(binaryFor(equals.type), equals.lexeme.substring(0, 1), null, equals.line, equals.column);
                value = new Binary(expr, op, value);
            }
            consume(TokenType.SEMICOLON, "';' after assignment");
            return new Statement.AssignStmt(expr, equals, value);
        }
        consume(TokenType.SEMICOLON, "';' after expression");
        return new Statement.ExprStmt(expr);
    }

    private static TokenType binaryFor(TokenType compound) {
        switch (compound) {
            case PLUS_EQUAL: return TokenType.PLUS;
            case MINUS_EQUAL: return TokenType.MINUS;
            case STAR_EQUAL: return TokenType.STAR;
            case SLASH_EQUAL: return TokenType.SLASH;
            default: throw new IllegalArgumentException("not a compound assignment: " + compound);
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        enter(peek());
        try {
            return or();
        } finally {
            depth--;
        }
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.PIPE_PIPE)) {
            Token op = previous();
            expr = new Binary(expr, op, and());
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = bitOr();
        while (match(TokenType.AMP_AMP)) {
            Token op = previous();
            expr = new Binary(expr, op, bitOr());
        }
        return expr;
    }

    private ExprInterface bitOr() {
        ExprInterface expr = bitXor();
        while (match(TokenType.PIPE)) {
            Token op = previous();
            expr = new Binary(expr, op, bitXor());
        }
        return expr;
    }

    private ExprInterface bitXor() {
        ExprInterface expr = bitAnd();
        while (match(TokenType.CARET)) {
            Token op = previous();
            expr = new Binary(expr, op, bitAnd());
        }
        return expr;
    }

    private ExprInterface bitAnd() {
        ExprInterface expr = equality();
        while (match(TokenType.AMP)) {
            Token op = previous();
            expr = new Binary(expr, op, equality());
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.GREATER_S)) {
            Token op = previous();
            expr = new Binary(expr, op, comparison());
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = shift();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            expr = new Binary(expr, op, shift());
        }
        return expr;
    }

    private ExprInterface shift() {
        ExprInterface expr = term();
        while (match(TokenType.LESS_LESS, TokenType.GREATER_GREATER)) {
            Token op = previous();
            expr = new Binary(expr, op, term());
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            expr = new Binary(expr, op, factor());
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            expr = new Binary(expr, op, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.TILDE)) {
            Token op = previous();
            enter(op);
            try {
                return new Unary(op, unary());
            } finally {
                depth--;
            }
        }
        return call();
    }

    private ExprInterface call() {
        ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                Token paren = previous();
                expr = new Call(expr, paren, arguments());
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "']' after index");
                expr = new Index(expr, index, bracket);
            } else if (match(TokenType.DOT)) {
                expr = new Member(expr, consumeName("member name after '.'"));
            } else {
                break;
            }
        }
        return expr;
    }

    /** Arguments after '(' through ')'. */
    private List<ExprInterface> arguments() {
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after arguments");
        return args;
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE, previous());
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE, previous());
        if (match(TokenType.NUMBER)) return new Literal(previous().literal, previous());
        if (match(TokenType.HEX)) return new Literal(new HexLiteral((String) previous().literal), previous());
        if (match(TokenType.STRING)) return new Literal(previous().literal, previous());
        if (match(TokenType.IDENTIFIER, TokenType.STATE)) return new Identifier(previous());

        // bytes32(x), uint256(x): casts read like calls
        if (check(TokenType.TYPE) && checkNext(TokenType.LEFT_PAREN)) return new Identifier(advance());

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "')' after expression");
            return expr;
        }

        throw error(peek(), "expression");
    }

    // -------------------------
    // Token helpers
    // -------------------------

    /** Identifier, or a keyword used as a name (for example a member called 'state'). */
    private Token consumeName(String expected) {
        if (!isAtEnd() && peek().type != TokenType.STRING && !peek().lexeme.isEmpty()
                && Character.isLetter(peek().lexeme.charAt(0))) {
            return advance();
        }
        throw error(peek(), expected);
    }

    private void enter(Token at) {
        if (++depth > maxDepth) {
            throw new ExpressionTooDeepError(at.position(), maxDepth);
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String expected) {
        String found = token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
        return new ParseError(token.position(), expected, found);
    }
}
