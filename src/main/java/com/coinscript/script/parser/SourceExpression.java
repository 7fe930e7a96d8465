package com.coinscript.script.parser;

import java.util.List;

/** Expressions of the contract language, as written in source. */
public class SourceExpression {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Token the expression is reported at. */
        Token token();
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitMemberExpr(Member expr);
        R visitIndexExpr(Index expr);
        R visitCallExpr(Call expr);
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public Token token() { return operator; }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public Token token() { return operator; }
    }

    /**
     * Literal value: {@link java.math.BigInteger} for numbers, {@link String} for
     * strings, {@link Boolean}, or a {@link HexLiteral}.
     */
    public static final class Literal implements ExprInterface {
        public final Object value;
        public final Token source;

        public Literal(Object value, Token source) {
            this.value = value;
            this.source = source;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public Token token() { return source; }
    }

    /** Byte-string literal written as 0x digits. */
    public static final class HexLiteral {
        public final String text;

        public HexLiteral(String text) {
            this.text = text;
        }

        @Override
        public String toString() { return text; }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public Token token() { return name; }
    }

    /** {@code object.name}; used for {@code state.field} and {@code msg.sender}. */
    public static final class Member implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public Member(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }

        @Override
        public Token token() { return name; }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }

        @Override
        public Token token() { return bracket; }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public Token token() { return callee.token(); }

        /** Callee name when the callee is a plain identifier, else null. */
        public String calleeName() {
            return callee instanceof Identifier ? ((Identifier) callee).name.lexeme : null;
        }
    }
}
