package com.coinscript.script.parser;

import java.util.List;

import com.coinscript.script.parser.SourceExpression.ExprInterface;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitVarStmt(VarStmt stmt);
        R visitAssignStmt(AssignStmt stmt);
        R visitIfStmt(If stmt);
        R visitRequireStmt(RequireStmt stmt);
        R visitExceptionStmt(ExceptionStmt stmt);
        R visitEmitStmt(EmitStmt stmt);
        R visitSendStmt(SendStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitPlaceholderStmt(PlaceholderStmt stmt);
    }

    /** {@code let x = e;} or {@code uint256 x = e;}; type is null for let. */
    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Declaration.TypeRef type;
        public final ExprInterface initializer;

        VarStmt(Token name, Declaration.TypeRef type, ExprInterface initializer) {
            this.name = name;
            this.type = type;
            this.initializer = initializer;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarStmt(this); }
    }

    /** Target is an Identifier, a Member ({@code state.f}) or an Index ({@code state.m[k]}). */
    public static final class AssignStmt implements Stmt {
        public final ExprInterface target;
        public final Token equals;
        public final ExprInterface value;

        AssignStmt(ExprInterface target, Token equals, ExprInterface value) {
            this.target = target;
            this.equals = equals;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final ExprInterface condition;
        public final List<Stmt> thenBranch;
        /** Empty when there is no else. */
        public final List<Stmt> elseBranch;

        If(Token keyword, ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class RequireStmt implements Stmt {
        public final Token keyword;
        public final ExprInterface condition;
        public final ExprInterface message;

        RequireStmt(Token keyword, ExprInterface condition, ExprInterface message) {
            this.keyword = keyword;
            this.condition = condition;
            this.message = message;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRequireStmt(this); }
    }

    public static final class ExceptionStmt implements Stmt {
        public final Token keyword;
        public final ExprInterface message;

        ExceptionStmt(Token keyword, ExprInterface message) {
            this.keyword = keyword;
            this.message = message;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExceptionStmt(this); }
    }

    public static final class EmitStmt implements Stmt {
        public final Token keyword;
        public final Token event;
        public final List<ExprInterface> arguments;

        EmitStmt(Token keyword, Token event, List<ExprInterface> arguments) {
            this.keyword = keyword;
            this.event = event;
            this.arguments = arguments;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitEmitStmt(this); }
    }

    public static final class SendStmt implements Stmt {
        public final Token keyword;
        public final ExprInterface recipient;
        public final ExprInterface amount;
        public final ExprInterface memo;

        SendStmt(Token keyword, ExprInterface recipient, ExprInterface amount, ExprInterface memo) {
            this.keyword = keyword;
            this.recipient = recipient;
            this.amount = amount;
            this.memo = memo;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSendStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final ExprInterface value;

        ReturnStmt(Token keyword, ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final ExprInterface expression;

        ExprStmt(ExprInterface expression) { this.expression = expression; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code _;} inside a modifier body: where the modified action's body goes. */
    public static final class PlaceholderStmt implements Stmt {
        public final Token token;

        PlaceholderStmt(Token token) { this.token = token; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPlaceholderStmt(this); }
    }
}
