package com.lumen.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    /** One method per node kind: adding a node breaks every pass until it handles it. */
    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitCallExpr(Call expr);
        R visitGetExpr(GetExpr expr);
        R visitSetExpr(SetExpr expr);
        R visitThisExpr(This expr);
        R visitSuperExpr(Super expr);
        R visitGroupingExpr(Grouping expr);
        R visitFunctionLiteralExpr(FunctionLiteral expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Object value; // null, Boolean, Double or String

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
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
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Grouping implements ExprInterface {
        public final ExprInterface expression;

        public Grouping(ExprInterface expression) {
            this.expression = expression;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }
    }

    // -------------------------
    // Calls and functions
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren; // closing ')', used for error lines
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
    }

    public static final class FunctionLiteral implements ExprInterface {
        public final Token keyword;
        public final List<Token> params;
        public final List<Statement.Stmt> body;

        public FunctionLiteral(Token keyword, List<Token> params, List<Statement.Stmt> body) {
            this.keyword = keyword;
            this.params = params;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionLiteralExpr(this);
        }
    }

    // -------------------------
    // Objects
    // -------------------------

    public static final class GetExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final Token name;

        public GetExpr(ExprInterface receiver, Token name) {
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class SetExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final Token name;
        public final ExprInterface value;

        public SetExpr(ExprInterface receiver, Token name, ExprInterface value) {
            this.receiver = receiver;
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetExpr(this);
        }
    }

    public static final class This implements ExprInterface {
        public final Token keyword;

        public This(Token keyword) {
            this.keyword = keyword;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitThisExpr(this);
        }
    }

    public static final class Super implements ExprInterface {
        public final Token keyword;
        public final Token method;

        public Super(Token keyword, Token method) {
            this.keyword = keyword;
            this.method = method;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSuperExpr(this);
        }
    }
}
