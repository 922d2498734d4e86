package com.lumen.script.parser;

import java.util.List;

import com.lumen.script.parser.Expr.Assign;
import com.lumen.script.parser.Expr.Binary;
import com.lumen.script.parser.Expr.Call;
import com.lumen.script.parser.Expr.ExprInterface;
import com.lumen.script.parser.Expr.ExprVisitor;
import com.lumen.script.parser.Expr.FunctionLiteral;
import com.lumen.script.parser.Expr.GetExpr;
import com.lumen.script.parser.Expr.Grouping;
import com.lumen.script.parser.Expr.Literal;
import com.lumen.script.parser.Expr.Logical;
import com.lumen.script.parser.Expr.SetExpr;
import com.lumen.script.parser.Expr.Super;
import com.lumen.script.parser.Expr.This;
import com.lumen.script.parser.Expr.Unary;
import com.lumen.script.parser.Expr.Variable;

/**
 * Prefix rendering of an expression tree, for debugging the parser.
 *
 * <pre>
 *   1 + 2 &lt;= 5 + 7    =&gt;  (&lt;= (+ 1 2) (+ 5 7))
 *   (-1) + 3          =&gt;  (+ (group (- 1)) 3)
 *   a.b = c           =&gt;  (= (. a b) c)
 * </pre>
 */
public class AstPrinter implements ExprVisitor<String> {

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        if (expr.value == null) return "nil";
        if (expr.value instanceof Double) return Value.formatNumber((Double) expr.value);
        return expr.value.toString();
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitAssignExpr(Assign expr) {
        return parenthesize("=", expr.name.lexeme, print(expr.value));
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return parenthesize(expr.operator.lexeme, print(expr.right));
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return parenthesize(expr.operator.lexeme, print(expr.left), print(expr.right));
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return parenthesize(expr.operator.lexeme, print(expr.left), print(expr.right));
    }

    @Override
    public String visitGroupingExpr(Grouping expr) {
        return parenthesize("group", print(expr.expression));
    }

    @Override
    public String visitCallExpr(Call expr) {
        StringBuilder sb = new StringBuilder("(call ").append(print(expr.callee));
        for (ExprInterface arg : expr.arguments) {
            sb.append(' ').append(print(arg));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitGetExpr(GetExpr expr) {
        return parenthesize(".", print(expr.receiver), expr.name.lexeme);
    }

    @Override
    public String visitSetExpr(SetExpr expr) {
        return parenthesize("=", parenthesize(".", print(expr.receiver), expr.name.lexeme), print(expr.value));
    }

    @Override
    public String visitThisExpr(This expr) {
        return "this";
    }

    @Override
    public String visitSuperExpr(Super expr) {
        return parenthesize("super", expr.method.lexeme);
    }

    @Override
    public String visitFunctionLiteralExpr(FunctionLiteral expr) {
        return "(fun (" + names(expr.params) + "))";
    }

    private static String names(List<Token> params) {
        StringBuilder sb = new StringBuilder();
        for (Token p : params) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(p.lexeme);
        }
        return sb.toString();
    }

    private static String parenthesize(String head, String... parts) {
        StringBuilder sb = new StringBuilder("(").append(head);
        for (String part : parts) {
            sb.append(' ').append(part);
        }
        return sb.append(')').toString();
    }
}
