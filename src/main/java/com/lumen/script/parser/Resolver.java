package com.lumen.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

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
import com.lumen.script.parser.Statement.Block;
import com.lumen.script.parser.Statement.ClassStmt;
import com.lumen.script.parser.Statement.ExprStmt;
import com.lumen.script.parser.Statement.FunctionStmt;
import com.lumen.script.parser.Statement.If;
import com.lumen.script.parser.Statement.PrintStmt;
import com.lumen.script.parser.Statement.ReturnStmt;
import com.lumen.script.parser.Statement.Stmt;
import com.lumen.script.parser.Statement.StmtVisitor;
import com.lumen.script.parser.Statement.VarStmt;
import com.lumen.script.parser.Statement.While;

/**
 * Static pass that maps every local variable reference to the number of scopes between the
 * reference and its declaration. References not found in any local scope are left out of the
 * table and looked up in the global scope at runtime.
 *
 * The scope stack mirrors the environments the {@link Interpreter} creates, one for one:
 * blocks, function bodies, loop iterations, the "super" scope of a subclass and the "this"
 * scope of its methods.
 */
public class Resolver implements ExprVisitor<Void>, StmtVisitor<Void> {

    private enum FunctionType { NONE, FUNCTION, METHOD, INITIALIZER }

    private enum ClassType { NONE, CLASS, SUBCLASS }

    // name -> finished resolving its initializer?
    private final List<Map<String, Boolean>> scopes = new ArrayList<>();
    private final Map<ExprInterface, Integer> resolved = new HashMap<>();
    private final List<Diagnostic> errors = new ArrayList<>();
    private FunctionType currentFunction = FunctionType.NONE;
    private ClassType currentClass = ClassType.NONE;

    public Map<ExprInterface, Integer> resolve(List<Stmt> program) {
        for (Stmt stmt : program) resolve(stmt);
        return Collections.unmodifiableMap(resolved);
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    private void resolve(Stmt stmt) {
        stmt.accept(this);
    }

    private void resolve(ExprInterface expr) {
        expr.accept(this);
    }

    private void resolveAll(List<Stmt> statements) {
        for (Stmt s : statements) resolve(s);
    }

    private void beginScope() {
        scopes.add(new HashMap<String, Boolean>());
    }

    private void endScope() {
        scopes.remove(scopes.size() - 1);
    }

    private Map<String, Boolean> innermost() {
        return scopes.get(scopes.size() - 1);
    }

    private void declare(Token name) {
        if (scopes.isEmpty()) return;
        Map<String, Boolean> scope = innermost();
        if (scope.containsKey(name.lexeme)) {
            error(name, "Already a variable with this name in this scope.");
        }
        scope.put(name.lexeme, Boolean.FALSE);
    }

    private void define(Token name) {
        if (scopes.isEmpty()) return;
        innermost().put(name.lexeme, Boolean.TRUE);
    }

    private void resolveLocal(ExprInterface expr, Token name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            if (scopes.get(i).containsKey(name.lexeme)) {
                resolved.put(expr, scopes.size() - 1 - i);
                return;
            }
        }
        // Not found: global.
    }

    private void resolveFunction(List<Token> params, List<Stmt> body, FunctionType type) {
        FunctionType enclosingFunction = currentFunction;
        currentFunction = type;

        beginScope();
        for (Token param : params) {
            declare(param);
            define(param);
        }
        resolveAll(body);
        endScope();

        currentFunction = enclosingFunction;
    }

    private void error(Token token, String message) {
        errors.add(Diagnostic.at(Diagnostic.Category.RESOLUTION, token, message));
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitBlockStmt(Block stmt) {
        beginScope();
        resolveAll(stmt.statements);
        endScope();
        return null;
    }

    @Override
    public Void visitClassStmt(ClassStmt stmt) {
        ClassType enclosingClass = currentClass;
        currentClass = ClassType.CLASS;

        declare(stmt.name);
        define(stmt.name);

        if (stmt.superclass != null) {
            if (stmt.name.lexeme.equals(stmt.superclass.name.lexeme)) {
                error(stmt.superclass.name, "A class can't inherit from itself.");
            } else {
                currentClass = ClassType.SUBCLASS;
                resolve(stmt.superclass);
            }
        }

        if (currentClass == ClassType.SUBCLASS) {
            beginScope();
            innermost().put("super", Boolean.TRUE);
        }

        beginScope();
        innermost().put("this", Boolean.TRUE);

        for (FunctionStmt method : stmt.methods) {
            FunctionType type = LumenClass.INITIALIZER.equals(method.name.lexeme)
                    ? FunctionType.INITIALIZER
                    : FunctionType.METHOD;
            resolveFunction(method.params, method.body, type);
        }

        endScope();
        if (currentClass == ClassType.SUBCLASS) endScope();

        currentClass = enclosingClass;
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitFunctionStmt(FunctionStmt stmt) {
        // Defined before the body so the function can call itself.
        declare(stmt.name);
        define(stmt.name);
        resolveFunction(stmt.params, stmt.body, FunctionType.FUNCTION);
        return null;
    }

    @Override
    public Void visitIfStmt(If stmt) {
        resolve(stmt.condition);
        resolve(stmt.thenBranch);
        if (stmt.elseBranch != null) resolve(stmt.elseBranch);
        return null;
    }

    @Override
    public Void visitPrintStmt(PrintStmt stmt) {
        resolve(stmt.expression);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt stmt) {
        if (currentFunction == FunctionType.NONE) {
            error(stmt.keyword, "Can't return from top-level code.");
        }
        if (stmt.value != null) resolve(stmt.value);
        return null;
    }

    @Override
    public Void visitVarStmt(VarStmt stmt) {
        declare(stmt.name);
        if (stmt.initializer != null) {
            resolve(stmt.initializer);
        }
        define(stmt.name);
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        resolve(stmt.condition);
        if (stmt.iterationVars.isEmpty()) {
            resolve(stmt.body);
        } else {
            beginScope();
            for (Token var : stmt.iterationVars) {
                innermost().put(var.lexeme, Boolean.TRUE);
            }
            resolve(stmt.body);
            endScope();
        }
        if (stmt.increment != null) resolve(stmt.increment);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitAssignExpr(Assign expr) {
        resolve(expr.value);
        resolveLocal(expr, expr.name);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        resolve(expr.callee);
        for (ExprInterface argument : expr.arguments) resolve(argument);
        return null;
    }

    @Override
    public Void visitGetExpr(GetExpr expr) {
        resolve(expr.receiver);
        return null;
    }

    @Override
    public Void visitGroupingExpr(Grouping expr) {
        resolve(expr.expression);
        return null;
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        resolve(expr.left);
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitSetExpr(SetExpr expr) {
        resolve(expr.value);
        resolve(expr.receiver);
        return null;
    }

    @Override
    public Void visitSuperExpr(Super expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword, "Can't use 'super' outside of a class.");
        } else if (currentClass != ClassType.SUBCLASS) {
            error(expr.keyword, "Can't use 'super' in a class with no superclass.");
        } else {
            resolveLocal(expr, expr.keyword);
        }
        return null;
    }

    @Override
    public Void visitThisExpr(This expr) {
        if (currentClass == ClassType.NONE) {
            error(expr.keyword, "Can't use 'this' outside of a class.");
            return null;
        }
        resolveLocal(expr, expr.keyword);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        resolve(expr.right);
        return null;
    }

    @Override
    public Void visitVariableExpr(Variable expr) {
        if (!scopes.isEmpty() && Boolean.FALSE.equals(innermost().get(expr.name.lexeme))) {
            error(expr.name, "Can't read local variable in its own initializer.");
        }
        resolveLocal(expr, expr.name);
        return null;
    }

    @Override
    public Void visitFunctionLiteralExpr(FunctionLiteral expr) {
        resolveFunction(expr.params, expr.body, FunctionType.FUNCTION);
        return null;
    }
}
