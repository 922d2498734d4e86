package com.lumen.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lumen.debug.Debug;
import com.lumen.script.LumenScript.OutputSink;
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
 * Tree-walking evaluator. Statements yield a {@link Completion}; expressions yield a {@link Value}.
 * Every failure is a {@link LumenRuntimeError}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    private static final String TAG = "lumen.native";

    private final Environment globals;
    Environment env;
    private final Map<ExprInterface, Integer> locals = new HashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final OutputSink output;
    private final int maxDepth;

    public Interpreter(Environment globals, OutputSink output, int maxDepth) {
        this.globals = globals;
        this.env = globals;
        this.output = output;
        this.maxDepth = maxDepth;
    }

    /** Installs hop counts computed by the {@link Resolver}; earlier entries stay valid. */
    public void resolve(Map<ExprInterface, Integer> resolved) {
        locals.putAll(resolved);
    }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) execute(stmt);
    }

    /** Calls a global function or class from host code, with the usual arity check. */
    public Value invokeForHost(String targetName, List<Value> args) {
        Token name = new Token(TokenType.IDENTIFIER, targetName, null, 0);
        Value callee = globals.get(name);
        return invoke(callee, args, name);
    }

    private Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    Completion executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            for (Stmt s : statements) {
                Completion c = execute(s);
                if (c.isReturn()) return c;
            }
            return Completion.NORMAL;
        } finally {
            this.env = previous;
        }
    }

    private Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitPrintStmt(PrintStmt stmt) {
        Value value = eval(stmt.expression);
        output.print(value.toString());
        return Completion.NORMAL;
    }

    @Override
    public Completion visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.nil() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) return execute(stmt.thenBranch);
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            Completion c;
            if (stmt.iterationVars.isEmpty()) {
                c = execute(stmt.body);
            } else {
                // Fresh copies of the loop variables for this pass; closures made in the body
                // keep this pass's values.
                Environment iteration = env.childScope();
                for (Token var : stmt.iterationVars) {
                    iteration.define(var.lexeme, env.getAt(0, var.lexeme));
                }
                c = executeBlock(Collections.singletonList(stmt.body), iteration);
                if (c.isReturn()) return c;
                for (Token var : stmt.iterationVars) {
                    env.assignAt(0, var, iteration.getAt(0, var.lexeme));
                }
            }
            if (c.isReturn()) return c;
            if (stmt.increment != null) eval(stmt.increment);
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunctionStmt(FunctionStmt stmt) {
        UserFunction fn = new UserFunction(stmt.name.lexeme, stmt.params, stmt.body, env, false);
        env.define(stmt.name.lexeme, Value.function(fn));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        Value value = (stmt.value == null) ? Value.nil() : eval(stmt.value);
        return Completion.returned(value);
    }

    @Override
    public Completion visitClassStmt(ClassStmt stmt) {
        String className = stmt.name.lexeme;

        LumenClass superclass = null;
        if (stmt.superclass != null) {
            Value sc = eval(stmt.superclass);
            if (sc.getType() != Value.Type.CLASS) {
                throw new LumenRuntimeError(stmt.superclass.name, "Superclass must be a class.");
            }
            superclass = sc.asClass();
        }

        // Methods of a subclass close over a scope holding "super".
        Environment methodScope = env;
        if (superclass != null) {
            methodScope = env.childScope();
            methodScope.define("super", Value.clazz(superclass));
        }

        Map<String, UserFunction> methods = new LinkedHashMap<>();
        for (FunctionStmt fn : stmt.methods) {
            String mName = fn.name.lexeme;
            boolean initializer = LumenClass.INITIALIZER.equals(mName);
            methods.put(mName, new UserFunction(mName, fn.params, fn.body, methodScope, initializer));
        }

        env.define(className, Value.clazz(new LumenClass(className, superclass, methods)));
        return Completion.NORMAL;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return Value.number((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    @Override
    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.expression);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return lookUpVariable(expr.name, expr);
    }

    @Override
    public Value visitThisExpr(This expr) {
        return lookUpVariable(expr.keyword, expr);
    }

    private Value lookUpVariable(Token name, ExprInterface expr) {
        Integer distance = locals.get(expr);
        if (distance != null) {
            return env.getAt(distance, name.lexeme);
        }
        return globals.get(name);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        Integer distance = locals.get(expr);
        if (distance != null) {
            env.assignAt(distance, expr.name, value);
        } else {
            globals.assign(expr.name, value);
        }
        return value;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                requireNumber(expr.operator, right);
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);

        switch (expr.operator.type) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                throw new LumenRuntimeError(expr.operator, "Operands must be two numbers or two strings.");
            case MINUS:
                requireNumbers(expr.operator, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(expr.operator, left, right);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(expr.operator, left, right);
                if (right.asNumber() == 0.0) {
                    throw new LumenRuntimeError(expr.operator, "Division by zero.");
                }
                return Value.number(left.asNumber() / right.asNumber());

            case GREATER:
                requireNumbers(expr.operator, left, right);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(expr.operator, left, right);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumbers(expr.operator, left, right);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(expr.operator, left, right);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                return Value.bool(Value.isEqual(left, right));
            case BANG_EQUAL:
                return Value.bool(!Value.isEqual(left, right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) {
            args.add(eval(a));
        }

        return invoke(callee, args, expr.paren);
    }

    private Value invoke(Value callee, List<Value> args, Token site) {
        if (callee.getType() != Value.Type.FUNCTION && callee.getType() != Value.Type.CLASS) {
            throw new LumenRuntimeError(site, "Can only call functions and classes.");
        }
        LumenCallable fn = callee.asCallable();

        if (args.size() != fn.arity()) {
            throw new LumenRuntimeError(site, "Expected " + fn.arity() + " arguments but got " + args.size() + ".");
        }
        if (callStack.size() >= maxDepth) {
            throw new LumenRuntimeError(site, "Stack overflow.");
        }

        CallFrame frame = new CallFrame(fn.toString(), site.line);
        callStack.push(frame);
        try {
            return fn.call(this, args);
        } catch (LumenRuntimeError e) {
            e.addFrame(frame);
            throw e;
        } catch (StackOverflowError e) {
            throw new LumenRuntimeError(site, "Stack overflow.");
        } catch (RuntimeException e) {
            // Natives signal bad arguments with plain exceptions.
            if (!(fn instanceof NativeFunction)) throw e;
            Debug.get().e(TAG, fn + " failed on line " + site.line, e);
            throw new LumenRuntimeError(site, fn + ": " + e.getMessage());
        } finally {
            callStack.pop();
        }
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        Value object = eval(expr.receiver);
        if (object.getType() == Value.Type.INSTANCE) {
            return object.asInstance().get(expr.name);
        }
        throw new LumenRuntimeError(expr.name, "Only instances have properties.");
    }

    @Override
    public Value visitSetExpr(SetExpr expr) {
        Value object = eval(expr.receiver);
        if (object.getType() != Value.Type.INSTANCE) {
            throw new LumenRuntimeError(expr.name, "Only instances have fields.");
        }
        Value value = eval(expr.value);
        object.asInstance().set(expr.name, value);
        return value;
    }

    @Override
    public Value visitSuperExpr(Super expr) {
        int distance = locals.get(expr);
        LumenClass superclass = env.getAt(distance, "super").asClass();
        // "this" always sits one scope inside the one holding "super".
        LumenInstance instance = env.getAt(distance - 1, "this").asInstance();

        UserFunction method = superclass.findMethod(expr.method.lexeme);
        if (method == null) {
            throw new LumenRuntimeError(expr.method, "Undefined property '" + expr.method.lexeme + "'.");
        }
        return Value.function(method.bind(instance));
    }

    @Override
    public Value visitFunctionLiteralExpr(FunctionLiteral expr) {
        return Value.function(new UserFunction(null, expr.params, expr.body, env, false));
    }

    private static void requireNumber(Token operator, Value operand) {
        if (operand.getType() == Value.Type.NUMBER) return;
        throw new LumenRuntimeError(operator, "Operand must be a number.");
    }

    private static void requireNumbers(Token operator, Value left, Value right) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw new LumenRuntimeError(operator, "Operands must be numbers.");
    }
}
