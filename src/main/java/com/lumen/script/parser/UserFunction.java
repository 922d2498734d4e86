package com.lumen.script.parser;

import java.util.List;

import com.lumen.script.parser.Statement.Stmt;

/** A function declared in script code, paired with the scope it was declared in. */
public class UserFunction implements LumenCallable {
    final String name; // null for function literals
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;
    private final boolean isInitializer;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure, boolean isInitializer) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.isInitializer = isInitializer;
    }

    /** Method retrieved from an instance: same code, closure extended with {@code this}. */
    UserFunction bind(LumenInstance instance) {
        Environment withThis = closure.childScope();
        withThis.define("this", Value.instance(instance));
        return new UserFunction(name, params, body, withThis, isInitializer);
    }

    @Override
    public int arity() {
        return params.size();
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the function's closure (lexical scoping),
        // not of the caller's environment.
        Environment frame = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeBlock(body, frame);

        // Initializers always hand back the instance, whatever their body returned.
        if (isInitializer) return closure.getAt(0, "this");
        return completion.isReturn() ? completion.value() : Value.nil();
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return (name == null) ? "<fn>" : "<fn " + name + ">";
    }
}
