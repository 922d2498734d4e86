package com.lumen.script.parser;

import java.util.List;

import com.lumen.script.LumenScript.BuiltinFunction;

/** Host-implemented function exposed as a global. */
public final class NativeFunction implements LumenCallable {
    private final String name;
    private final int arity;
    private final BuiltinFunction body;

    public NativeFunction(String name, int arity, BuiltinFunction body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    public String name() {
        return name;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        Value out = body.call(arguments);
        return (out == null) ? Value.nil() : out;
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}
