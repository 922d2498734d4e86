package com.lumen.script.parser;

import java.util.List;
import java.util.Map;

public class LumenClass implements LumenCallable {
    static final String INITIALIZER = "init";

    final String name;
    final LumenClass superclass; // shared, may be null
    private final Map<String, UserFunction> methods;

    LumenClass(String name, LumenClass superclass, Map<String, UserFunction> methods) {
        this.name = name;
        this.superclass = superclass;
        this.methods = methods;
    }

    /** Own methods first, then up the superclass chain; null when nobody defines it. */
    UserFunction findMethod(String methodName) {
        for (LumenClass c = this; c != null; c = c.superclass) {
            UserFunction m = c.methods.get(methodName);
            if (m != null) return m;
        }
        return null;
    }

    public String name() {
        return name;
    }

    public LumenClass superclass() {
        return superclass;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        LumenInstance instance = new LumenInstance(this);
        UserFunction initializer = findMethod(INITIALIZER);
        if (initializer != null) {
            initializer.bind(instance).call(interpreter, arguments);
        }
        return Value.instance(instance);
    }

    @Override
    public int arity() {
        UserFunction initializer = findMethod(INITIALIZER);
        return (initializer == null) ? 0 : initializer.arity();
    }

    @Override
    public String toString() {
        return name;
    }
}
