package com.lumen.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class LumenInstance {
    private final LumenClass klass;
    private final Map<String, Value> fields = new LinkedHashMap<>();

    LumenInstance(LumenClass klass) {
        this.klass = klass;
    }

    public LumenClass klass() {
        return klass;
    }

    /** Fields shadow methods; methods come back bound to this instance. */
    Value get(Token name) {
        if (fields.containsKey(name.lexeme)) {
            return fields.get(name.lexeme);
        }

        UserFunction method = klass.findMethod(name.lexeme);
        if (method != null) return Value.function(method.bind(this));

        throw new LumenRuntimeError(name, "Undefined property '" + name.lexeme + "'.");
    }

    void set(Token name, Value value) {
        fields.put(name.lexeme, value);
    }

    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return klass.name + " instance";
    }
}
