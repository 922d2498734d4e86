package com.lumen.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope: name -> value, plus the enclosing scope. The global scope has no parent.
 *
 * Scopes are shared, never copied: every closure created in a scope holds this same object, so a
 * write through one closure is visible through the others.
 */
public class Environment {
    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Root (global) scope. */
    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in this scope. Redefinition overwrites, which only the global scope ever sees. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(Token name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name.lexeme)) return e.values.get(name.lexeme);
        }
        throw new LumenRuntimeError(name, "Undefined variable '" + name.lexeme + "'.");
    }

    public void assign(Token name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name.lexeme)) {
                e.values.put(name.lexeme, value);
                return;
            }
        }
        throw new LumenRuntimeError(name, "Undefined variable '" + name.lexeme + "'.");
    }

    // -------------------------
    // Resolved access (hop counts from the resolver)
    // -------------------------

    public Value getAt(int distance, String name) {
        Map<String, Value> scope = ancestor(distance).values;
        if (!scope.containsKey(name)) {
            throw new IllegalStateException("Resolved variable '" + name + "' missing " + distance + " scopes up");
        }
        return scope.get(name);
    }

    public void assignAt(int distance, Token name, Value value) {
        ancestor(distance).values.put(name.lexeme, value);
    }

    Environment ancestor(int distance) {
        Environment e = this;
        for (int i = 0; i < distance; i++) {
            if (e.parent == null) {
                throw new IllegalStateException("Scope chain shorter than resolved distance " + distance);
            }
            e = e.parent;
        }
        return e;
    }

    /** Copy of this scope's own bindings (enclosing scopes excluded), in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Drops every binding; used on session teardown. */
    public void clear() {
        values.clear();
    }
}
