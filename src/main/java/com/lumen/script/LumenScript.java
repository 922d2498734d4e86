package com.lumen.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lumen.script.parser.Diagnostic;
import com.lumen.script.parser.NativeFunction;
import com.lumen.script.parser.Value;

/**
 * Core Lumen engine.
 *
 * - C-like syntax (var / fun / class / if / else / while / for / and / or / print / return)
 * - Types: nil, bool, number (double), string, function, class, instance
 * - Closures with lexical scoping, classes with single inheritance (init, this, super)
 * - Built-ins registered via registerFunction; core set: clock, len, str, typeof, sqrt, abs, pow
 *
 * Configuration is set on the engine and copied into each session when it is created.
 */
public class LumenScript {

    /** Functional interface for built-in functions. Throw any RuntimeException to fail the call. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Receives each line written by {@code print}. */
    public interface OutputSink {
        void print(String line);
    }

    /** Receives every diagnostic a run surfaces (lexical, syntax, resolution or runtime). */
    public interface ErrorReporter {
        void report(Diagnostic diagnostic);
    }

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private final Map<String, NativeFunction> functions = new LinkedHashMap<String, NativeFunction>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private OutputSink output = System.out::println;
    private ErrorReporter errorReporter = d -> System.err.println(d);

    public LumenScript() {
        registerCoreBuiltins();
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setOutput(OutputSink output) {
        this.output = (output == null) ? line -> { } : output;
    }

    public void setErrorReporter(ErrorReporter errorReporter) {
        this.errorReporter = (errorReporter == null) ? d -> { } : errorReporter;
    }

    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (arity < 0) throw new IllegalArgumentException("arity must not be negative: " + arity);
        if (fn == null) throw new IllegalArgumentException("fn must not be null");
        functions.put(name, new NativeFunction(name, arity, fn));
    }

    /** Fresh global scope populated with the registered built-ins. */
    public LumenSession newSession() {
        return new LumenSession(new LinkedHashMap<>(functions), output, errorReporter, maxCallDepth);
    }

    /** Runs {@code source} in a session of its own, torn down before returning. */
    public RunResult run(String source) {
        try (LumenSession session = newSession()) {
            return session.run(source);
        }
    }

    private void registerCoreBuiltins() {
        registerFunction("clock", 0, args -> Value.number(System.currentTimeMillis() / 1000.0));

        registerFunction("len", 1, args -> {
            Value v = args.get(0);
            if (v.getType() != Value.Type.STRING) {
                throw new IllegalArgumentException("len() expects a string, got " + typeName(v));
            }
            return Value.number(v.asString().length());
        });

        registerFunction("str", 1, args -> Value.string(args.get(0).toString()));

        registerFunction("typeof", 1, args -> Value.string(typeName(args.get(0))));

        registerFunction("sqrt", 1, args -> Value.number(Math.sqrt(number("sqrt", args.get(0)))));

        registerFunction("abs", 1, args -> Value.number(Math.abs(number("abs", args.get(0)))));

        registerFunction("pow", 2, args -> Value.number(Math.pow(number("pow", args.get(0)), number("pow", args.get(1)))));
    }

    private static double number(String fn, Value v) {
        if (v.getType() != Value.Type.NUMBER) {
            throw new IllegalArgumentException(fn + "() expects a number, got " + typeName(v));
        }
        return v.asNumber();
    }

    static String typeName(Value v) {
        switch (v.getType()) {
            case NIL:      return "nil";
            case BOOL:     return "bool";
            case NUMBER:   return "number";
            case STRING:   return "string";
            case FUNCTION: return "function";
            case CLASS:    return "class";
            case INSTANCE: return "instance";
            default:       return "unknown";
        }
    }
}
