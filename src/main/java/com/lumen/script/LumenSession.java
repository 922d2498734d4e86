package com.lumen.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.lumen.debug.Debug;
import com.lumen.script.LumenScript.ErrorReporter;
import com.lumen.script.LumenScript.OutputSink;
import com.lumen.script.parser.Diagnostic;
import com.lumen.script.parser.Environment;
import com.lumen.script.parser.Expr.ExprInterface;
import com.lumen.script.parser.Interpreter;
import com.lumen.script.parser.Lexer;
import com.lumen.script.parser.LumenRuntimeError;
import com.lumen.script.parser.NativeFunction;
import com.lumen.script.parser.Parser;
import com.lumen.script.parser.Resolver;
import com.lumen.script.parser.Statement.Stmt;
import com.lumen.script.parser.Token;
import com.lumen.script.parser.Value;

/**
 * One interpreter with its own global scope. Globals survive from one {@link #run(String)} to
 * the next, which is what a REPL host wants; {@link LumenScript#run(String)} uses a throwaway
 * session per call.
 */
public final class LumenSession implements AutoCloseable {
    private static final String TAG = "lumen.run";

    private final Environment globals = new Environment();
    private final Interpreter interpreter;
    private final ErrorReporter errorReporter;
    private final Set<String> nativeNames;
    private boolean closed = false;

    LumenSession(Map<String, NativeFunction> natives, OutputSink output, ErrorReporter errorReporter, int maxCallDepth) {
        this.errorReporter = errorReporter;
        for (Map.Entry<String, NativeFunction> e : natives.entrySet()) {
            globals.define(e.getKey(), Value.function(e.getValue()));
        }
        this.nativeNames = new HashSet<>(natives.keySet());
        this.interpreter = new Interpreter(globals, output, maxCallDepth);
    }

    /**
     * Scan, parse and resolve {@code source}; execute it only if all three passes were clean.
     * Every diagnostic is also handed to the session's error reporter.
     */
    public RunResult run(String source) {
        ensureOpen();
        if (source == null) throw new IllegalArgumentException("source must not be null");

        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Debug.get().d(TAG, "scanned " + tokens.size() + " tokens, " + lexer.errors().size() + " lexical errors");

        Parser parser = new Parser(tokens);
        List<Stmt> program = parser.parse();
        Debug.get().d(TAG, "parsed " + program.size() + " statements, " + parser.errors().size() + " syntax errors");

        Resolver resolver = new Resolver();
        Map<ExprInterface, Integer> locals = resolver.resolve(program);
        Debug.get().d(TAG, "resolved " + locals.size() + " local references, " + resolver.errors().size() + " resolution errors");

        List<Diagnostic> compileErrors = new ArrayList<>();
        compileErrors.addAll(lexer.errors());
        compileErrors.addAll(parser.errors());
        compileErrors.addAll(resolver.errors());
        if (!compileErrors.isEmpty()) {
            for (Diagnostic d : compileErrors) report(d);
            return RunResult.compileError(compileErrors);
        }

        interpreter.resolve(locals);
        try {
            interpreter.execute(program);
            return RunResult.ok();
        } catch (LumenRuntimeError e) {
            Diagnostic d = e.toDiagnostic();
            Debug.get().w(TAG, d + (e.callTrace().isEmpty() ? "" : " " + e.callTrace()));
            report(d);
            return RunResult.runtimeError(d);
        }
    }

    /**
     * Invoke a global function (or class) defined by an earlier run.
     *
     * @throws LumenRuntimeError if the name is undefined, not callable, or the call fails
     */
    public Value call(String functionName, List<Value> args) {
        ensureOpen();
        if (functionName == null || functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        List<Value> callArgs = (args == null) ? new ArrayList<Value>() : args;
        return interpreter.invokeForHost(functionName, callArgs);
    }

    /** Script-defined globals (natives left out), in definition order. */
    public Map<String, Value> globals() {
        ensureOpen();
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : globals.snapshot().entrySet()) {
            // A script may rebind a native's name; only the untouched binding is left out.
            if (nativeNames.contains(e.getKey()) && isInstalledNative(e.getKey(), e.getValue())) continue;
            out.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    private boolean isInstalledNative(String name, Value value) {
        return value.getType() == Value.Type.FUNCTION
                && value.asCallable() instanceof NativeFunction
                && ((NativeFunction) value.asCallable()).name().equals(name);
    }

    public boolean isClosed() {
        return closed;
    }

    /** Drops the global scope. Closures held by the host stay usable only through their own scopes. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        globals.clear();
        Debug.get().i(TAG, "session closed");
    }

    private void report(Diagnostic d) {
        if (errorReporter != null) errorReporter.report(d);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("session is closed");
    }
}
