package com.lumen.script;

import java.util.Collections;
import java.util.List;

import com.lumen.script.parser.Diagnostic;

/** Outcome of one {@code run(source)}: OK, or the diagnostics that stopped it. */
public final class RunResult {

    public enum Status { OK, COMPILE_ERROR, RUNTIME_ERROR }

    private static final RunResult OK = new RunResult(Status.OK, Collections.<Diagnostic>emptyList());

    private final Status status;
    private final List<Diagnostic> diagnostics;

    private RunResult(Status status, List<Diagnostic> diagnostics) {
        this.status = status;
        this.diagnostics = diagnostics;
    }

    public static RunResult ok() {
        return OK;
    }

    /** Lexical, syntax and resolution errors, in the order they were found. */
    public static RunResult compileError(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            throw new IllegalArgumentException("compile error needs at least one diagnostic");
        }
        return new RunResult(Status.COMPILE_ERROR, Collections.unmodifiableList(diagnostics));
    }

    public static RunResult runtimeError(Diagnostic diagnostic) {
        if (diagnostic == null) throw new IllegalArgumentException("diagnostic must not be null");
        return new RunResult(Status.RUNTIME_ERROR, Collections.singletonList(diagnostic));
    }

    public Status status() { return status; }

    public boolean isOk() { return status == Status.OK; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    /** Process exit code for a command-line host: 0, 65 (EX_DATAERR) or 70 (EX_SOFTWARE). */
    public int exitCode() {
        switch (status) {
            case COMPILE_ERROR: return 65;
            case RUNTIME_ERROR: return 70;
            default:            return 0;
        }
    }

    @Override
    public String toString() {
        return status + (diagnostics.isEmpty() ? "" : " " + diagnostics);
    }
}
