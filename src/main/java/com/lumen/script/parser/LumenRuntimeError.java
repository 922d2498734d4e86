package com.lumen.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Fatal error raised while executing a program; carries the token to report against. */
public class LumenRuntimeError extends RuntimeException {
    private static final int MAX_TRACE = 64;

    private final Token token;
    private final List<String> callTrace = new ArrayList<>();

    public LumenRuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

    public Token token() {
        return token;
    }

    /** Script call frames the error unwound through, innermost first. */
    public List<String> callTrace() {
        return Collections.unmodifiableList(callTrace);
    }

    void addFrame(CallFrame frame) {
        if (callTrace.size() < MAX_TRACE) callTrace.add(frame.toString());
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.at(Diagnostic.Category.RUNTIME, token, getMessage());
    }
}
