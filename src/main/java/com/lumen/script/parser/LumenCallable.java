package com.lumen.script.parser;

import java.util.List;

/** Anything a call expression can invoke: natives, user functions and classes. */
public interface LumenCallable {
    int arity();

    Value call(Interpreter interpreter, List<Value> arguments);
}
