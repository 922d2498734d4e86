package com.lumen.script.parser;

/**
 * Outcome of executing a statement: either it finished normally, or a {@code return} ran and
 * the carried value must travel up to the nearest call boundary.
 */
public final class Completion {
    public static final Completion NORMAL = new Completion(false, Value.nil());

    private final boolean returned;
    private final Value value;

    private Completion(boolean returned, Value value) {
        this.returned = returned;
        this.value = value;
    }

    public static Completion returned(Value value) {
        return new Completion(true, value);
    }

    public boolean isReturn() { return returned; }

    public Value value() { return value; }
}
