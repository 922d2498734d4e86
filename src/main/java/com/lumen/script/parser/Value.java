package com.lumen.script.parser;

public class Value {
    public enum Type { NIL, BOOL, NUMBER, STRING, FUNCTION, CLASS, INSTANCE }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    private final Type type;
    private final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value function(LumenCallable fn) { return new Value(Type.FUNCTION, fn); }
    public static Value clazz(LumenClass c) { return new Value(Type.CLASS, c); }
    public static Value instance(LumenInstance i) { return new Value(Type.INSTANCE, i); }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Anything that can appear before {@code (...)}: functions and classes. */
    public LumenCallable asCallable() {
        if (type != Type.FUNCTION && type != Type.CLASS) {
            throw new IllegalStateException("Expected callable, got " + type);
        }
        return (LumenCallable) value;
    }

    public LumenClass asClass() {
        if (type != Type.CLASS) throw new IllegalStateException("Expected class, got " + type);
        return (LumenClass) value;
    }

    public LumenInstance asInstance() {
        if (type != Type.INSTANCE) throw new IllegalStateException("Expected instance, got " + type);
        return (LumenInstance) value;
    }

    /** Nil and false are falsy, everything else (0 and "" included) is truthy. */
    public boolean isTruthy() {
        if (type == Type.NIL) return false;
        if (type == Type.BOOL) return (boolean) value;
        return true;
    }

    /**
     * Language equality: nil only equals nil; numbers, bools and strings compare by value;
     * functions, classes and instances by identity.
     */
    public static boolean isEqual(Value a, Value b) {
        if (a.type != b.type) return false;
        switch (a.type) {
            case NIL:
                return true;
            case NUMBER:
                return a.asNumber() == b.asNumber();
            case BOOL:
            case STRING:
                return a.value.equals(b.value);
            default:
                return a.value == b.value;
        }
    }

    /** Printed form, as produced by {@code print}. */
    @Override
    public String toString() {
        switch (type) {
            case NIL:
                return "nil";
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return asString();
            default:
                return String.valueOf(value);
        }
    }

    // Largest magnitude below which every integral double converts to long exactly.
    private static final double EXACT_LONG_LIMIT = 9007199254740992.0;

    /** Integral values without a fractional part or exponent ("-0" kept); others as Double.toString. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) <= EXACT_LONG_LIMIT) {
            if (d == 0.0 && 1.0 / d < 0) return "-0";
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
