package com.lumen.script.parser;

/**
 * One reportable problem found while running a script.
 *
 * Rendered as {@code [line N] Error<where>: <message>} where {@code where} is
 * " at 'lexeme'", " at end" or empty.
 */
public final class Diagnostic {

    public enum Category { LEXICAL, SYNTAX, RESOLUTION, RUNTIME }

    private final Category category;
    private final int line;
    private final String where;
    private final String message;

    public Diagnostic(Category category, int line, String where, String message) {
        this.category = category;
        this.line = line;
        this.where = (where == null) ? "" : where;
        this.message = message;
    }

    /** Diagnostic pointing at a token: " at end" for EOF, " at 'lexeme'" otherwise. */
    public static Diagnostic at(Category category, Token token, String message) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new Diagnostic(category, token.line, where, message);
    }

    public Category category() { return category; }
    public int line() { return line; }
    public String where() { return where; }
    public String message() { return message; }

    @Override
    public String toString() {
        return "[line " + line + "] Error" + where + ": " + message;
    }
}
