package com.lumen.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lumen.script.parser.Expr.Assign;
import com.lumen.script.parser.Expr.Binary;
import com.lumen.script.parser.Expr.ExprInterface;
import com.lumen.script.parser.Expr.FunctionLiteral;
import com.lumen.script.parser.Expr.GetExpr;
import com.lumen.script.parser.Expr.Grouping;
import com.lumen.script.parser.Expr.Literal;
import com.lumen.script.parser.Expr.Logical;
import com.lumen.script.parser.Expr.SetExpr;
import com.lumen.script.parser.Expr.Unary;
import com.lumen.script.parser.Expr.Variable;
import com.lumen.script.parser.Statement.Block;
import com.lumen.script.parser.Statement.ExprStmt;
import com.lumen.script.parser.Statement.FunctionStmt;
import com.lumen.script.parser.Statement.Stmt;
import com.lumen.script.parser.Statement.VarStmt;
import com.lumen.script.parser.Statement.While;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * Syntax errors are recorded in {@link #errors()}; the parser then discards tokens up to the
 * next statement boundary and carries on, so one pass reports every independent error.
 */
public class Parser {
    static final int MAX_ARGS = 255;

    /** Unwinds a malformed production back to {@link #declaration()}. */
    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }

    private final List<Token> tokens;
    private final List<Diagnostic> errors = new ArrayList<>();
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            Stmt stmt = declaration();
            if (stmt != null) statements.add(stmt);
        }
        return statements;
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    private Stmt declaration() {
        try {
            if (match(TokenType.CLASS)) return classDeclaration();
            if (check(TokenType.FUN) && checkNext(TokenType.IDENTIFIER)) {
                advance();
                return function("function");
            }
            if (match(TokenType.VAR)) return varDeclaration();
            return statement();
        } catch (ParseError error) {
            synchronize();
            return null;
        }
    }

    private Stmt classDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect class name.");

        Variable superclass = null;
        if (match(TokenType.LESS)) {
            consume(TokenType.IDENTIFIER, "Expect superclass name.");
            superclass = new Variable(previous());
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' before class body.");

        List<FunctionStmt> methods = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            methods.add(function("method"));
        }

        consume(TokenType.RIGHT_BRACE, "Expect '}' after class body.");
        return new Statement.ClassStmt(name, superclass, methods);
    }

    private FunctionStmt function(String kind) {
        Token name = consume(TokenType.IDENTIFIER, "Expect " + kind + " name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after " + kind + " name.");
        List<Token> params = parameters();
        consume(TokenType.LEFT_BRACE, "Expect '{' before " + kind + " body.");
        List<Stmt> body = block();
        return new FunctionStmt(name, params, body);
    }

    // Called with the '(' already consumed; consumes the closing ')'.
    private List<Token> parameters() {
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGS) {
                    error(peek(), "Can't have more than " + MAX_ARGS + " parameters.");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    private VarStmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        return exprStatement();
    }

    private Stmt printStatement() {
        ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return new Statement.PrintStmt(value);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) elseBranch = statement();
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");
        Stmt body = statement();
        return new While(condition, body);
    }

    // for (init; cond; inc) body
    // => { init; while (cond) body  [inc after each pass, fresh copy of init's var per pass] }
    private Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        List<Token> loopVars = Collections.emptyList();
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.VAR)) {
            VarStmt decl = varDeclaration(); // consumes first ';'
            initializer = decl;
            loopVars = Collections.singletonList(decl.name);
        } else {
            initializer = exprStatement();  // consumes first ';'
        }

        ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        Stmt body = statement();

        if (condition == null) condition = new Literal(Boolean.TRUE);
        Stmt loop = new While(condition, body, increment, loopVars);

        if (initializer != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(initializer);
            list.add(loop);
            loop = new Block(list);
        }

        return loop;
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt stmt = declaration();
            if (stmt != null) statements.add(stmt);
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt exprStatement() {
        ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private ExprInterface expression() { return assignment(); }

    private ExprInterface assignment() {
        ExprInterface expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            if (expr instanceof GetExpr) {
                GetExpr get = (GetExpr) expr;
                return new SetExpr(get.receiver, get.name, value);
            }
            // Parser is still in a sane state; report and keep going.
            error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token op = previous();
            ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private ExprInterface call() {
        ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expect property name after '.'.");
                expr = new GetExpr(expr, name);
            } else {
                break;
            }
        }

        return expr;
    }

    private ExprInterface finishCall(ExprInterface callee) {
        List<ExprInterface> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_ARGS) {
                    error(peek(), "Can't have more than " + MAX_ARGS + " arguments.");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }

        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NIL)) return new Literal(null);
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);

        if (match(TokenType.SUPER)) {
            Token keyword = previous();
            consume(TokenType.DOT, "Expect '.' after 'super'.");
            Token method = consume(TokenType.IDENTIFIER, "Expect superclass method name.");
            return new Expr.Super(keyword, method);
        }

        if (match(TokenType.THIS)) return new Expr.This(previous());
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr);
        }

        if (match(TokenType.FUN)) {
            Token keyword = previous();
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'fun'.");
            List<Token> params = parameters();
            consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
            List<Stmt> body = block();
            return new FunctionLiteral(keyword, params, body);
        }

        throw error(peek(), "Expect expression.");
    }

    // Discard tokens until something that looks like the start of the next statement.
    private void synchronize() {
        advance();

        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;

            switch (peek().type) {
                case CLASS:
                case FUN:
                case VAR:
                case FOR:
                case IF:
                case WHILE:
                case PRINT:
                case RETURN:
                    return;
                default:
                    break;
            }

            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        errors.add(Diagnostic.at(Diagnostic.Category.SYNTAX, token, message));
        return new ParseError();
    }
}
