import org.junit.jupiter.api.Test;

import com.lumen.script.LumenScript;
import com.lumen.script.RunResult;
import com.lumen.script.parser.Diagnostic;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LumenScriptErrorHandlingTest {

    private final List<String> out = new ArrayList<>();
    private final List<Diagnostic> reported = new ArrayList<>();

    private LumenScript engine() {
        LumenScript ls = new LumenScript();
        ls.setOutput(out::add);
        ls.setErrorReporter(reported::add);
        return ls;
    }

    private RunResult run(String src) {
        return engine().run(src);
    }

    private static List<String> texts(RunResult r) {
        List<String> t = new ArrayList<>();
        for (Diagnostic d : r.diagnostics()) t.add(d.toString());
        return t;
    }

    private void assertRuntimeError(String src, String expectedMessage) {
        RunResult r = run(src);
        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status(), "for source: " + src);
        assertEquals(1, r.diagnostics().size());
        assertEquals(Diagnostic.Category.RUNTIME, r.diagnostics().get(0).category());
        assertEquals(expectedMessage, r.diagnostics().get(0).message());
    }

    // -------------------------
    // Compile-time
    // -------------------------

    @Test
    void unexpectedCharacter_isLexicalAndNothingRuns() {
        RunResult r = run("print 1; @ print 2;");

        assertEquals(RunResult.Status.COMPILE_ERROR, r.status());
        assertEquals(List.of("[line 1] Error: Unexpected character '@'."), texts(r));
        assertEquals(Diagnostic.Category.LEXICAL, r.diagnostics().get(0).category());
        assertTrue(out.isEmpty());
    }

    @Test
    void lexicalAndSyntaxErrors_areReportedTogether() {
        RunResult r = run(String.join("\n",
                "print \"abc",
                ";",
                "print 1 +;",
                ""
        ));

        assertEquals(RunResult.Status.COMPILE_ERROR, r.status());
        assertEquals(List.of(
                "[line 1] Error: Unterminated string.",
                "[line 2] Error at ';': Expect expression.",
                "[line 3] Error at ';': Expect expression."
        ), texts(r));
        assertEquals(Diagnostic.Category.LEXICAL, r.diagnostics().get(0).category());
        assertEquals(Diagnostic.Category.SYNTAX, r.diagnostics().get(1).category());
    }

    @Test
    void parser_recoversAndReportsEveryStatementError() {
        RunResult r = run(String.join("\n",
                "var = 1;",
                "print 2;",
                "print (3;",
                "var ok = 4;",
                ""
        ));

        assertEquals(List.of(
                "[line 1] Error at '=': Expect variable name.",
                "[line 3] Error at ';': Expect ')' after expression."
        ), texts(r));
        assertTrue(out.isEmpty(), "Nothing may run after a syntax error");
    }

    @Test
    void missingSemicolonAtEnd_pointsAtEnd() {
        RunResult r = run("print 1");
        assertEquals(List.of("[line 1] Error at end: Expect ';' after value."), texts(r));
    }

    @Test
    void invalidAssignmentTarget_doesNotDerailParsing() {
        RunResult r = run(String.join("\n",
                "1 = 2;",
                "var a = 1;",
                "a + a = 3;",
                ""
        ));
        assertEquals(List.of(
                "[line 1] Error at '=': Invalid assignment target.",
                "[line 3] Error at '=': Invalid assignment target."
        ), texts(r));
    }

    @Test
    void tooManyArguments_isReported() {
        StringBuilder src = new StringBuilder("fun f() {}\nf(");
        for (int i = 0; i < 256; i++) {
            if (i > 0) src.append(", ");
            src.append(i);
        }
        src.append(");");

        RunResult r = run(src.toString());

        assertEquals(RunResult.Status.COMPILE_ERROR, r.status());
        assertEquals(1, r.diagnostics().size());
        assertEquals("Can't have more than 255 arguments.", r.diagnostics().get(0).message());
    }

    @Test
    void resolutionErrors_areAllCollected() {
        RunResult r = run(String.join("\n",
                "return 1;",
                "{ var a = 1; var a = 2; }",
                "{ var b = b; }",
                "print this;",
                "fun f() { super.x(); }",
                "class C < C {}",
                "class D { m() { return super.m(); } }",
                ""
        ));

        assertEquals(RunResult.Status.COMPILE_ERROR, r.status());
        assertEquals(List.of(
                "[line 1] Error at 'return': Can't return from top-level code.",
                "[line 2] Error at 'a': Already a variable with this name in this scope.",
                "[line 3] Error at 'b': Can't read local variable in its own initializer.",
                "[line 4] Error at 'this': Can't use 'this' outside of a class.",
                "[line 5] Error at 'super': Can't use 'super' outside of a class.",
                "[line 6] Error at 'C': A class can't inherit from itself.",
                "[line 7] Error at 'super': Can't use 'super' in a class with no superclass."
        ), texts(r));
        for (Diagnostic d : r.diagnostics()) {
            assertEquals(Diagnostic.Category.RESOLUTION, d.category());
        }
    }

    @Test
    void reporter_receivesSameDiagnosticsAsResult() {
        RunResult r = run("print ;\nprint ;");
        assertEquals(2, reported.size());
        assertEquals(r.diagnostics(), reported);
    }

    // -------------------------
    // Runtime
    // -------------------------

    @Test
    void runtimeError_haltsButEarlierOutputStays() {
        RunResult r = run(String.join("\n",
                "print \"before\";",
                "print 1 + \"x\";",
                "print \"after\";",
                ""
        ));

        assertEquals(List.of("before"), out);
        assertEquals(List.of("[line 2] Error at '+': Operands must be two numbers or two strings."), texts(r));
        assertEquals(1, reported.size());
    }

    @Test
    void operatorTypeErrors() {
        assertRuntimeError("print -\"a\";", "Operand must be a number.");
        assertRuntimeError("print 1 < \"a\";", "Operands must be numbers.");
        assertRuntimeError("print nil * 2;", "Operands must be numbers.");
    }

    @Test
    void divisionByZero_isRuntimeError() {
        assertRuntimeError("print 1 / 0;", "Division by zero.");
    }

    @Test
    void undefinedVariable_readAndWrite() {
        RunResult r = run("print y;");
        assertEquals(List.of("[line 1] Error at 'y': Undefined variable 'y'."), texts(r));

        assertRuntimeError("z = 1;", "Undefined variable 'z'.");
    }

    @Test
    void callErrors() {
        assertRuntimeError("\"x\"();", "Can only call functions and classes.");
        assertRuntimeError("fun f(a) {}\nf(1, 2);", "Expected 1 arguments but got 2.");
        assertRuntimeError("clock(1);", "Expected 0 arguments but got 1.");
    }

    @Test
    void nativeFailure_becomesRuntimeError() {
        assertRuntimeError("len(1);", "<native fn len>: len() expects a string, got number");
    }

    @Test
    void unboundedRecursion_isStackOverflow() {
        assertRuntimeError("fun r() { r(); }\nr();", "Stack overflow.");
    }

    @Test
    void maxCallDepth_isConfigurable() {
        String src = String.join("\n",
                "fun down(n) {",
                "  if (n == 0) return 0;",
                "  return down(n - 1);",
                "}",
                ""
        );
        LumenScript ls = engine();
        ls.setMaxCallDepth(10);

        assertTrue(ls.run(src + "print down(9);").isOk());
        RunResult r = ls.run(src + "print down(10);");
        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status());
        assertEquals("Stack overflow.", r.diagnostics().get(0).message());

        assertThrows(IllegalArgumentException.class, () -> ls.setMaxCallDepth(0));
    }

    @Test
    void runtimeErrorInsideFunction_pointsAtFailingLine() {
        RunResult r = run(String.join("\n",
                "fun inner() {",
                "  return nil - 1;",
                "}",
                "fun outer() { return inner(); }",
                "outer();",
                ""
        ));
        assertEquals(List.of("[line 2] Error at '-': Operands must be numbers."), texts(r));
    }

    @Test
    void compileErrorResult_needsDiagnostics() {
        assertThrows(IllegalArgumentException.class, () -> RunResult.compileError(new ArrayList<Diagnostic>()));
    }

    @Test
    void unterminatedString_stillParsesAndResolvesTheRest() {
        RunResult r = run(String.join("\n",
                "var s = \"abc",
                ";",
                "{ var b = b; }",
                ""
        ));

        assertEquals(RunResult.Status.COMPILE_ERROR, r.status());
        assertEquals(List.of(
                "[line 1] Error: Unterminated string.",
                "[line 2] Error at ';': Expect expression.",
                "[line 3] Error at 'b': Can't read local variable in its own initializer."
        ), texts(r));
        assertEquals(Diagnostic.Category.LEXICAL, r.diagnostics().get(0).category());
        assertEquals(Diagnostic.Category.RESOLUTION, r.diagnostics().get(2).category());
    }
}
