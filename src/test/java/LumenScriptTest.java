import org.junit.jupiter.api.Test;

import com.lumen.script.LumenScript;
import com.lumen.script.LumenSession;
import com.lumen.script.RunResult;
import com.lumen.script.parser.Diagnostic;
import com.lumen.script.parser.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LumenScriptTest {

    private final List<String> out = new ArrayList<>();
    private final List<Diagnostic> errors = new ArrayList<>();

    private LumenScript engine() {
        LumenScript ls = new LumenScript();
        ls.setOutput(out::add);
        ls.setErrorReporter(errors::add);
        return ls;
    }

    private List<String> runOk(String src) {
        RunResult r = engine().run(src);
        assertTrue(r.isOk(), "Expected clean run, got " + r);
        assertTrue(errors.isEmpty(), "Unexpected diagnostics: " + errors);
        return out;
    }

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void print_integralNumbersDropTrailingZero() {
        runOk(
                "print 1 + 2;\n" +
                "print 7 / 2;\n" +
                "print -0.5 * 4;\n"
        );
        assertEquals(List.of("3", "3.5", "-2"), out);
    }

    @Test
    void arithmetic_precedence() {
        runOk(
                "print 2 + 3 * 4;\n" +
                "print (2 + 3) * 4;\n" +
                "print 10 / 2 + 6;\n" +
                "print 10 - 4 - 3;\n" +
                "print -(1 + 2);\n"
        );
        assertEquals(List.of("14", "20", "11", "3", "-3"), out);
    }

    @Test
    void strings_concatenateAndPrintRaw() {
        runOk(
                "var a = \"lu\";\n" +
                "var b = \"men\";\n" +
                "print a + b;\n" +
                "print \"\";\n"
        );
        assertEquals(List.of("lumen", ""), out);
    }

    @Test
    void comparisonsAndEquality() {
        runOk(
                "print 3 < 5;\n" +
                "print 3 <= 3;\n" +
                "print 5 > 3;\n" +
                "print 5 >= 6;\n" +
                "print (1 + 2) == 3;\n" +
                "print \"a\" == \"a\";\n" +
                "print nil == nil;\n" +
                "print nil == false;\n" +
                "print 1 == \"1\";\n" +
                "print 1 != 2;\n"
        );
        assertEquals(List.of("true", "true", "true", "false", "true", "true", "true", "false", "false", "true"), out);
    }

    @Test
    void truthiness_onlyNilAndFalseAreFalsy() {
        runOk(
                "if (0) print \"zero\";\n" +
                "if (\"\") print \"empty\";\n" +
                "if (nil) print \"nil\"; else print \"no nil\";\n" +
                "if (false) print \"false\"; else print \"no false\";\n" +
                "print !nil;\n" +
                "print !!0;\n"
        );
        assertEquals(List.of("zero", "empty", "no nil", "no false", "true", "true"), out);
    }

    @Test
    void logicalOperators_shortCircuitAndReturnOperand() {
        runOk(
                "print nil or \"fallback\";\n" +
                "print 1 and 2;\n" +
                "print false and doesNotExist();\n" +
                "print true or doesNotExist();\n"
        );
        assertEquals(List.of("fallback", "2", "false", "true"), out);
    }

    @Test
    void whileAndForLoops() {
        runOk(
                "var i = 0;\n" +
                "while (i < 3) { print i; i = i + 1; }\n" +
                "for (var j = 10; j < 13; j = j + 1) print j;\n" +
                "var k = 0;\n" +
                "for (; k < 2;) k = k + 1;\n" +
                "print k;\n"
        );
        assertEquals(List.of("0", "1", "2", "10", "11", "12", "2"), out);
    }

    @Test
    void blocksShadowAndRestore() {
        runOk(
                "var a = \"outer\";\n" +
                "{\n" +
                "  var a = \"inner\";\n" +
                "  print a;\n" +
                "}\n" +
                "print a;\n"
        );
        assertEquals(List.of("inner", "outer"), out);
    }

    @Test
    void functions_recursionAndReturn() {
        runOk(
                "fun fib(n) {\n" +
                "  if (n < 2) return n;\n" +
                "  return fib(n - 1) + fib(n - 2);\n" +
                "}\n" +
                "print fib(15);\n" +
                "fun nothing() {}\n" +
                "print nothing();\n" +
                "print fib;\n" +
                "print clock;\n"
        );
        assertEquals(List.of("610", "nil", "<fn fib>", "<native fn clock>"), out);
    }

    @Test
    void functionLiterals_areFirstClass() {
        runOk(
                "var twice = fun (f, x) { return f(f(x)); };\n" +
                "print twice(fun (n) { return n * 3; }, 2);\n" +
                "print fun () {};\n"
        );
        assertEquals(List.of("18", "<fn>"), out);
    }

    @Test
    void globalRedeclarationIsAllowed() {
        runOk(
                "var a = 1;\n" +
                "var a = a + 1;\n" +
                "print a;\n"
        );
        assertEquals(List.of("2"), out);
    }

    @Test
    void coreBuiltins() {
        runOk(
                "print len(\"hello\");\n" +
                "print str(12) + \"!\";\n" +
                "print typeof(nil);\n" +
                "print typeof(1);\n" +
                "print typeof(\"s\");\n" +
                "print typeof(true);\n" +
                "print typeof(len);\n" +
                "print sqrt(16);\n" +
                "print abs(-2.5);\n" +
                "print pow(2, 10);\n" +
                "print clock() > 0;\n"
        );
        assertEquals(List.of("5", "12!", "nil", "number", "string", "bool", "function", "4", "2.5", "1024", "true"), out);
    }

    @Test
    void registerFunction_hostBuiltinIsCallable() {
        LumenScript ls = engine();
        ls.registerFunction("double", 1, args -> Value.number(args.get(0).asNumber() * 2));

        RunResult r = ls.run("print double(21);");

        assertTrue(r.isOk());
        assertEquals(List.of("42"), out);
    }

    @Test
    void registerFunction_rejectsBadArguments() {
        LumenScript ls = new LumenScript();
        assertThrows(IllegalArgumentException.class, () -> ls.registerFunction("", 0, args -> Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> ls.registerFunction("f", -1, args -> Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> ls.registerFunction("f", 0, null));
    }

    @Test
    void run_isolatesGlobalsBetweenCalls() {
        LumenScript ls = engine();
        assertTrue(ls.run("var a = 1;").isOk());

        RunResult r = ls.run("print a;");

        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status());
        assertEquals("Undefined variable 'a'.", r.diagnostics().get(0).message());
    }

    @Test
    void session_globalsReflectScriptState() {
        try (LumenSession session = engine().newSession()) {
            assertTrue(session.run("var x = 10; x = x + 5; var y = x;").isOk());

            Map<String, Value> env = session.globals();
            assertEquals(15.0, v(env, "x").asNumber(), 1e-9);
            assertEquals(15.0, v(env, "y").asNumber(), 1e-9);
            assertFalse(env.containsKey("clock"));
        }
    }

    @Test
    void sameSourceTwice_printsTheSame() {
        String src = String.join("\n",
                "class Acc { init() { this.total = 0; } add(n) { this.total = this.total + n; return this; } }",
                "var a = Acc();",
                "for (var i = 1; i <= 4; i = i + 1) a.add(i * 1.5);",
                "print a.total;",
                "print typeof(a);",
                ""
        );
        runOk(src);
        List<String> first = new ArrayList<>(out);
        out.clear();
        runOk(src);

        assertEquals(List.of("15", "instance"), first);
        assertEquals(first, out);
    }

    @Test
    void exitCodes_followStatus() {
        assertEquals(0, engine().run("print 1;").exitCode());
        assertEquals(65, engine().run("print ;").exitCode());
        assertEquals(70, engine().run("print 1 / 0;").exitCode());
    }

    @Test
    void print_largeIntegralNumbersStayPlain() {
        runOk(
                "print 10000000;\n" +
                "print 12345678;\n" +
                "print 1000000 * 1000000;\n" +
                "print -0;\n" +
                "print 0.1 + 0.2;\n"
        );
        assertEquals(List.of("10000000", "12345678", "1000000000000", "-0", "0.30000000000000004"), out);
    }
}
