import org.junit.jupiter.api.Test;

import com.lumen.script.LumenScript;
import com.lumen.script.RunResult;
import com.lumen.script.parser.Diagnostic;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LumenScriptClassTest {

    private final List<String> out = new ArrayList<>();
    private final List<Diagnostic> errors = new ArrayList<>();

    private RunResult run(String src) {
        LumenScript ls = new LumenScript();
        ls.setOutput(out::add);
        ls.setErrorReporter(errors::add);
        return ls.run(src);
    }

    private void runOk(String src) {
        RunResult r = run(src);
        assertTrue(r.isOk(), "Expected clean run, got " + r);
    }

    @Test
    void init_setsFieldsAndMethodsSeeThem() {
        runOk(String.join("\n",
                "class Point {",
                "  init(x, y) {",
                "    this.x = x;",
                "    this.y = y;",
                "  }",
                "  sum() { return this.x + this.y; }",
                "}",
                "var p = Point(2, 3);",
                "print p.sum();",
                "p.x = 10;",
                "print p.sum();",
                "print p;",
                "print Point;",
                ""
        ));
        assertEquals(List.of("5", "13", "Point instance", "Point"), out);
    }

    @Test
    void fieldsCanBeAddedFromOutside() {
        runOk(String.join("\n",
                "class Bag {}",
                "var b = Bag();",
                "b.item = \"apple\";",
                "print b.item;",
                ""
        ));
        assertEquals(List.of("apple"), out);
    }

    @Test
    void inheritedInitializer_runsForSubclass() {
        runOk(String.join("\n",
                "class A {",
                "  init(n) { this.n = n; }",
                "}",
                "class B < A {}",
                "print B(5).n;",
                ""
        ));
        assertEquals(List.of("5"), out);
    }

    @Test
    void superCall_resolvesAgainstDeclaringClass() {
        runOk(String.join("\n",
                "class A {",
                "  method() { print \"A method\"; }",
                "}",
                "class B < A {",
                "  method() { print \"B method\"; }",
                "  test() { super.method(); }",
                "}",
                "class C < B {}",
                "C().test();",
                ""
        ));
        assertEquals(List.of("A method"), out);
    }

    @Test
    void overriddenMethod_chainsThroughSuper() {
        runOk(String.join("\n",
                "class Animal {",
                "  speak() { return \"...\"; }",
                "}",
                "class Dog < Animal {",
                "  speak() { return \"woof \" + super.speak(); }",
                "}",
                "print Dog().speak();",
                ""
        ));
        assertEquals(List.of("woof ..."), out);
    }

    @Test
    void boundMethod_remembersItsInstance() {
        runOk(String.join("\n",
                "class Person {",
                "  init(name) { this.name = name; }",
                "  greet() { print \"hi \" + this.name; }",
                "}",
                "var g = Person(\"ada\").greet;",
                "g();",
                "print g;",
                ""
        ));
        assertEquals(List.of("hi ada", "<fn greet>"), out);
    }

    @Test
    void callingInitDirectly_returnsInstance() {
        runOk(String.join("\n",
                "class Foo {",
                "  init() { this.count = 0; return; }",
                "}",
                "var foo = Foo();",
                "foo.count = 7;",
                "print foo.init() == foo;",
                "print foo.count;",
                ""
        ));
        assertEquals(List.of("true", "0"), out);
    }

    @Test
    void fieldShadowsMethod() {
        runOk(String.join("\n",
                "class Box {",
                "  value() { return \"method\"; }",
                "}",
                "var b = Box();",
                "b.value = \"field\";",
                "print b.value;",
                ""
        ));
        assertEquals(List.of("field"), out);
    }

    @Test
    void undefinedProperty_isRuntimeError() {
        RunResult r = run(String.join("\n",
                "class Empty {}",
                "print Empty().missing;",
                ""
        ));
        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status());
        assertEquals("[line 2] Error at 'missing': Undefined property 'missing'.", r.diagnostics().get(0).toString());
    }

    @Test
    void superclassMustBeAClass() {
        RunResult r = run(String.join("\n",
                "var NotAClass = \"nope\";",
                "class Sub < NotAClass {}",
                ""
        ));
        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status());
        assertEquals("Superclass must be a class.", r.diagnostics().get(0).message());
    }

    @Test
    void constructorArity_followsInit() {
        RunResult r = run(String.join("\n",
                "class P { init(a, b) {} }",
                "P(1);",
                ""
        ));
        assertEquals(RunResult.Status.RUNTIME_ERROR, r.status());
        assertEquals("Expected 2 arguments but got 1.", r.diagnostics().get(0).message());
    }

    @Test
    void propertyAccessOnNonInstance_isRuntimeError() {
        RunResult r = run("var s = \"str\"; print s.length;");
        assertEquals("Only instances have properties.", r.diagnostics().get(0).message());

        errors.clear();
        r = run("var n = 1; n.x = 2;");
        assertEquals("Only instances have fields.", r.diagnostics().get(0).message());
    }
}
