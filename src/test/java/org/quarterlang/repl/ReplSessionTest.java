package org.quarterlang.repl;

import org.quarterlang.console.StreamConsole;
import org.quarterlang.runtime.ExecutionMode;
import org.quarterlang.runtime.InterpreterOptions;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class ReplSessionTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final ReplSession session = new ReplSession(BuiltinRegistry.withDefaults(), InterpreterOptions.defaults(), "qtr> ");

    private StreamConsole console(String input) {
        return new StreamConsole(new BufferedReader(new StringReader(input)), new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    @Tag("unit")
    void evaluatesEachLineOnItsOwn() {
        int failures = session.run(console("val x : int = 2\nprint(x)\n\nprint(3)\nexit\nprint(4)\n"));

        assertThat(failures).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Cannot resolve 'x': it is not bound in any frame and is not an integer.");
        assertThat(out.toString()).contains("3").doesNotContain("4");
    }

    @Test
    @Tag("unit")
    void reportsCompileErrorsAndKeepsGoing() {
        int failures = session.run(console("val : int = 1\nval y : int = 6 * 7; print(y)\n"));

        assertThat(failures).isEqualTo(1);
        assertThat(err.toString()).contains("Error: [ERROR] <repl>:1: Expected value name after 'val'.");
        assertThat(out.toString()).contains("42");
    }

    @Test
    @Tag("unit")
    void evaluateReportsSuccess() {
        StreamConsole console = console("");

        assertThat(session.evaluate("print(nothing)", console)).isFalse();
        assertThat(session.evaluate("val m : int = min(8, 5); print(m)", console)).isTrue();
        assertThat(out.toString()).contains("5");
    }

    @Test
    @Tag("unit")
    void stopsAtEndOfInputAndOnQuit() {
        assertThat(session.run(console("print(1)"))).isZero();
        assertThat(session.run(console("QUIT\nmissing()\n"))).isZero();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void recursionBeyondJavaStackFailsOnlyThatLine() {
        ReplSession deep = new ReplSession(BuiltinRegistry.withDefaults(), new InterpreterOptions(ExecutionMode.GRAPH, 1_000_000), "qtr> ");

        int failures = deep.run(console("fn d(n) { val m : int = n + 1; val r : int = d(m) }; d(0)\nprint(7)\n"));

        assertThat(failures).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Call stack overflow: the Java stack ran out at depth ");
        assertThat(out.toString()).contains("7");
    }
}
