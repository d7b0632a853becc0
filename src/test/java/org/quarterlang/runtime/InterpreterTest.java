package org.quarterlang.runtime;

import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.compiler.ir.IrReturn;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.fail;

public class InterpreterTest {

    private static final String FACTORIAL = """
        fn fact(n) {
          when n is 0 { return 1 }
          val m : int = n - 1
          val r : int = fact(m)
          return n * r
        }
        val f : int = fact(5)
        print(f)
        """;

    private final StringWriter output = new StringWriter();

    private IrProgram compile(String source) {
        try {
            return new Compiler().compile(List.of(source.split("\n")), "InterpreterTest");
        } catch (CompilationException e) {
            fail("Compilation errors: " + e.getMessage());
            return null;
        }
    }

    private Interpreter interpreter(String source, InterpreterOptions options) {
        return new Interpreter(compile(source), BuiltinRegistry.withDefaults(), options, new PrintWriter(output, true));
    }

    private Interpreter interpreter(String source) {
        return interpreter(source, InterpreterOptions.defaults());
    }

    private List<String> printedLines() {
        return output.toString().lines().collect(Collectors.toList());
    }

    @Test
    @Tag("unit")
    void runsRecursiveFunctionFollowingJumps() {
        interpreter(FACTORIAL).run();

        assertThat(printedLines()).containsExactly("120");
    }

    @Test
    @Tag("unit")
    void linearModeStopsAtFirstReturnReachedInEmissionOrder() {
        interpreter(FACTORIAL, InterpreterOptions.defaults().withMode(ExecutionMode.LINEAR)).run();

        assertThat(printedLines()).containsExactly("1");
    }

    @Test
    @Tag("unit")
    void loopBodyRunsOncePerIterationInGraphModeAndOnceInLinearMode() {
        String source = "val c : int = 0\nloop 0 to 3 { c = c + 1 }\nprint(c)";

        interpreter(source).run();
        interpreter(source, InterpreterOptions.defaults().withMode(ExecutionMode.LINEAR)).run();

        assertThat(printedLines()).containsExactly("3", "1");
    }

    @Test
    @Tag("unit")
    void linearModeStillReportsJumpsToListener() {
        Interpreter interpreter = interpreter("loop 0 to 1 { }", InterpreterOptions.defaults().withMode(ExecutionMode.LINEAR));
        List<String> seen = new ArrayList<>();
        interpreter.setListener((point, stack) -> seen.add(point.instruction().toString()));

        interpreter.run();

        assertThat(seen).containsExactly(
                "alloc i @0", "store i, 0", "jump loop.cond.0",
                "cjump i, 1, loop.body.0", "jump loop.exit.0",
                "add i, i, 1", "jump loop.cond.0");
    }

    @Test
    @Tag("unit")
    void calleeFrameBindsParametersAndLocals() {
        Interpreter interpreter = interpreter("""
            fn add(a, b) {
              val s : int = a + b
              return s
            }
            val x : int = add(2, 3)
            print(x)
            """);
        Map<String, Long> atReturn = new LinkedHashMap<>();
        List<Integer> depths = new ArrayList<>();
        interpreter.setListener((point, stack) -> {
            if (point.functionName().equals("add") && point.instruction() instanceof IrReturn) {
                atReturn.putAll(stack.top().bindings());
                depths.add(stack.depth());
            }
        });

        interpreter.run();

        assertThat(atReturn).containsExactly(Map.entry("a", 2L), Map.entry("b", 3L), Map.entry("s", 5L));
        assertThat(depths).containsExactly(2);
        assertThat(printedLines()).containsExactly("5");
        assertThat(interpreter.getCallStack().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void namesResolveThroughCallerFrames() {
        interpreter("fn show() { print(outer) }\nval outer : int = 41\nshow()").run();

        assertThat(printedLines()).containsExactly("41");
    }

    @Test
    @Tag("unit")
    void runReturnsValueOfEntryFunction() {
        Interpreter interpreter = interpreter("fn seven() { return 7 }\nval s : int = seven()\nreturn s");

        assertThat(interpreter.run()).isEqualTo(7L);
        assertThat(interpreter.call("seven", List.of())).isEqualTo(7L);
    }

    @Test
    @Tag("unit")
    void builtinsTakePrecedenceOverUserFunctions() {
        interpreter("fn print(x) { return 99 }\nprint(5)").run();

        assertThat(printedLines()).containsExactly("5");
    }

    @Test
    @Tag("unit")
    void rejectsArgumentCountMismatch() {
        Interpreter interpreter = interpreter("fn add(a, b) { return a }");

        assertThatThrownBy(() -> interpreter.call("add", List.of(1L)))
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Function 'add' expects 2 argument(s) but got 1.")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.ARGUMENT_COUNT_MISMATCH);
        assertThat(interpreter.getCallStack().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void reportsUnknownFunction() {
        assertThatThrownBy(() -> interpreter("missing(1)").run())
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Function not found: missing")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.FUNCTION_NOT_FOUND);
    }

    @Test
    @Tag("unit")
    void reportsUnresolvedName() {
        assertThatThrownBy(() -> interpreter("print(y)").run())
                .isInstanceOf(ExecutionException.class)
                .hasMessageContaining("Cannot resolve 'y'")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.UNRESOLVED_OPERAND);
    }

    @Test
    @Tag("unit")
    void reportsDivisionByZeroAndUnwindsFrames() {
        Interpreter interpreter = interpreter("fn half(d) {\n  val q : int = 10 / d\n  return q\n}\nval h : int = half(0)");

        assertThatThrownBy(interpreter::run)
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Division by zero in 'div q, 10, d'.")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.DIVISION_BY_ZERO);
        assertThat(interpreter.getCallStack().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void stopsUnboundedRecursionAtDepthCeiling() {
        Interpreter interpreter = interpreter(
                "fn down(n) {\n  val m : int = n + 1\n  val r : int = down(m)\n}\ndown(0)",
                new InterpreterOptions(ExecutionMode.GRAPH, 16));

        assertThatThrownBy(interpreter::run)
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Call stack overflow: maximum depth of 16 reached when calling 'down'.")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.CALL_DEPTH_EXCEEDED);
        assertThat(interpreter.getCallStack().depth()).isZero();
    }

    @Test
    @Tag("unit")
    void javaStackExhaustionBecomesCallDepthError() {
        Interpreter interpreter = interpreter(
                "fn down(n) {\n  val m : int = n + 1\n  val r : int = down(m)\n}\ndown(0)",
                new InterpreterOptions(ExecutionMode.GRAPH, Integer.MAX_VALUE));

        assertThatThrownBy(interpreter::run)
                .isInstanceOf(ExecutionException.class)
                .hasMessageStartingWith("Call stack overflow: the Java stack ran out at depth ")
                .extracting(e -> ((ExecutionException) e).getCode())
                .isEqualTo(RuntimeErrorCode.CALL_DEPTH_EXCEEDED);
        assertThat(interpreter.getCallStack().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void dodecagramBuiltinsAndSayAreCallable() {
        interpreter("val t : int = from_dg(10)\nsay(t)\nto_dg(t)\nval s : int = dg_add(t, 1)\nprint(s)").run();

        assertThat(printedLines()).containsExactly("12", "10", "13");
    }
}
