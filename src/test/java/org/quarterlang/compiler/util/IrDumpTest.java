package org.quarterlang.compiler.util;

import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class IrDumpTest {

    @Test
    @Tag("unit")
    void rendersFunctionsSlotsBlocksAndInstructions() throws CompilationException {
        String text = IrDump.render(new Compiler().compile(
                List.of("fn inc(n) { return n + 1 }", "when 1 is 2 { inc(1) }"), "dump.q"));

        assertThat(text).isEqualTo(String.join("\n",
                "; program dump.q",
                "",
                "function inc(n) slots=2",
                "  ; n@0, $t0@1",
                "  entry:",
                "    alloc $t0 @1",
                "    add $t0, n, 1",
                "    ret $t0",
                "",
                "function <main>() slots=0",
                "  entry:",
                "    cjump 1, 2, when.end.0",
                "  when.then.0:",
                "    call inc(1)",
                "  when.end.0:",
                ""));
    }
}
