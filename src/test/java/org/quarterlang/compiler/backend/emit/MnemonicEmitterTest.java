package org.quarterlang.compiler.backend.emit;

import org.quarterlang.compiler.Compiler;
import org.quarterlang.compiler.api.CompilationException;
import org.quarterlang.compiler.ir.IrProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

public class MnemonicEmitterTest {

    private IrProgram compile(String source) {
        try {
            return new Compiler().compile(List.of(source.split("\n")), "emit.q");
        } catch (CompilationException e) {
            fail("Compilation errors: " + e.getMessage());
            return null;
        }
    }

    @Test
    @Tag("unit")
    void emitsFunctionWithParametersAndCall() {
        String asm = new MnemonicEmitter().emit(compile("fn add(a, b) { return a + b }\nval x : int = add(2, 3)"));

        assertThat(asm).isEqualTo(String.join("\n",
                "; emit.q",
                "section .text",
                "",
                "global add",
                "add:",
                "    push rbp",
                "    mov rbp, rsp",
                "    sub rsp, 24",
                "    mov rax, qword [rbp+16]",
                "    mov qword [rbp-8], rax",
                "    mov rax, qword [rbp+24]",
                "    mov qword [rbp-16], rax",
                ".add.entry:",
                "    mov qword [rbp-24], 0",
                "    mov rax, qword [rbp-8]",
                "    add rax, qword [rbp-16]",
                "    mov qword [rbp-24], rax",
                "    mov rax, qword [rbp-24]",
                "    mov rsp, rbp",
                "    pop rbp",
                "    ret",
                "    xor rax, rax",
                "    mov rsp, rbp",
                "    pop rbp",
                "    ret",
                "",
                "global _main",
                "_main:",
                "    push rbp",
                "    mov rbp, rsp",
                "    sub rsp, 8",
                "._main.entry:",
                "    mov qword [rbp-8], 0",
                "    push 3",
                "    push 2",
                "    call add",
                "    add rsp, 16",
                "    mov qword [rbp-8], rax",
                "    xor rax, rax",
                "    mov rsp, rbp",
                "    pop rbp",
                "    ret",
                ""));
    }

    @Test
    @Tag("unit")
    void emitsBranchesDivisionAndUnslottedNames() {
        String asm = new MnemonicEmitter().emit(compile("val q : int = 9 / 3\nwhen q is 3 { print(g) }"));

        assertThat(asm)
                .contains("    mov rcx, 3\n    cqo\n    idiv rcx\n")
                .contains("    mov rax, qword [rbp-8]\n    cmp rax, 3\n    jne ._main.when.end.0\n")
                .contains("._main.when.then.0:\n    push qword [g]\n    call print\n    add rsp, 8\n")
                .contains("._main.when.end.0:\n");
    }

    @Test
    @Tag("unit")
    void emitsLoopJumpsWithinFunction() {
        String asm = new MnemonicEmitter().emit(compile("fn spin() {\n  loop 0 to 2 { }\n  return\n}"));

        assertThat(asm)
                .contains("    jmp .spin.loop.cond.0\n")
                .contains("    jne .spin.loop.body.0\n    jmp .spin.loop.exit.0\n")
                .contains(".spin.loop.exit.0:\n    xor rax, rax\n    mov rsp, rbp\n    pop rbp\n    ret\n");
    }
}
