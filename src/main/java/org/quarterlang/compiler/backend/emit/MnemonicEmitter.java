package org.quarterlang.compiler.backend.emit;

import org.quarterlang.compiler.ir.IrAlloc;
import org.quarterlang.compiler.ir.IrArithmetic;
import org.quarterlang.compiler.ir.IrBasicBlock;
import org.quarterlang.compiler.ir.IrCall;
import org.quarterlang.compiler.ir.IrCondJump;
import org.quarterlang.compiler.ir.IrFunction;
import org.quarterlang.compiler.ir.IrImm;
import org.quarterlang.compiler.ir.IrInstruction;
import org.quarterlang.compiler.ir.IrInstructionVisitor;
import org.quarterlang.compiler.ir.IrJump;
import org.quarterlang.compiler.ir.IrOperand;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.compiler.ir.IrReturn;
import org.quarterlang.compiler.ir.IrStore;
import org.quarterlang.compiler.ir.IrVar;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a CFG program as x86-64 flavoured assembly text.
 * <p>
 * Every function gets a label, a frame-pointer prologue and a frame of 8 bytes per slot.
 * Slot {@code n} lives at {@code [rbp-8*(n+1)]}; parameters are copied from the caller's pushes
 * at {@code [rbp+16+8*i]} into their slots. The output is text only and is not assembled.
 */
public class MnemonicEmitter {

    private static final String INDENT = "    ";

    /**
     * Emits all functions in emission order.
     *
     * @param program The program to render.
     * @return The assembly text.
     */
    public String emit(IrProgram program) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ").append(program.programName()).append('\n');
        sb.append("section .text").append('\n');
        for (IrFunction function : program.functions().values()) {
            sb.append('\n');
            emitFunction(function, sb);
        }
        return sb.toString();
    }

    private void emitFunction(IrFunction function, StringBuilder sb) {
        String label = labelOf(function.name());
        sb.append("global ").append(label).append('\n');
        sb.append(label).append(":\n");
        line(sb, "push rbp");
        line(sb, "mov rbp, rsp");
        if (function.slotCount() > 0) {
            line(sb, "sub rsp, " + 8 * function.slotCount());
        }
        for (int i = 0; i < function.parameters().size(); i++) {
            line(sb, "mov rax, qword [rbp+" + (16 + 8 * i) + "]");
            line(sb, "mov " + slotAddress(i) + ", rax");
        }

        InstructionEmitter emitter = new InstructionEmitter(function);
        for (IrBasicBlock block : function.blocks()) {
            sb.append(blockLabel(function, block.name())).append(":\n");
            for (IrInstruction instruction : block.instructions()) {
                for (String mnemonic : instruction.accept(emitter)) {
                    line(sb, mnemonic);
                }
            }
        }
        line(sb, "xor rax, rax");
        epilogue(sb);
    }

    private static void epilogue(StringBuilder sb) {
        line(sb, "mov rsp, rbp");
        line(sb, "pop rbp");
        line(sb, "ret");
    }

    private static void line(StringBuilder sb, String mnemonic) {
        sb.append(INDENT).append(mnemonic).append('\n');
    }

    private static String labelOf(String functionName) {
        return functionName.equals(IrProgram.ENTRY_FUNCTION) ? "_main" : functionName;
    }

    private static String blockLabel(IrFunction function, String blockName) {
        return "." + labelOf(function.name()) + "." + blockName;
    }

    private static String slotAddress(int slot) {
        return "qword [rbp-" + 8 * (slot + 1) + "]";
    }

    /**
     * Translates single instructions of one function into mnemonic lines.
     */
    private static final class InstructionEmitter implements IrInstructionVisitor<List<String>> {

        private final IrFunction function;

        InstructionEmitter(IrFunction function) {
            this.function = function;
        }

        @Override
        public List<String> visit(IrAlloc instruction) {
            return List.of("mov " + slotAddress(instruction.slot()) + ", 0");
        }

        @Override
        public List<String> visit(IrStore instruction) {
            return List.of(
                    "mov rax, " + operand(instruction.source()),
                    "mov " + address(instruction.destination()) + ", rax");
        }

        @Override
        public List<String> visit(IrArithmetic instruction) {
            List<String> lines = new ArrayList<>();
            lines.add("mov rax, " + operand(instruction.left()));
            switch (instruction.op()) {
                case ADD:
                    lines.add("add rax, " + operand(instruction.right()));
                    break;
                case SUBTRACT:
                    lines.add("sub rax, " + operand(instruction.right()));
                    break;
                case MULTIPLY:
                    lines.add("imul rax, " + operand(instruction.right()));
                    break;
                case DIVIDE:
                    lines.add("mov rcx, " + operand(instruction.right()));
                    lines.add("cqo");
                    lines.add("idiv rcx");
                    break;
                default:
                    throw new IllegalStateException("Unknown operator: " + instruction.op());
            }
            lines.add("mov " + address(instruction.destination()) + ", rax");
            return lines;
        }

        @Override
        public List<String> visit(IrJump instruction) {
            return List.of("jmp " + blockLabel(function, instruction.target()));
        }

        @Override
        public List<String> visit(IrCondJump instruction) {
            return List.of(
                    "mov rax, " + operand(instruction.left()),
                    "cmp rax, " + operand(instruction.right()),
                    "jne " + blockLabel(function, instruction.target()));
        }

        @Override
        public List<String> visit(IrCall instruction) {
            List<String> lines = new ArrayList<>();
            List<IrOperand> arguments = instruction.arguments();
            for (int i = arguments.size() - 1; i >= 0; i--) {
                lines.add("push " + operand(arguments.get(i)));
            }
            lines.add("call " + labelOf(instruction.callee()));
            if (!arguments.isEmpty()) {
                lines.add("add rsp, " + 8 * arguments.size());
            }
            if (instruction.resultTarget() != null) {
                lines.add("mov " + address(instruction.resultTarget()) + ", rax");
            }
            return lines;
        }

        @Override
        public List<String> visit(IrReturn instruction) {
            List<String> lines = new ArrayList<>();
            if (instruction.value() == null) {
                lines.add("xor rax, rax");
            } else {
                lines.add("mov rax, " + operand(instruction.value()));
            }
            lines.add("mov rsp, rbp");
            lines.add("pop rbp");
            lines.add("ret");
            return lines;
        }

        private String operand(IrOperand operand) {
            if (operand instanceof IrImm) {
                return Long.toString(((IrImm) operand).value());
            }
            return address(((IrVar) operand).name());
        }

        /**
         * Names without a slot in this function are resolved dynamically at run time; they are
         * rendered as symbolic memory references.
         */
        private String address(String name) {
            Integer slot = function.slots().get(name);
            return slot == null ? "qword [" + name + "]" : slotAddress(slot);
        }
    }
}
