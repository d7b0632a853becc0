package org.quarterlang.runtime;

import org.quarterlang.compiler.ir.IrAlloc;
import org.quarterlang.compiler.ir.IrArithmetic;
import org.quarterlang.compiler.ir.IrArithmeticOp;
import org.quarterlang.compiler.ir.IrBasicBlock;
import org.quarterlang.compiler.ir.IrCall;
import org.quarterlang.compiler.ir.IrCondJump;
import org.quarterlang.compiler.ir.IrFunction;
import org.quarterlang.compiler.ir.IrInstruction;
import org.quarterlang.compiler.ir.IrInstructionVisitor;
import org.quarterlang.compiler.ir.IrJump;
import org.quarterlang.compiler.ir.IrOperand;
import org.quarterlang.compiler.ir.IrProgram;
import org.quarterlang.compiler.ir.IrReturn;
import org.quarterlang.compiler.ir.IrStore;
import org.quarterlang.runtime.builtins.BuiltinFunction;
import org.quarterlang.runtime.builtins.BuiltinRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Executes a CFG program with a stack of call frames.
 * <p>
 * The program is never modified. Every call pushes a fresh {@link CallFrame} with the arguments
 * bound to the parameter names, runs the function according to the configured {@link ExecutionMode},
 * and pops the frame again, also when an error unwinds the call. A call resolves to a built-in
 * first and to a user function second.
 * <p>
 * An interpreter is single-threaded and not reentrant from other threads.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final IrProgram program;
    private final BuiltinRegistry builtins;
    private final InterpreterOptions options;
    private final PrintWriter out;
    private final CallStack callStack = new CallStack();
    private ExecutionListener listener;

    /**
     * Creates a new interpreter.
     *
     * @param program The program to execute.
     * @param builtins The built-in functions available to call instructions.
     * @param options The execution settings.
     * @param out The stream receiving program output.
     */
    public Interpreter(IrProgram program, BuiltinRegistry builtins, InterpreterOptions options, PrintWriter out) {
        this.program = program;
        this.builtins = builtins;
        this.options = options;
        this.out = out;
    }

    /**
     * Installs a listener that is notified before every instruction, replacing any earlier one.
     * @param listener The listener, or null to remove it.
     */
    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public CallStack getCallStack() {
        return callStack;
    }

    public InterpreterOptions getOptions() {
        return options;
    }

    /**
     * Runs the synthesized entry function.
     * @return The value returned by the entry function, 0 if it has no return.
     */
    public long run() {
        return call(IrProgram.ENTRY_FUNCTION, List.of());
    }

    /**
     * Calls a function by name.
     *
     * @param name The name of a built-in or a function of the program.
     * @param arguments The argument values, one per parameter.
     * @return The returned value, 0 if the function ends without returning a value.
     * @throws ExecutionException if the function does not exist, the argument count does not match,
     *                            the call stack is full (by the configured ceiling or because the Java
     *                            stack ran out) or execution of the body fails.
     */
    public long call(String name, List<Long> arguments) {
        Optional<BuiltinFunction> builtin = builtins.lookup(name);
        if (builtin.isPresent()) {
            return builtin.get().invoke(arguments, out);
        }

        IrFunction function = program.function(name).orElseThrow(() ->
                new ExecutionException(RuntimeErrorCode.FUNCTION_NOT_FOUND, "Function not found: " + name));
        if (arguments.size() != function.parameters().size()) {
            throw new ExecutionException(RuntimeErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "Function '" + name + "' expects " + function.parameters().size()
                            + " argument(s) but got " + arguments.size() + ".");
        }
        if (callStack.depth() >= options.maxCallDepth()) {
            throw new ExecutionException(RuntimeErrorCode.CALL_DEPTH_EXCEEDED,
                    "Call stack overflow: maximum depth of " + options.maxCallDepth() + " reached when calling '" + name + "'.");
        }

        CallFrame frame = new CallFrame(name);
        for (int i = 0; i < arguments.size(); i++) {
            frame.bind(function.parameters().get(i), arguments.get(i));
        }
        callStack.push(frame);
        LOG.trace("Enter '{}' with {} at depth {}", name, arguments, callStack.depth());
        try {
            long result = options.mode() == ExecutionMode.GRAPH
                    ? executeGraph(function, frame)
                    : executeLinear(function, frame);
            LOG.trace("Leave '{}' with {}", name, result);
            return result;
        } catch (StackOverflowError e) {
            throw new ExecutionException(RuntimeErrorCode.CALL_DEPTH_EXCEEDED,
                    "Call stack overflow: the Java stack ran out at depth " + callStack.depth() + " when calling '" + name + "'.");
        } finally {
            callStack.pop();
        }
    }

    private long executeGraph(IrFunction function, CallFrame frame) {
        List<IrBasicBlock> blocks = function.blocks();
        int blockIndex = 0;
        int ip = 0;
        while (blockIndex < blocks.size()) {
            IrBasicBlock block = blocks.get(blockIndex);
            if (ip >= block.instructions().size()) {
                // Fall through to the next block in emission order.
                blockIndex++;
                ip = 0;
                continue;
            }
            IrInstruction instruction = block.instructions().get(ip);
            Step step = dispatch(function, block, ip, instruction, frame);
            switch (step.kind) {
                case NEXT:
                    ip++;
                    break;
                case JUMP:
                    blockIndex = function.indexOfBlock(step.target);
                    if (blockIndex < 0) {
                        throw new IllegalStateException("Jump to unknown block '" + step.target + "' in function '" + function.name() + "'.");
                    }
                    ip = 0;
                    break;
                case RETURN:
                    return step.value;
                default:
                    throw new IllegalStateException("Unknown step: " + step.kind);
            }
        }
        return 0;
    }

    private long executeLinear(IrFunction function, CallFrame frame) {
        for (IrBasicBlock block : function.blocks()) {
            List<IrInstruction> instructions = block.instructions();
            for (int ip = 0; ip < instructions.size(); ip++) {
                IrInstruction instruction = instructions.get(ip);
                if (instruction.isJump()) {
                    notifyListener(function, block, ip, instruction, frame);
                    LOG.trace("Recorded '{}' in {}:{} without transferring control", instruction, function.name(), block.name());
                    continue;
                }
                Step step = dispatch(function, block, ip, instruction, frame);
                if (step.kind == Step.Kind.RETURN) {
                    return step.value;
                }
            }
        }
        return 0;
    }

    private Step dispatch(IrFunction function, IrBasicBlock block, int ip, IrInstruction instruction, CallFrame frame) {
        notifyListener(function, block, ip, instruction, frame);
        return instruction.accept(new InstructionExecutor());
    }

    private void notifyListener(IrFunction function, IrBasicBlock block, int ip, IrInstruction instruction, CallFrame frame) {
        frame.moveTo(block.name(), ip);
        if (listener != null) {
            listener.beforeInstruction(new ExecutionPoint(function.name(), block.name(), ip, instruction), callStack);
        }
    }

    /**
     * Executes one instruction against the top frame and tells the block walk how to continue.
     */
    private final class InstructionExecutor implements IrInstructionVisitor<Step> {

        @Override
        public Step visit(IrAlloc instruction) {
            callStack.assign(instruction.name(), 0);
            return Step.NEXT;
        }

        @Override
        public Step visit(IrStore instruction) {
            callStack.assign(instruction.destination(), callStack.resolve(instruction.source()));
            return Step.NEXT;
        }

        @Override
        public Step visit(IrArithmetic instruction) {
            long left = callStack.resolve(instruction.left());
            long right = callStack.resolve(instruction.right());
            if (instruction.op() == IrArithmeticOp.DIVIDE && right == 0) {
                throw new ExecutionException(RuntimeErrorCode.DIVISION_BY_ZERO,
                        "Division by zero in '" + instruction + "'.");
            }
            callStack.assign(instruction.destination(), instruction.op().apply(left, right));
            return Step.NEXT;
        }

        @Override
        public Step visit(IrJump instruction) {
            return Step.jump(instruction.target());
        }

        @Override
        public Step visit(IrCondJump instruction) {
            long left = callStack.resolve(instruction.left());
            long right = callStack.resolve(instruction.right());
            return left != right ? Step.jump(instruction.target()) : Step.NEXT;
        }

        @Override
        public Step visit(IrCall instruction) {
            List<Long> arguments = new ArrayList<>(instruction.arguments().size());
            for (IrOperand argument : instruction.arguments()) {
                arguments.add(callStack.resolve(argument));
            }
            long result = call(instruction.callee(), arguments);
            if (instruction.resultTarget() != null) {
                callStack.assign(instruction.resultTarget(), result);
            }
            return Step.NEXT;
        }

        @Override
        public Step visit(IrReturn instruction) {
            long value = instruction.value() == null ? 0 : callStack.resolve(instruction.value());
            return Step.returning(value);
        }
    }

    /**
     * The continuation after one instruction.
     */
    private static final class Step {
        enum Kind { NEXT, JUMP, RETURN }

        static final Step NEXT = new Step(Kind.NEXT, null, 0);

        final Kind kind;
        final String target;
        final long value;

        private Step(Kind kind, String target, long value) {
            this.kind = kind;
            this.target = target;
            this.value = value;
        }

        static Step jump(String target) {
            return new Step(Kind.JUMP, target, 0);
        }

        static Step returning(long value) {
            return new Step(Kind.RETURN, null, value);
        }
    }
}
