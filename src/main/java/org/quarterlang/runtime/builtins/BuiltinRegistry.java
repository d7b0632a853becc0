package org.quarterlang.runtime.builtins;

import org.quarterlang.runtime.ExecutionException;
import org.quarterlang.runtime.RuntimeErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The named built-in functions available to call instructions. A registry is constructed
 * explicitly and handed to each interpreter; there is no shared global instance.
 */
public final class BuiltinRegistry {

    /**
     * The built-in that writes its arguments to the program output.
     */
    public static final String PRINT = "print";

    /**
     * The radix of the dodecagram built-ins.
     */
    public static final int DODECAGRAM_RADIX = 12;

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinRegistry.class);

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    /**
     * Creates an empty registry.
     */
    public BuiltinRegistry() {
    }

    /**
     * Creates a registry with {@code print} and its alias {@code say}, {@code max}, {@code min}
     * and the dodecagram built-ins {@code to_dg}, {@code from_dg} and {@code dg_add}.
     * @return The new registry.
     */
    public static BuiltinRegistry withDefaults() {
        BuiltinRegistry registry = new BuiltinRegistry();
        registry.register(PRINT, BuiltinRegistry::print);
        registry.register("say", BuiltinRegistry::print);
        registry.register("max", (args, out) -> {
            requireArguments("max", args);
            return Collections.max(args);
        });
        registry.register("min", (args, out) -> {
            requireArguments("min", args);
            return Collections.min(args);
        });
        registry.register("to_dg", BuiltinRegistry::toDodecagram);
        registry.register("from_dg", (args, out) -> {
            requireExactly("from_dg", 1, args);
            return fromDodecagram(args.get(0));
        });
        registry.register("dg_add", (args, out) -> {
            requireExactly("dg_add", 2, args);
            try {
                return Math.addExact(args.get(0), args.get(1));
            } catch (ArithmeticException e) {
                throw new ExecutionException(RuntimeErrorCode.ARGUMENT_OUT_OF_RANGE,
                        "Built-in 'dg_add' overflows for " + args.get(0) + " and " + args.get(1) + ".");
            }
        });
        return registry;
    }

    /**
     * Registers a built-in under a name, replacing an earlier registration of the same name.
     *
     * @param name The name used at call sites.
     * @param function The implementation.
     */
    public void register(String name, BuiltinFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Built-in name must not be blank.");
        }
        if (functions.put(name, function) != null) {
            LOG.debug("Replaced built-in '{}'", name);
        }
    }

    public Optional<BuiltinFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    private static long print(List<Long> arguments, PrintWriter out) {
        for (Long value : arguments) {
            out.println(value);
        }
        out.flush();
        return 0;
    }

    /**
     * Writes the base-12 form of each argument on its own line, digits ten and eleven as {@code a} and {@code b}.
     * @return The first argument.
     */
    private static long toDodecagram(List<Long> arguments, PrintWriter out) {
        requireArguments("to_dg", arguments);
        for (Long value : arguments) {
            out.println(Long.toString(value, DODECAGRAM_RADIX));
        }
        out.flush();
        return arguments.get(0);
    }

    /**
     * Reads the decimal digits of a value as base-12 digits, so {@code from_dg(10)} is 12.
     */
    private static long fromDodecagram(long digits) {
        try {
            return Long.parseLong(Long.toString(digits), DODECAGRAM_RADIX);
        } catch (NumberFormatException e) {
            throw new ExecutionException(RuntimeErrorCode.ARGUMENT_OUT_OF_RANGE,
                    "Built-in 'from_dg' cannot read " + digits + " as a base-12 number.");
        }
    }

    private static void requireExactly(String name, int count, List<Long> arguments) {
        if (arguments.size() != count) {
            throw new ExecutionException(RuntimeErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "Built-in '" + name + "' expects " + count + " argument(s) but got " + arguments.size() + ".");
        }
    }

    private static void requireArguments(String name, List<Long> arguments) {
        if (arguments.isEmpty()) {
            throw new ExecutionException(RuntimeErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "Built-in '" + name + "' expects at least 1 argument but got 0.");
        }
    }
}
