package org.quarterlang.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The CFG program: all user functions in source order followed by the synthesized
 * entry function holding the top-level statements. The interpreter treats it as read-only.
 *
 * @param programName The program name used for diagnostics.
 * @param functions The functions by name, in emission order.
 */
public record IrProgram(String programName, Map<String, IrFunction> functions) {

    /**
     * The name of the synthesized entry function. The lexer cannot produce it as an identifier.
     */
    public static final String ENTRY_FUNCTION = "<main>";

    public IrProgram {
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        if (!functions.containsKey(ENTRY_FUNCTION)) {
            throw new IllegalArgumentException("Program '" + programName + "' has no entry function.");
        }
    }

    public Optional<IrFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public IrFunction entryFunction() {
        return functions.get(ENTRY_FUNCTION);
    }
}
