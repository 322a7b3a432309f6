package translate;

import ir.type.FunctionType;
import qasm.ast.Statement;
import translate.builder.FunctionBuilder;

/**
 * Registered external function: its expected IR signature, an optional
 * declaration emitted once when the function is used, and its lowering.
 */
public record FunctionInfo(String name, FunctionType type, Statement definition, FunctionBuilder builder) {

    public boolean hasDefinition() {
        return definition != null;
    }
}
