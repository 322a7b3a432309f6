package translate;

import qasm.ast.ClassicalType;
import translate.builder.DeclarationBuilder;

/**
 * A struct the profile knows how to lower. {@code targetType} is null for
 * quantum structs ({@code Qubit}).
 */
public record StructInfo(String name, ClassicalType targetType, DeclarationBuilder declarationBuilder) {

    public boolean isQuantum() {
        return targetType == null;
    }

    /** Name of the statically addressed array, e.g. {@code Qubits}. */
    public String staticName() {
        return name + "s";
    }

    public String temporaryName() {
        return staticName() + "_tmp";
    }
}
