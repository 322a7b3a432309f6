package translate;

import ir.type.TypeKind;
import qasm.ast.ClassicalType;

/**
 * Result of mapping an IR type. {@code kind} is the source kind
 * ({@code POINTER} for {@code %Qubit*}); exactly one of {@code classical}
 * and {@code structName} is set unless the type is void.
 */
public record TargetType(TypeKind kind, ClassicalType classical, String structName) {

    public static TargetType ofVoid() {
        return new TargetType(TypeKind.VOID, null, null);
    }

    public static TargetType ofClassical(TypeKind kind, ClassicalType classical) {
        return new TargetType(kind, classical, null);
    }

    public static TargetType ofStruct(TypeKind kind, String structName) {
        return new TargetType(kind, null, structName);
    }

    public TargetType asPointer() {
        return new TargetType(TypeKind.POINTER, classical, structName);
    }

    public boolean isVoid() {
        return kind == TypeKind.VOID;
    }

    public boolean isPointer() {
        return kind == TypeKind.POINTER;
    }

    public boolean isStruct() {
        return structName != null;
    }
}
