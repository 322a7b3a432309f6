package ir.type;

public enum TypeKind {
    VOID,
    INTEGER,
    // floating point, one per LLVM spelling
    HALF,
    FLOAT,
    DOUBLE,
    X86_FP80,
    FP128,
    PPC_FP128,
    // derived
    POINTER,
    STRUCT,
    ARRAY,
    VECTOR,
    FUNCTION,
    LABEL;

    public boolean isFloatingPoint() {
        return switch (this) {
        case HALF, FLOAT, DOUBLE, X86_FP80, FP128, PPC_FP128 -> true;
        default -> false;
        };
    }
}
