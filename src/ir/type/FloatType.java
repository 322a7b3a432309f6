package ir.type;

import java.util.EnumMap;
import java.util.Map;

/**
 * One instance per LLVM floating point spelling.
 */
public final class FloatType extends Type {
    private static final Map<TypeKind, FloatType> instances = new EnumMap<>(TypeKind.class);

    static {
        for (TypeKind k : TypeKind.values()) {
            if (k.isFloatingPoint()) {
                instances.put(k, new FloatType(k));
            }
        }
    }

    private FloatType(TypeKind kind) {
        super(kind);
    }

    public static FloatType get(TypeKind kind) {
        FloatType t = instances.get(kind);
        if (t == null) {
            throw new IllegalArgumentException(kind + " is not a floating point kind");
        }
        return t;
    }

    public static FloatType getHalf() { return get(TypeKind.HALF); }
    public static FloatType getFloat() { return get(TypeKind.FLOAT); }
    public static FloatType getDouble() { return get(TypeKind.DOUBLE); }

    /**
     * @return the storage width in bits; x86_fp80 reports 80
     */
    public int getBitWidth() {
        return switch (getKind()) {
        case HALF -> 16;
        case FLOAT -> 32;
        case DOUBLE -> 64;
        case X86_FP80 -> 80;
        case FP128, PPC_FP128 -> 128;
        default -> throw new IllegalStateException("not a float kind: " + getKind());
        };
    }

    @Override
    public String toIR() {
        return getKind().name().toLowerCase();
    }
}
