package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class IntegerType extends Type {
    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    private IntegerType(int bitWidth) {
        super(TypeKind.INTEGER);
        this.bitWidth = bitWidth;
    }

    public static IntegerType get(int bitWidth) {
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("Integer bit width must be positive: " + bitWidth);
        }
        return pool.computeIfAbsent(bitWidth, IntegerType::new);
    }

    public static IntegerType getI1() { return get(1); }
    public static IntegerType getI8() { return get(8); }
    public static IntegerType getI32() { return get(32); }
    public static IntegerType getI64() { return get(64); }

    public int getBitWidth() {
        return bitWidth;
    }

    @Override
    public boolean isI1() {
        return bitWidth == 1;
    }

    @Override
    public String toIR() {
        return "i" + bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }
}
