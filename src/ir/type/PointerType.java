package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed pointer {@code T*}. The opaque {@code ptr} spelling has no pointee
 * and is represented by {@link #getOpaque()}.
 */
public final class PointerType extends Type {
    private final Type pointeeType;

    private static final Map<Type, PointerType> pool =
        new ConcurrentHashMap<>();
    private static final PointerType OPAQUE = new PointerType(null);

    private PointerType(Type pointeeType) {
        super(TypeKind.POINTER);
        this.pointeeType = pointeeType;
    }

    public static PointerType get(Type pointeeType) {
        return pool.computeIfAbsent(Objects.requireNonNull(pointeeType, "pointee"), PointerType::new);
    }

    public static PointerType getOpaque() {
        return OPAQUE;
    }

    public boolean isOpaque() {
        return pointeeType == null;
    }

    /**
     * @return the pointee, null for the opaque {@code ptr}
     */
    public Type getPointeeType() {
        return pointeeType;
    }

    @Override
    public String toIR() {
        return isOpaque() ? "ptr" : pointeeType.toIR() + "*";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType other)) return false;
        return Objects.equals(pointeeType, other.pointeeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), pointeeType);
    }
}
