package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class VectorType extends Type {
    private final Type elementType;
    private final int numElements;

    private static final Map<Key, VectorType> pool =
        new ConcurrentHashMap<>();

    private record Key(Type elementType, int numElements) {}

    private VectorType(Type elementType, int numElements) {
        super(TypeKind.VECTOR);
        this.elementType = elementType;
        this.numElements = numElements;
    }

    public static VectorType get(Type elementType, int numElements) {
        return pool.computeIfAbsent(
            new Key(Objects.requireNonNull(elementType), numElements),
            k -> new VectorType(k.elementType(), k.numElements()));
    }

    public Type getElementType() { return elementType; }
    public int getNumElements() { return numElements; }

    @Override
    public String toIR() {
        return "<" + numElements + " x " + elementType.toIR() + ">";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VectorType other)) return false;
        return elementType.equals(other.elementType) && numElements == other.numElements;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, numElements);
    }
}
