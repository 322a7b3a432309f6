package qasm.ast;

import java.util.List;

/**
 * {@code array[base, d0, d1, ...]}.
 */
public record ArrayType(ClassicalType baseType, List<Expression> dimensions) implements ClassicalType {

    public ArrayType {
        dimensions = List.copyOf(dimensions);
    }
}
