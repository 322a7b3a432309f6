package qasm.ast;

public record FloatType(Expression size) implements ClassicalType {
}
