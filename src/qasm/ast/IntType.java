package qasm.ast;

public record IntType(Expression size) implements ClassicalType {
}
