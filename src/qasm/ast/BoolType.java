package qasm.ast;

public record BoolType() implements ClassicalType {
}
