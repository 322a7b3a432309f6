package qasm.ast;

public record BooleanLiteral(boolean value) implements Expression {
}
