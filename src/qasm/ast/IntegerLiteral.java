package qasm.ast;

public record IntegerLiteral(long value) implements Expression {
}
