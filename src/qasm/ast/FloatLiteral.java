package qasm.ast;

public record FloatLiteral(double value) implements Expression {
}
