package qasm.ast;

public record BinaryExpression(BinaryOperator op, Expression lhs, Expression rhs) implements Expression {
}
