package qasm.ast;

public record ExpressionStatement(Expression expression) implements Statement {
}
