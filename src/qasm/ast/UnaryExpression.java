package qasm.ast;

public record UnaryExpression(UnaryOperator op, Expression expression) implements Expression {

    public static UnaryExpression not(Expression expression) {
        return new UnaryExpression(UnaryOperator.LOGICAL_NOT, expression);
    }
}
