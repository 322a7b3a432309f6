package qasm.ast;

public record ClassicalAssignment(Expression lvalue, Expression rvalue) implements Statement {
}
