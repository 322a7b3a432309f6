package qasm.ast;

public interface Expression {
}
