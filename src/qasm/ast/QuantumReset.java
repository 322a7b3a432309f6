package qasm.ast;

public record QuantumReset(Expression qubit) implements Statement {
}
