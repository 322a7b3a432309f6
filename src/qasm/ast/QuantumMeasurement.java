package qasm.ast;

/**
 * {@code measure q}
 */
public record QuantumMeasurement(Expression qubit) implements Expression {
}
