package qasm.ast;

/**
 * {@code target = measure q;}, or a bare {@code measure q;} when target is null.
 */
public record QuantumMeasurementStatement(QuantumMeasurement measure, Expression target) implements Statement {
}
