package qasm.ast;

import java.util.List;

/**
 * Opaque {@code defcal}. The body is kept as raw text and is empty for
 * synthesized declarations.
 */
public record CalibrationDefinition(Identifier name,
                                    List<ClassicalType> arguments,
                                    List<Identifier> qubits,
                                    ClassicalType returnType,
                                    String body) implements Statement {

    public CalibrationDefinition {
        arguments = List.copyOf(arguments);
        qubits = List.copyOf(qubits);
        body = body == null ? "" : body;
    }
}
