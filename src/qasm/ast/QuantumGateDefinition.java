package qasm.ast;

import java.util.List;

public record QuantumGateDefinition(Identifier name,
                                    List<Identifier> arguments,
                                    List<Identifier> qubits,
                                    List<QuantumGate> body) implements Statement {

    public QuantumGateDefinition {
        arguments = List.copyOf(arguments);
        qubits = List.copyOf(qubits);
        body = List.copyOf(body);
    }
}
