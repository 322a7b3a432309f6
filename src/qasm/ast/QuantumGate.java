package qasm.ast;

import java.util.List;

/**
 * Gate application {@code name(args) q0, q1;}
 */
public record QuantumGate(Identifier name, List<Expression> arguments, List<Expression> qubits) implements Statement {

    public QuantumGate {
        arguments = List.copyOf(arguments);
        qubits = List.copyOf(qubits);
    }

    public static QuantumGate of(String name, Expression... qubits) {
        return new QuantumGate(new Identifier(name), List.of(), List.of(qubits));
    }
}
