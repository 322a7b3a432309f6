package qasm.ast;

/**
 * {@code qubit[size] name;} size may be null for a single qubit.
 */
public record QubitDeclaration(Identifier qubit, Expression size) implements Statement {
}
