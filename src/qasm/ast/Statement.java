package qasm.ast;

/**
 * A top-level or block-level OpenQASM statement.
 */
public interface Statement {
}
