package translate.builder;

import ir.value.Value;
import qasm.ast.Expression;
import translate.SymbolTable;

/**
 * Recognizes an IR constant encoding and turns it into an expression.
 */
public interface InstructionBuilder {

    /**
     * @return the expression, or null when the constant is not this builder's encoding
     */
    Expression build(SymbolTable symbols, Value constant);
}
