package translate.builder;

import qasm.ast.Statement;

/**
 * Declares a named array of {@code size} elements.
 */
public interface DeclarationBuilder {
    Statement build(String name, int size);
}
