package translate.builder;

import java.util.List;

import qasm.ast.ArrayType;
import qasm.ast.ClassicalDeclaration;
import qasm.ast.ClassicalType;
import qasm.ast.Identifier;
import qasm.ast.IntegerLiteral;
import qasm.ast.Statement;

/**
 * {@code array[base, n] name;}
 */
public class ClassicalDeclarationBuilder implements DeclarationBuilder {
    private final ClassicalType baseType;

    public ClassicalDeclarationBuilder(ClassicalType baseType) {
        this.baseType = baseType;
    }

    @Override
    public Statement build(String name, int size) {
        ArrayType array = new ArrayType(baseType, List.of(new IntegerLiteral(size)));
        return new ClassicalDeclaration(array, new Identifier(name));
    }
}
