package translate.builder;

import qasm.ast.BitType;
import qasm.ast.ClassicalDeclaration;
import qasm.ast.Identifier;
import qasm.ast.IntegerLiteral;
import qasm.ast.Statement;

public class ResultDeclarationBuilder implements DeclarationBuilder {

    @Override
    public Statement build(String name, int size) {
        return new ClassicalDeclaration(new BitType(new IntegerLiteral(size)), new Identifier(name));
    }
}
