package translate.builder;

import qasm.ast.Identifier;
import qasm.ast.IntegerLiteral;
import qasm.ast.QubitDeclaration;
import qasm.ast.Statement;

public class QubitDeclarationBuilder implements DeclarationBuilder {

    @Override
    public Statement build(String name, int size) {
        return new QubitDeclaration(new Identifier(name), new IntegerLiteral(size));
    }
}
