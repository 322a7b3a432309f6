package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import qasm.ast.ClassicalAssignment;
import qasm.ast.Expression;
import qasm.ast.IndexedIdentifier;
import translate.SymbolTable;

/**
 * Materializes a fixed literal in a temporary of the call's return type.
 */
public class ConstantBuilder implements FunctionBuilder {
    private final Expression literal;

    public ConstantBuilder(Expression literal) {
        this.literal = literal;
    }

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        IndexedIdentifier tmp = symbols.allocateTemporary(symbols.mapType(returnType));
        return LoweringResult.of(tmp, List.of(new ClassicalAssignment(tmp, literal)));
    }
}
