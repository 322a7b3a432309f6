package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import qasm.ast.BinaryExpression;
import qasm.ast.BinaryOperator;
import qasm.ast.ClassicalAssignment;
import qasm.ast.IndexedIdentifier;
import translate.SymbolTable;

/**
 * {@code tmp = lhs op rhs;} with a fresh temporary of the result type. Used
 * for IR arithmetic and comparisons as well as profile functions such as
 * {@code result_equal}.
 */
public class BinaryExpressionBuilder implements FunctionBuilder {
    private final BinaryOperator op;

    public BinaryExpressionBuilder(BinaryOperator op) {
        this.op = op;
    }

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        BinaryExpression expr = new BinaryExpression(op,
                                                     symbols.mapValue(operands.get(0)),
                                                     symbols.mapValue(operands.get(1)));
        IndexedIdentifier tmp = symbols.allocateTemporary(symbols.mapType(returnType));
        return LoweringResult.of(tmp, List.of(new ClassicalAssignment(tmp, expr)));
    }
}
