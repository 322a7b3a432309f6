package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import qasm.ast.ClassicalAssignment;
import qasm.ast.IOKeyword;
import qasm.ast.Identifier;
import translate.SymbolTable;

/**
 * Copies the operand into a new {@code output} variable.
 */
public class OutputBuilder implements FunctionBuilder {

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        Value value = operands.get(0);
        Identifier output = symbols.allocateIO(symbols.toClassical(symbols.mapType(value.getType())), IOKeyword.OUTPUT);
        return LoweringResult.of(new ClassicalAssignment(output, symbols.mapValue(value)));
    }
}
