package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import qasm.ast.QuantumReset;
import translate.SymbolTable;

public class ResetBuilder implements FunctionBuilder {

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        return LoweringResult.of(new QuantumReset(symbols.mapValue(operands.get(0))));
    }
}
