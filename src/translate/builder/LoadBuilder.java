package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import translate.SymbolTable;

/**
 * The result is the first operand itself, e.g. {@code read_result(r)} is just {@code r}.
 */
public class LoadBuilder implements FunctionBuilder {

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        return LoweringResult.of(symbols.mapValue(operands.get(0)), List.of());
    }
}
