package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import translate.SymbolTable;

/**
 * Output recording and runtime bookkeeping calls have no OpenQASM counterpart.
 */
public class RecordBuilder implements FunctionBuilder {

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        return LoweringResult.none();
    }
}
