package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import translate.SymbolTable;

/**
 * Lowers one call of a registered function.
 */
public interface FunctionBuilder {

    /**
     * @param symbols    translation state, used for operand mapping and allocation
     * @param returnType IR return type of the callee
     * @param operands   the call's arguments
     */
    LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands);
}
