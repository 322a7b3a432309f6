package translate.builder;

import java.util.List;

import ir.type.Type;
import ir.value.Value;
import qasm.ast.IOKeyword;
import qasm.ast.Identifier;
import translate.SymbolTable;

/**
 * The call's value is a new {@code input} variable.
 */
public class InputBuilder implements FunctionBuilder {

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        Identifier input = symbols.allocateIO(symbols.toClassical(symbols.mapType(returnType)), IOKeyword.INPUT);
        return LoweringResult.of(input, List.of());
    }
}
