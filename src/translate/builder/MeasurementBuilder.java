package translate.builder;

import java.util.ArrayList;
import java.util.List;

import ir.type.Type;
import ir.type.TypeKind;
import ir.value.Value;
import qasm.ast.Expression;
import qasm.ast.QuantumMeasurement;
import qasm.ast.QuantumMeasurementStatement;
import qasm.ast.QuantumReset;
import qasm.ast.Statement;
import translate.SymbolTable;
import translate.TargetType;

/**
 * Measurements.
 * <ul>
 *   <li>{@code m}: result goes to a fresh {@code Results_tmp[k]} which is also the call's value</li>
 *   <li>{@code mz}: result goes to the {@code Result*} operand</li>
 *   <li>{@code mresetz}: like {@code mz}, then the qubit is reset</li>
 * </ul>
 */
public class MeasurementBuilder implements FunctionBuilder {
    public static final String RESULT_STRUCT = "Result";

    private final String kind;

    public MeasurementBuilder(String kind) {
        this.kind = kind;
    }

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        Expression result = null;
        Expression target;
        if (kind.equals("m")) {
            result = symbols.allocateTemporary(TargetType.ofStruct(TypeKind.POINTER, RESULT_STRUCT));
            target = result;
        } else {
            target = symbols.mapValue(operands.get(1));
        }
        Expression qubit = symbols.mapValue(operands.get(0));
        List<Statement> statements = new ArrayList<>();
        statements.add(new QuantumMeasurementStatement(new QuantumMeasurement(qubit), target));
        if (kind.equals("mresetz")) {
            statements.add(new QuantumReset(qubit));
        }
        return LoweringResult.of(result, statements);
    }
}
