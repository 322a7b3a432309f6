package translate.builder;

import java.util.ArrayList;
import java.util.List;

import exception.CompileException;
import ir.type.Type;
import ir.value.Value;
import qasm.ast.ClassicalAssignment;
import qasm.ast.Expression;
import qasm.ast.ExpressionStatement;
import qasm.ast.FunctionCall;
import qasm.ast.Identifier;
import qasm.ast.Statement;
import translate.SymbolTable;
import translate.TargetType;

/**
 * Call of an extern the profile does not know, lowered against its
 * synthesized {@code defcal}: {@code target = name(args..., qubits...);}.
 *
 * <p>A non-void return gets a temporary. A returned qubit is passed as an
 * extra qubit operand instead. A classical pointer operand is both an
 * argument and the assignment target; only one such output is allowed.
 */
public class DefCalBuilder implements FunctionBuilder {
    private final Identifier name;

    public DefCalBuilder(String name) {
        this.name = new Identifier(name);
    }

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        Expression result = null;
        Expression assignTarget = null;
        List<Expression> arguments = new ArrayList<>();
        List<Expression> qubits = new ArrayList<>();

        TargetType retType = symbols.mapType(returnType);
        if (!retType.isVoid()) {
            result = symbols.allocateTemporary(retType);
            if (symbols.isQubit(retType)) {
                qubits.add(result);
            } else {
                assignTarget = result;
            }
        }

        for (Value op : operands) {
            TargetType opType = symbols.mapType(op.getType());
            Expression expr = symbols.mapValue(op);
            if (symbols.isQubit(opType)) {
                qubits.add(expr);
                continue;
            }
            arguments.add(expr);
            if (opType.isPointer()) {
                if (assignTarget != null) {
                    throw CompileException.tooManyReturnValues(name.name());
                }
                assignTarget = expr;
            }
        }

        List<Expression> callArgs = new ArrayList<>(arguments);
        callArgs.addAll(qubits);
        FunctionCall call = new FunctionCall(name, callArgs);
        Statement stmt = assignTarget != null
            ? new ClassicalAssignment(assignTarget, call)
            : new ExpressionStatement(call);
        return LoweringResult.of(result, List.of(stmt));
    }
}
