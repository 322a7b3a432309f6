package translate.builder;

import java.util.ArrayList;
import java.util.List;

import exception.CompileException;
import ir.type.Type;
import ir.value.Value;
import qasm.ast.Expression;
import qasm.ast.Identifier;
import qasm.ast.QuantumGate;
import translate.SymbolTable;

/**
 * {@code h q;}, {@code rx(theta) q;}, {@code sdg q;} ... Qubit operands go to the
 * qubit list in call order, everything else becomes a gate argument.
 */
public class GateBuilder implements FunctionBuilder {
    private final Identifier name;

    public GateBuilder(String gate) {
        this(gate, false);
    }

    public GateBuilder(String gate, boolean adjoint) {
        this.name = new Identifier(adjoint ? gate + "dg" : gate);
    }

    public String getGateName() {
        return name.name();
    }

    @Override
    public LoweringResult build(SymbolTable symbols, Type returnType, List<Value> operands) {
        if (!returnType.isVoid()) {
            throw CompileException.malformedGate(name.name(), returnType.toIR());
        }
        List<Expression> arguments = new ArrayList<>();
        List<Expression> qubits = new ArrayList<>();
        for (Value op : operands) {
            Expression expr = symbols.mapValue(op);
            if (symbols.isQubit(symbols.mapType(op.getType()))) {
                qubits.add(expr);
            } else {
                arguments.add(expr);
            }
        }
        return LoweringResult.of(new QuantumGate(name, arguments, qubits));
    }
}
