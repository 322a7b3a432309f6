package translate.builder;

import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import qasm.ast.Expression;
import qasm.ast.IndexedIdentifier;
import translate.StructInfo;
import translate.SymbolTable;

/**
 * Static struct addressing: {@code %Qubit* null} is {@code Qubits[0]},
 * {@code inttoptr (i64 N to %Qubit*)} is {@code Qubits[N]}.
 */
public class InttoptrBuilder implements InstructionBuilder {

    @Override
    public Expression build(SymbolTable symbols, Value constant) {
        long index;
        if (constant instanceof ConstantNull) {
            index = 0;
        } else if (constant instanceof ConstantExpr expr
                   && expr.getOpcode() == Opcode.INTTOPTR
                   && expr.getOperand(0) instanceof ConstantInt ci
                   && ci.getValue() >= 0) {
            index = ci.getValue();
        } else {
            return null;
        }
        StructType struct = pointeeStruct(constant.getType());
        if (struct == null) {
            return null;
        }
        StructInfo info = symbols.getStruct(struct.getName());
        symbols.noteStructUse(info.name(), index);
        return IndexedIdentifier.of(info.staticName(), index);
    }

    private static StructType pointeeStruct(Type type) {
        if (type instanceof PointerType ptr && ptr.getPointeeType() instanceof StructType st && !st.isLiteral()) {
            return st;
        }
        return null;
    }
}
