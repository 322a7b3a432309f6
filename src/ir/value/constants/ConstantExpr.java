package ir.value.constants;

import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Constant expression such as {@code inttoptr (i64 1 to %Qubit*)} or
 * {@code getelementptr inbounds ([2 x i8], [2 x i8]* @0, i64 0, i64 0)}.
 * The type is the expression's result type.
 */
public class ConstantExpr extends Constant {
    private final Opcode opcode;
    // getelementptr only
    private final Type sourceElementType;

    public ConstantExpr(Opcode opcode, Type type, List<Value> operands) {
        this(opcode, type, null, operands);
    }

    public ConstantExpr(Opcode opcode, Type type, Type sourceElementType, List<Value> operands) {
        super(type);
        this.opcode = opcode;
        this.sourceElementType = sourceElementType;
        for (Value operand : operands) {
            addOperand(operand);
        }
    }

    public Opcode getOpcode() { return opcode; }
    public Type getSourceElementType() { return sourceElementType; }

    public boolean isCast() {
        return switch (opcode) {
        case TRUNC, ZEXT, SEXT, BITCAST, INTTOPTR, PTRTOINT -> true;
        default -> false;
        };
    }

    @Override
    public String toIR() {
        return getType().toIR() + " " + getReference();
    }

    @Override
    public String getReference() {
        StringBuilder sb = new StringBuilder(opcode.getIRName()).append(" (");
        if (isCast()) {
            Value src = getOperand(0);
            sb.append(src.getType().toIR()).append(" ").append(src.getReference())
              .append(" to ").append(getType().toIR());
        } else {
            List<String> parts = new ArrayList<>();
            if (sourceElementType != null) {
                parts.add(sourceElementType.toIR());
            }
            for (Value v : getOperands()) {
                parts.add(v.getType().toIR() + " " + v.getReference());
            }
            sb.append(String.join(", ", parts));
        }
        return sb.append(")").toString();
    }
}
