package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;

/**
 * An instruction the loader recognizes syntactically (load, store, alloca,
 * phi, ...) but the translator has no lowering for. Only its mnemonic and
 * source text are kept so the failure can point at it.
 */
public class GenericInst extends Instruction {
    private final String mnemonic;
    private final String text;

    public GenericInst(String mnemonic, Type type, String name, String text) {
        super(type, name);
        this.mnemonic = mnemonic;
        this.text = text;
    }

    @Override
    public Opcode opCode() {
        return Opcode.OTHER;
    }

    @Override
    public String getOpcodeName() {
        return mnemonic;
    }

    @Override
    public String toIR() {
        return text;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
