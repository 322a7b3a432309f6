package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.User;

public abstract class Instruction extends User {
    private BasicBlock parent;

    public Instruction(Type type, String name) {
        super(type, name);
    }

    public abstract Opcode opCode();

    /**
     * @return the mnemonic used in diagnostics; differs from
     *         {@code opCode().getIRName()} only for instructions parsed as {@link GenericInst}
     */
    public String getOpcodeName() {
        return opCode().getIRName();
    }

    public BasicBlock getParent() {
        return parent;
    }

    public void setParent(BasicBlock parent) {
        this.parent = parent;
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public abstract <T> T accept(InstructionVisitor<T> visitor);

    /* "%x = " prefix for value-producing instructions */
    protected String resultPrefix() {
        return getType().isVoid() || !hasName() ? "" : "%" + getName() + " = ";
    }
}
