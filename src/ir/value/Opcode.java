package ir.value;

public enum Opcode {
    // 二元运算
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    SDIV("sdiv"),
    UDIV("udiv"),
    SREM("srem"),
    UREM("urem"),
    SHL("shl"),
    LSHR("lshr"),
    ASHR("ashr"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    FADD("fadd"),
    FSUB("fsub"),
    FMUL("fmul"),
    FDIV("fdiv"),
    FREM("frem"),

    // 比较, 名字带上谓词
    ICMP_EQ("icmp eq"),
    ICMP_NE("icmp ne"),
    ICMP_UGT("icmp ugt"),
    ICMP_UGE("icmp uge"),
    ICMP_ULT("icmp ult"),
    ICMP_ULE("icmp ule"),
    ICMP_SGT("icmp sgt"),
    ICMP_SGE("icmp sge"),
    ICMP_SLT("icmp slt"),
    ICMP_SLE("icmp sle"),

    // 类型转换 (只出现在常量表达式里)
    TRUNC("trunc"),
    ZEXT("zext"),
    SEXT("sext"),
    BITCAST("bitcast"),
    INTTOPTR("inttoptr"),
    PTRTOINT("ptrtoint"),
    GETELEMENTPTR("getelementptr"),

    // 终结指令
    RET("ret"),
    BR("br"),

    CALL("call"),

    // parsed but never lowered
    OTHER("other");

    private final String irName;

    Opcode(String irName) {
        this.irName = irName;
    }

    /**
     * @return the mnemonic as written in a .ll file, e.g. {@code "add"} or {@code "icmp slt"}
     */
    public String getIRName() {
        return irName;
    }

    public boolean isTerminator() {
        return this == RET || this == BR;
    }

    public boolean isBinary() {
        return ordinal() >= ADD.ordinal() && ordinal() <= FREM.ordinal();
    }

    public boolean isICmp() {
        return ordinal() >= ICMP_EQ.ordinal() && ordinal() <= ICMP_SLE.ordinal();
    }

    public static Opcode fromIRName(String name) {
        for (Opcode op : values()) {
            if (op != OTHER && op.irName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
