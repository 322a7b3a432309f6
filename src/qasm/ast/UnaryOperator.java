package qasm.ast;

public enum UnaryOperator {
    LOGICAL_NOT("!"),
    NEG("-");

    // 一元运算符比所有二元运算符都紧
    public static final int PRECEDENCE = 11;

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
