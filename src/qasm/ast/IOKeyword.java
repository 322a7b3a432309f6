package qasm.ast;

public enum IOKeyword {
    INPUT("input", "i"),
    OUTPUT("output", "o");

    private final String keyword;
    // 变量名后缀, IntType_i0 / IntType_o0
    private final String suffix;

    IOKeyword(String keyword, String suffix) {
        this.keyword = keyword;
        this.suffix = suffix;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getSuffix() {
        return suffix;
    }
}
