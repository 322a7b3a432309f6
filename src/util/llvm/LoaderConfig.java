package util.llvm;

/**
 * QIR 加载器配置类
 *
 * Options controlling how the textual loader reacts to input it cannot parse.
 */
public class LoaderConfig {

    /**
     * 错误处理策略枚举
     */
    public enum ErrorHandling {
        STRICT,     // 遇到错误立即抛出异常
        LENIENT,    // 跳过出错的行继续解析
        COLLECT     // 收集所有错误，最后一起报告
    }

    private ErrorHandling errorHandling = ErrorHandling.STRICT;
    // 不认识的指令保留为 GenericInst, 交给翻译阶段报错
    private boolean allowUnknownInstructions = true;
    private boolean debugMode = false;
    private int maxErrors = 10;

    /**
     * @return default configuration: strict, unknown instructions kept
     */
    public static LoaderConfig defaultConfig() {
        return new LoaderConfig();
    }

    /**
     * @return configuration that skips bad lines instead of failing
     */
    public static LoaderConfig lenientConfig() {
        return new LoaderConfig().setErrorHandling(ErrorHandling.LENIENT);
    }

    public ErrorHandling getErrorHandling() {
        return errorHandling;
    }

    public LoaderConfig setErrorHandling(ErrorHandling errorHandling) {
        this.errorHandling = errorHandling;
        return this;
    }

    public boolean isAllowUnknownInstructions() {
        return allowUnknownInstructions;
    }

    public LoaderConfig setAllowUnknownInstructions(boolean allowUnknownInstructions) {
        this.allowUnknownInstructions = allowUnknownInstructions;
        return this;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public LoaderConfig setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
        return this;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public LoaderConfig setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
        return this;
    }

    @Override
    public String toString() {
        return "LoaderConfig{" +
                "errorHandling=" + errorHandling +
                ", allowUnknownInstructions=" + allowUnknownInstructions +
                ", debugMode=" + debugMode +
                ", maxErrors=" + maxErrors +
                '}';
    }
}
