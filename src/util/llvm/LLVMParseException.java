package util.llvm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * QIR 文本解析异常类
 *
 * Thrown by the loader when the input cannot be turned into a module;
 * carries every {@link ParseError} collected so far.
 */
public class LLVMParseException extends Exception {

    private final List<ParseError> errors;

    /**
     * 解析错误详情类
     */
    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() { return lineNumber; }
        public String getLine() { return line; }
        public String getErrorMessage() { return errorMessage; }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    public LLVMParseException(String message) {
        super(message);
        this.errors = new ArrayList<>();
    }

    /**
     * 创建包含多个错误的异常
     */
    public LLVMParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.errors = new ArrayList<>(errors);
    }

    public LLVMParseException(String message, Throwable cause) {
        super(message, cause);
        this.errors = new ArrayList<>();
    }

    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * 格式化多个错误消息, 最多列出前 5 个
     */
    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");
        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i));
        }
        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }
        return sb.toString();
    }

    /* factories used by the parser; each wraps a single line-level error */

    public static LLVMParseException referenceError(String message, int lineNumber, String line) {
        return single("Reference error: " + message, lineNumber, line);
    }

    public static LLVMParseException unsupportedInstruction(String instruction, int lineNumber, String line) {
        return single("Unsupported instruction: " + instruction, lineNumber, line);
    }

    private static LLVMParseException single(String message, int lineNumber, String line) {
        return new LLVMParseException("Parse error", List.of(new ParseError(lineNumber, line, message)));
    }
}
