package util.logging;

import driver.CompilerDriver;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the Logger interface. Records look like
 * {@code bell.ll 2024-01-01 12:00:00,000 [INFO] pass.PassManager - [run:42] message}.
 */
public class SimpleLogger implements Logger {
    private final String name;
    private final LogLevel level;
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    @Override public void trace(String message) { log(LogLevel.TRACE, message); }
    @Override public void debug(String message) { log(LogLevel.DEBUG, message); }
    @Override public void info(String message) { log(LogLevel.INFO, message); }
    @Override public void warn(String message) { log(LogLevel.WARN, message); }
    @Override public void error(String message) { log(LogLevel.ERROR, message); }
    @Override public void fatal(String message) { log(LogLevel.FATAL, message); }

    @Override public void trace(String format, Object... args) { logFormatted(LogLevel.TRACE, format, args); }
    @Override public void debug(String format, Object... args) { logFormatted(LogLevel.DEBUG, format, args); }
    @Override public void info(String format, Object... args) { logFormatted(LogLevel.INFO, format, args); }
    @Override public void warn(String format, Object... args) { logFormatted(LogLevel.WARN, format, args); }
    @Override public void error(String format, Object... args) { logFormatted(LogLevel.ERROR, format, args); }
    @Override public void fatal(String format, Object... args) { logFormatted(LogLevel.FATAL, format, args); }

    @Override public boolean isTraceEnabled() { return isEnabled(LogLevel.TRACE); }
    @Override public boolean isDebugEnabled() { return isEnabled(LogLevel.DEBUG); }
    @Override public boolean isInfoEnabled() { return isEnabled(LogLevel.INFO); }
    @Override public boolean isWarnEnabled() { return isEnabled(LogLevel.WARN); }
    @Override public boolean isErrorEnabled() { return isEnabled(LogLevel.ERROR); }
    @Override public boolean isFatalEnabled() { return isEnabled(LogLevel.FATAL); }

    private boolean isEnabled(LogLevel target) {
        return !target.isLessSpecificThan(level);
    }

    private void logFormatted(LogLevel target, String format, Object... args) {
        // 先判断级别, 避免无用的字符串拼接
        if (isEnabled(target)) {
            log(target, formatMessage(format, args));
        }
    }

    private void log(LogLevel target, String message) {
        if (!isEnabled(target)) {
            return;
        }

        StackTraceElement caller = getCaller();
        String methodInfo = "";
        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        String source = CompilerDriver.getInstance().getSource();
        String logMessage = String.format("%s %s [%s] %s - %s%s",
                                          source != null ? source : "unknown",
                                          LocalDateTime.now().format(TIMESTAMP),
                                          target,
                                          name,
                                          methodInfo,
                                          message);

        LogManager.writeLog(target, logMessage);
    }

    /**
     * Gets the calling class/method from the stack trace
     */
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        String loggerClassName = SimpleLogger.class.getName();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            String cls = element.getClassName();
            if (foundLogger && !cls.equals(loggerClassName)
                && !cls.startsWith("java.lang.reflect.")
                && !cls.equals(LogManager.class.getName())) {
                return element;
            }
            if (cls.equals(loggerClassName)) {
                foundLogger = true;
            }
        }
        return null;
    }

    static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);
        while (matcher.find()) {
            if (argIndex < args.length) {
                Object arg = args[argIndex++];
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(arg)));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
