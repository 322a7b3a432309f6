package util.logging;

/**
 * Minimal logging facade in the spirit of SLF4J. Formatted variants
 * substitute {@code {}} placeholders in order.
 */
public interface Logger {
    void trace(String message);
    void debug(String message);
    void info(String message);
    void warn(String message);
    void error(String message);
    void fatal(String message);

    void trace(String format, Object... args);
    void debug(String format, Object... args);
    void info(String format, Object... args);
    void warn(String format, Object... args);
    void error(String format, Object... args);
    void fatal(String format, Object... args);

    /** Logs {@code message} followed by the throwable's class and message. */
    default void error(String message, Throwable t) {
        error(message + ": " + t.getClass().getSimpleName() + ": " + t.getMessage());
    }

    boolean isTraceEnabled();
    boolean isDebugEnabled();
    boolean isInfoEnabled();
    boolean isWarnEnabled();
    boolean isErrorEnabled();
    boolean isFatalEnabled();
}
