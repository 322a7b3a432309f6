package util.logging;

/**
 * Log levels, ordered from least to most severe.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level is below {@code other}, i.e. would be filtered
     *         out by a logger configured at {@code other}
     */
    public boolean isLessSpecificThan(LogLevel other) {
        return this.value < other.value;
    }

    public static LogLevel fromName(String name) {
        if (name == null) {
            return null;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(name.trim())) {
                return level;
            }
        }
        return null;
    }
}
