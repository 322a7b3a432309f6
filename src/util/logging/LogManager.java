package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    // 配置选项, 由 Config 决定
    private static boolean consoleEnabled = false;
    private static boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
        // Private constructor to prevent instantiation
    }

    /**
     * Get a logger for the specified class
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            init();
        }
        return getLogger(clazz.getName(), rootLevel);
    }

    /**
     * Get a logger for the specified class with an explicit level
     */
    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    /**
     * Get a logger for the specified name
     * @param name The logger name
     * @return A Logger instance
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }

        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    /**
     * Initialize the logging system
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }

        Config config = Config.getInstance();
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
        }
        consoleEnabled = config.logToConsole;
        fileEnabled = config.logToFile;

        if (fileEnabled) {
            openLogFile();
        }

        initialized = true;
    }

    private static void openLogFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists()) {
            logDir.mkdirs();
        }

        try {
            File logFile = new File(logDir, "qir2qasm" + System.currentTimeMillis() + ".log");
            fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
        } catch (IOException e) {
            System.err.println("cannot open log file, file logging disabled: " + e.getMessage());
            fileEnabled = false;
        }
    }

    /**
     * Set the root log level
     * @param level The new log level
     */
    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    /**
     * Get the root log level
     * @return The current root log level
     */
    public static synchronized LogLevel getRootLevel() {
        return rootLevel;
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    /**
     * 启用文件输出
     */
    public static void enableFile() {
        synchronized (FILE_LOCK) {
            fileEnabled = true;
            if (fileWriter == null) {
                openLogFile();
            }
        }
    }

    /**
     * 禁用文件输出
     */
    public static void disableFile() {
        fileEnabled = false;
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }

    /**
     * Shutdown the logging system and close all resources
     */
    public static void shutdown() {
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
