package driver;

/*
 * configuration of the translator, read from JVM system properties
 */
public class Config {
    private static Config config = new Config();

    public static final int DEFAULT_MAX_ROUNDS = 10000;

    public boolean isDebug = false;
    public boolean logToConsole = false;
    public boolean logToFile = false;
    // 每次改写之后校验 block map 与 CFG 是否一致
    public boolean verifyStructuring = true;
    public int maxStructuringRounds = DEFAULT_MAX_ROUNDS;

    private Config() {
        isDebug = getFlag("debug");
        logToConsole = getFlag("log.console");
        logToFile = getFlag("log.file");
        verifyStructuring = getFlag("structuring.verify", true);
        maxStructuringRounds = getInt("structuring.maxRounds", DEFAULT_MAX_ROUNDS);
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    /**
     * Same as {@link #getFlag(String)} but falls back to {@code def} when the
     * property is absent.
     */
    public static boolean getFlag(String name, boolean def) {
        String raw = System.getProperty(name);
        if (raw == null) {
            return def;
        }
        return raw.equalsIgnoreCase("true");
    }

    /**
     * Read a positive integer system property.
     * @param name the system property name
     * @param def value used when the property is absent or not a positive number
     */
    public static int getInt(String name, int def) {
        String raw = System.getProperty(name);
        if (raw == null) {
            return def;
        }
        try {
            int v = Integer.parseInt(raw.trim());
            return v > 0 ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static Config getInstance() {
        return config;
    }
}
