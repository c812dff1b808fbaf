package relief.siting.utils;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Static console logger shared by the optimizer core, the runner and the HTTP layer.
 * <p>
 * Messages at {@link Level#ERROR} go to {@link System#err}, everything else to
 * {@link System#out}. Each line is prefixed with a wall-clock timestamp and a coloured
 * level tag. The starting level is read from the {@code SITING_LOG_LEVEL} environment
 * variable and defaults to {@link Level#INFO}.
 * </p>
 * <p>
 * When the last format argument is a {@link Throwable} its stack trace is printed after
 * the message, so call sites can write:
 * <pre>
 * Log.error("Run failed: %s", e.getMessage(), e);
 * </pre>
 * </p>
 */
public final class Log {

    /**
     * Logging levels, lowest severity first.
     */
    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR,
        /** Nothing is printed. */
        OFF
    }

    private static final String RESET = "\u001B[0m";
    private static final String GRAY = "\u001B[90m";
    private static final String BLUE = "\u001B[34m";
    private static final String YELLOW = "\u001B[33m";
    private static final String RED = "\u001B[31m";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private static volatile Level currentLevel = levelFromEnvironment();

    private Log() {
        throw new UnsupportedOperationException("Log is a static facade and cannot be instantiated");
    }

    /**
     * Parses a level name, case-insensitively.
     *
     * @param name level name such as "debug" or "WARN"
     * @param fallback level returned when the name is blank or unknown
     * @return the parsed level
     */
    public static Level parseLevel(String name, Level fallback) {
        if (name == null || name.isBlank()) return fallback;
        try {
            return Level.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static Level levelFromEnvironment() {
        return parseLevel(System.getenv("SITING_LOG_LEVEL"), Level.INFO);
    }

    public static void setLevel(Level level) {
        currentLevel = level;
    }

    public static Level getLevel() {
        return currentLevel;
    }

    public static boolean isEnabled(Level level) {
        return currentLevel != Level.OFF && level != Level.OFF && level.ordinal() >= currentLevel.ordinal();
    }

    private static String colorForLevel(Level level) {
        return switch (level) {
            case DEBUG -> GRAY;
            case INFO -> BLUE;
            case WARN -> YELLOW;
            case ERROR -> RED;
            default -> RESET;
        };
    }

    private static void log(Level level, String message, Throwable cause) {
        if (!isEnabled(level)) return;
        String output = String.format(
                "%s %s[%-5s]%s %s", LocalTime.now().format(TIME), colorForLevel(level), level.name(), RESET, message);
        if (level == Level.ERROR) {
            System.err.println(output);
            if (cause != null) cause.printStackTrace(System.err);
        } else {
            System.out.println(output);
            if (cause != null) cause.printStackTrace(System.out);
        }
    }

    private static void logf(Level level, String format, Object... args) {
        if (!isEnabled(level)) return;
        Throwable cause = null;
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable) {
            cause = (Throwable) args[args.length - 1];
        }
        log(level, String.format(format, args), cause);
    }

    /**
     * Silences all output until {@link #turnOn(Level)} is called.
     */
    public static void turnOff() {
        currentLevel = Level.OFF;
    }

    public static void turnOn(Level level) {
        currentLevel = level;
    }

    public static void turnOn() {
        currentLevel = Level.INFO;
    }

    public static void debug(String msg) {
        log(Level.DEBUG, msg, null);
    }

    public static void debug(String fmt, Object... args) {
        logf(Level.DEBUG, fmt, args);
    }

    public static void info(String msg) {
        log(Level.INFO, msg, null);
    }

    public static void info(String fmt, Object... args) {
        logf(Level.INFO, fmt, args);
    }

    public static void warn(String msg) {
        log(Level.WARN, msg, null);
    }

    public static void warn(String fmt, Object... args) {
        logf(Level.WARN, fmt, args);
    }

    public static void error(String msg) {
        log(Level.ERROR, msg, null);
    }

    public static void error(String fmt, Object... args) {
        logf(Level.ERROR, fmt, args);
    }
}
