package utilities;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

// Library-wide logger. Level from -Dbloom.log.level (default INFO), optional log file from -Dbloom.log.file.
public final class BloomLogger {
    public static final String LEVEL_PROPERTY = "bloom.log.level";
    public static final String FILE_PROPERTY = "bloom.log.file";

    private static final Logger logger = Logger.getLogger(BloomLogger.class.getName());

    static {
        logger.setUseParentHandlers(false); // Disable default console handler
        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY), Level.INFO);

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level);
        logger.addHandler(consoleHandler);

        String file = System.getProperty(FILE_PROPERTY);
        if (file != null && !file.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(file, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to open log file " + file, e);
            }
        }

        logger.setLevel(level);
    }

    private BloomLogger() {}

    static Level parseLevel(String value, Level fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void warning(String msg, Throwable t) {
        logger.log(Level.WARNING, msg, t);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }
}
