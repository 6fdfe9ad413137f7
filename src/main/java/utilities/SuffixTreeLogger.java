package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class SuffixTreeLogger {
    // Set to a path to also append every record to that file.
    public static final String LOG_FILE_PROPERTY = "suffixtree.log.file";

    private static final Logger logger = Logger.getLogger(SuffixTreeLogger.class.getName());

    static {
        logger.setUseParentHandlers(false); // Disable default console handler

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                logger.warning("Failed to open log file " + logFile + ": " + e.getMessage());
            }
        }

        logger.setLevel(Level.ALL);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }
}
