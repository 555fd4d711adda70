package utilities;

import java.io.IOException;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class DnaLogger {
    // Set to a file path to mirror every record (down to FINEST) into that file.
    public static final String LOG_FILE_PROPERTY = "dnamatch.log.file";

    private static final boolean APPEND = true;

    private static final Logger logger = Logger.getLogger(DnaLogger.class.getName());

    static {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.INFO);
        console.setFormatter(new SimpleFormatter());
        logger.addHandler(console);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler file = new FileHandler(logFile, APPEND);
                file.setLevel(Level.ALL);
                file.setFormatter(new SimpleFormatter());
                logger.addHandler(file);
            } catch (IOException | SecurityException e) {
                logger.log(Level.WARNING, "Cannot open log file " + logFile + ", logging to console only", e);
            }
        }
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
