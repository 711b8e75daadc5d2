package calibrator;

import java.io.IOException;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Handle all log message levels
 *
 * Direct all messages to the log file without colors.
 *
 * Direct all messages to the console (terminal) with colors.
 */
public class LoggerSetup {

    private static Logger LOGGER;

    private LoggerSetup() {}

    public static Logger setupLogger() {

    LOGGER = Logger.getLogger("");
    LOGGER.setUseParentHandlers(false);
    // remove any default handlers
    Handler[] handlers = LOGGER.getHandlers();
    for(Handler handler : handlers) {
        LOGGER.removeHandler(handler);
    }

    System.setProperty("java.util.logging.SimpleFormatter.format",
    "%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$-7s [%3$s %2$s] %5$s %6$s%n");

    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setFormatter(new LoggerColoredSimpleFormatter());
    LOGGER.addHandler(consoleHandler);

    try {
        FileHandler logFile = new FileHandler(Cfg.logFile, true);
        logFile.setFormatter(new SimpleFormatter());
        LOGGER.addHandler(logFile);
    } catch (SecurityException | IOException e) {
        LOGGER.warning("log file " + Cfg.logFile + " not available, logging to the console only " + e);
    }

    handlers = LOGGER.getHandlers();
    for(Handler handler : handlers) {
        handler.setLevel(Cfg.loggerMinimumLevel);
    }
    LOGGER.setLevel(Cfg.loggerMinimumLevel);

    return LOGGER;
    }
}
