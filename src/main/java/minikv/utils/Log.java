package minikv.utils;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("MiniKV");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";

                String line = String.format("[%s] %s%n", levelStr, record.getMessage());
                if (record.getThrown() != null) {
                    java.io.StringWriter sw = new java.io.StringWriter();
                    record.getThrown().printStackTrace(new java.io.PrintWriter(sw));
                    line += sw;
                }
                return line;
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Accepts DEBUG, INFO, WARN or ERROR.
     */
    public static void setLevel(String level) {
        switch (level.toUpperCase()) {
            case "DEBUG": logger.setLevel(Level.FINE); break;
            case "INFO": logger.setLevel(Level.INFO); break;
            case "WARN": logger.setLevel(Level.WARNING); break;
            case "ERROR": logger.setLevel(Level.SEVERE); break;
            default: throw new IllegalArgumentException("Unknown log level: " + level);
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
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
}
