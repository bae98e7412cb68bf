package cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts logging for the command line.
 * <p>
 * By default logback.xml applies: warnings only, on stderr, so the result table
 * on stdout stays clean. In debug mode the search packages are lowered to DEBUG,
 * which prints per-size timing and table sizes.
 */
public final class LoggingConfigurator {

    /** Packages whose loggers carry the search diagnostics. */
    static final String[] SEARCH_LOGGERS = {"application", "domain"};

    private LoggingConfigurator() {
    }

    /**
     * Configure logging for the requested mode.
     * Must be called before the search starts.
     *
     * @param debugMode true to enable DEBUG output of the search packages
     */
    public static void configure(final boolean debugMode) {
        if (debugMode) {
            setSearchLevel(Level.DEBUG);
        }
    }

    static void setSearchLevel(final Level level) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            System.err.println("Warning: Logback is not the active SLF4J backend, cannot change log level");
            return;
        }
        final LoggerContext context = (LoggerContext) factory;
        for (final String name : SEARCH_LOGGERS) {
            final Logger logger = context.getLogger(name);
            logger.setLevel(level);
        }
    }
}
