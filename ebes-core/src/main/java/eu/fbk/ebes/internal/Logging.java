package eu.fbk.ebes.internal;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

/**
 * Logging helpers: the MDC key identifying the query being processed and the conversion words
 * used by <tt>logback.xml</tt>.
 */
public final class Logging {

    private static final Logger LOGGER = LoggerFactory.getLogger(Logging.class);

    public static final String MDC_CONTEXT = "context";

    private Logging() {
    }

    /**
     * Sets (or clears, if null) the context shown in front of log messages of the current
     * thread, returning the previous one.
     *
     * @param context
     *            the new context, e.g., the name of the query being ranked
     * @return the previous context, null if none
     */
    @Nullable
    public static String setContext(@Nullable final String context) {
        final String previous = MDC.get(MDC_CONTEXT);
        if (context == null) {
            MDC.remove(MDC_CONTEXT);
        } else {
            MDC.put(MDC_CONTEXT, context);
        }
        return previous;
    }

    /**
     * Changes the level of a Logback logger, doing nothing if Logback is not the SLF4J binding.
     *
     * @param logger
     *            the logger
     * @param debug
     *            true to enable DEBUG messages, false to restore INFO
     */
    public static void setDebug(final Logger logger, final boolean debug) {
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(debug ? Level.DEBUG : Level.INFO);
        } else {
            LOGGER.warn("Cannot change level of logger {}: not a Logback logger",
                    logger.getName());
        }
    }

    public static final class NormalConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            final Level level = event.getLevel();
            switch (level.toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.DEFAULT_FG;
            }
        }

    }

    public static final class BoldConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            final Level level = event.getLevel();
            switch (level.toInt()) {
            case Level.ERROR_INT:
                return ANSIConstants.BOLD + ANSIConstants.RED_FG;
            case Level.WARN_INT:
                return ANSIConstants.BOLD + ANSIConstants.MAGENTA_FG;
            default:
                return ANSIConstants.BOLD + ANSIConstants.DEFAULT_FG;
            }
        }

    }

    /**
     * Renders the query context (if any) and, for warnings and errors, the logger name.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final String context = event.getMDCPropertyMap().get(MDC_CONTEXT);
            final String logger = event.getLevel().toInt() >= Level.WARN_INT ? event
                    .getLoggerName() : null;
            if (context == null) {
                return logger == null ? "" : "[" + logger + "] ";
            } else {
                return logger == null ? "[" + context + "] " : "[" + context + "][" + logger
                        + "] ";
            }
        }

    }

}
