package com.tcode.common.logging;

import org.slf4j.Logger;

/**
 * Levels understood by {@link SubsystemLogger}, each bound to its SLF4J call.
 */
public enum LogLevel {
    ERROR {
        @Override
        boolean enabled(Logger logger) {
            return logger.isErrorEnabled();
        }

        @Override
        void write(Logger logger, String line, Throwable error) {
            logger.error(line, error);
        }
    },
    WARN {
        @Override
        boolean enabled(Logger logger) {
            return logger.isWarnEnabled();
        }

        @Override
        void write(Logger logger, String line, Throwable error) {
            logger.warn(line, error);
        }
    },
    INFO {
        @Override
        boolean enabled(Logger logger) {
            return logger.isInfoEnabled();
        }

        @Override
        void write(Logger logger, String line, Throwable error) {
            logger.info(line, error);
        }
    },
    DEBUG {
        @Override
        boolean enabled(Logger logger) {
            return logger.isDebugEnabled();
        }

        @Override
        void write(Logger logger, String line, Throwable error) {
            logger.debug(line, error);
        }
    },
    TRACE {
        @Override
        boolean enabled(Logger logger) {
            return logger.isTraceEnabled();
        }

        @Override
        void write(Logger logger, String line, Throwable error) {
            logger.trace(line, error);
        }
    };

    abstract boolean enabled(Logger logger);

    abstract void write(Logger logger, String line, Throwable error);
}
