package org.scharp.stataxml;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A logging handler that remembers the messages which were logged to a logger, for tests that check warnings.
 * <p>
 * Use it in a try-with-resources block so that it's detached from the logger when the test completes.
 * </p>
 */
class CapturingLogHandler extends Handler implements AutoCloseable {

    private final Logger logger;
    private final Level originalLevel;
    private final List<LogRecord> records;

    CapturingLogHandler(Class<?> loggingClass) {
        this.logger = Logger.getLogger(loggingClass.getName());
        this.originalLevel = logger.getLevel();
        this.records = new ArrayList<>();

        setLevel(Level.ALL);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
    }

    @Override
    public synchronized void publish(LogRecord record) {
        records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        logger.removeHandler(this);
        logger.setLevel(originalLevel);
    }

    /**
     * Gets the formatted messages that were logged at a given level.
     */
    synchronized List<String> messages(Level level) {
        List<String> messages = new ArrayList<>();
        for (LogRecord record : records) {
            if (record.getLevel().equals(level)) {
                Object[] parameters = record.getParameters();
                messages.add(parameters == null ? record.getMessage() :
                    MessageFormat.format(record.getMessage(), parameters));
            }
        }
        return messages;
    }
}
