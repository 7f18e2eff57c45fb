package com.mimecast.wren.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Server activity log.
 *
 * <p>Every entry is emitted through Log4j2, which owns durable persistence (console and rolling file),
 * and is also kept in a {@link LogBuffer} so the logs API can return recent activity.
 * <p>Messages use the Log4j2 <code>{}</code> placeholder syntax.
 * <p>Buffered lines are formatted as <code>yyyy-MM-dd HH:mm:ss - [thread] - LEVEL - message</code>.
 *
 * @see LogBuffer
 */
public class ServerLog {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Logger logger;
    private final LogBuffer buffer;

    /**
     * Constructs a new ServerLog instance.
     *
     * @param buffer LogBuffer instance.
     */
    public ServerLog(LogBuffer buffer) {
        this(LogManager.getLogger("com.mimecast.wren.server"), buffer);
    }

    /**
     * Constructs a new ServerLog instance with a given Log4j2 logger.
     *
     * @param logger Logger instance.
     * @param buffer LogBuffer instance.
     */
    public ServerLog(Logger logger, LogBuffer buffer) {
        this.logger = logger;
        this.buffer = buffer;
        log(Level.INFO, "Logger initialized");
    }

    public void info(String pattern, Object... args) {
        log(Level.INFO, pattern, args);
    }

    public void warn(String pattern, Object... args) {
        log(Level.WARN, pattern, args);
    }

    public void error(String pattern, Object... args) {
        log(Level.ERROR, pattern, args);
    }

    /**
     * Logs and buffers a message.
     * <p>The buffer append happens after Log4j2 returns so no buffer lock is held during appender I/O.
     *
     * @param level   Log level.
     * @param pattern Message pattern.
     * @param args    Pattern arguments.
     */
    private void log(Level level, String pattern, Object... args) {
        String message = ParameterizedMessage.format(pattern, args);
        logger.log(level, message);
        buffer.append(format(level, message));
    }

    /**
     * Formats a buffer line.
     *
     * @param level   Log level.
     * @param message Formatted message.
     * @return Line.
     */
    private String format(Level level, String message) {
        return TIMESTAMP.format(LocalDateTime.now()) + " - [" + Thread.currentThread().getName() + "] - "
                + level.name() + " - " + message;
    }

    /**
     * Gets the backing buffer.
     *
     * @return LogBuffer instance.
     */
    public LogBuffer getBuffer() {
        return buffer;
    }
}
