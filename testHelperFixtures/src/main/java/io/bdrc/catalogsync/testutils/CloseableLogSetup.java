package io.bdrc.catalogsync.testutils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.slf4j.LoggerFactory;

/**
 * Captures every event written to one named logger for the lifetime of the object.  Use it in a
 * try-with-resources block so the capturing appender is detached again afterwards.
 */
public class CloseableLogSetup implements AutoCloseable {

    /**
     * A captured event: level, rendered message and the key/value pairs attached to it.
     */
    @Getter
    @AllArgsConstructor
    public static class CapturedLogEvent {
        private final Level level;
        private final String message;
        private final Map<String, String> contextData;
    }

    @Getter
    private final List<CapturedLogEvent> capturedLogEvents = Collections.synchronizedList(new ArrayList<>());

    /**
     * The SLF4J view of the captured logger, for code under test that accepts an injected logger.
     */
    @Getter
    private final org.slf4j.Logger testLogger;

    private final AbstractAppender testAppender;
    private final org.apache.logging.log4j.core.Logger internalLogger;

    public CloseableLogSetup(String loggerName) {
        testAppender = new AbstractAppender("capture-" + loggerName, null, null, false, null) {
            @Override
            public void append(LogEvent event) {
                var contextData = event.getContextData() != null ? event.getContextData().toMap() : Map.<String, String>of();
                capturedLogEvents.add(new CapturedLogEvent(
                    event.getLevel(),
                    event.getMessage().getFormattedMessage(),
                    Map.copyOf(contextData)));
            }
        };
        testAppender.start();

        internalLogger = (org.apache.logging.log4j.core.Logger) LogManager.getLogger(loggerName);
        testLogger = LoggerFactory.getLogger(loggerName);

        internalLogger.setLevel(Level.ALL);
        internalLogger.setAdditive(false);
        internalLogger.addAppender(testAppender);
    }

    public List<String> getLogEvents() {
        synchronized (capturedLogEvents) {
            return capturedLogEvents.stream().map(CapturedLogEvent::getMessage).collect(Collectors.toList());
        }
    }

    public List<String> getLogEventsAtLevel(Level level) {
        synchronized (capturedLogEvents) {
            return capturedLogEvents.stream()
                .filter(e -> e.getLevel().equals(level))
                .map(CapturedLogEvent::getMessage)
                .collect(Collectors.toList());
        }
    }

    @Override
    public void close() {
        internalLogger.removeAppender(testAppender);
        testAppender.stop();
    }
}
