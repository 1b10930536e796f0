package io.keepsake.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink used when no push channel is configured. Notifications end up in the log only.
 */
public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String title, String body, Priority priority) {
        switch (priority) {
            case HIGH, MAX -> LOG.warn("[notify:{}] {}: {}", priority.wireValue(), title, body);
            default -> LOG.info("[notify:{}] {}: {}", priority.wireValue(), title, body);
        }
    }
}
