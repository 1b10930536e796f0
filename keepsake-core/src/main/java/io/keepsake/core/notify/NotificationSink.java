package io.keepsake.core.notify;

/**
 * Best-effort delivery of operator notifications. Implementations log delivery failures
 * and never throw them at the caller.
 */
public interface NotificationSink {

    void notify(String title, String body, Priority priority);
}
