package io.keepsake.core.support;

import io.keepsake.core.notify.NotificationSink;
import io.keepsake.core.notify.Priority;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotificationSink implements NotificationSink {
    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    @Override
    public void notify(String title, String body, Priority priority) {
        sent.add(new Notification(title, body, priority));
    }

    public List<Notification> sent() {
        return sent;
    }

    public List<Notification> withPriority(Priority priority) {
        return sent.stream().filter(notification -> notification.priority() == priority).toList();
    }

    public record Notification(String title, String body, Priority priority) {
    }
}
