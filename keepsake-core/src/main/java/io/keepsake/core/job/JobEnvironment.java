package io.keepsake.core.job;

import io.keepsake.core.backend.TransferBackend;
import io.keepsake.core.container.ContainerLifecycle;
import io.keepsake.core.device.DeviceResolver;
import io.keepsake.core.notify.NotificationSink;
import java.util.Objects;

/**
 * Collaborators shared by every job, plus the process-wide cloud switch.
 */
public record JobEnvironment(
    TransferBackend backend,
    ContainerLifecycle containers,
    DeviceResolver devices,
    NotificationSink notifications,
    boolean cloudEnabled
) {

    public JobEnvironment {
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(containers, "containers must not be null");
        Objects.requireNonNull(devices, "devices must not be null");
        Objects.requireNonNull(notifications, "notifications must not be null");
    }
}
