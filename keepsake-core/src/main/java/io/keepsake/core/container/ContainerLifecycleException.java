package io.keepsake.core.container;

public final class ContainerLifecycleException extends Exception {

    public ContainerLifecycleException(String message) {
        super(message);
    }

    public ContainerLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
