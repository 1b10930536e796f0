package io.keepsake.core.container;

import java.nio.file.Path;

/**
 * Quiesces the data source living at a path while it is being backed up.
 */
public interface ContainerLifecycle {

    void stop(Path path) throws ContainerLifecycleException;

    void start(Path path) throws ContainerLifecycleException;
}
