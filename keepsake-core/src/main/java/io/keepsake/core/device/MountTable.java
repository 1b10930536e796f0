package io.keepsake.core.device;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MountTable {
    private final Map<String, List<Path>> mounts;

    private MountTable(Map<String, List<Path>> mounts) {
        this.mounts = mounts;
    }

    public static MountTable of(Map<String, List<Path>> mounts) {
        return new MountTable(mounts == null ? Map.of() : Map.copyOf(mounts));
    }

    public Optional<Path> firstMount(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        List<Path> points = mounts.get(deviceId);
        if (points == null || points.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(points.get(0));
    }

    public boolean isMounted(String deviceId) {
        return firstMount(deviceId).isPresent();
    }

    public int size() {
        return mounts.size();
    }
}
