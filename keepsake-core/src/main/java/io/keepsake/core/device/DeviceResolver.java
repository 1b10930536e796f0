package io.keepsake.core.device;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Lists the block devices that are currently mounted.
 */
public interface DeviceResolver {

    /**
     * @return device id to its mount points; a missing key or an empty list means unavailable
     */
    Map<String, List<Path>> listMounts() throws IOException;
}
