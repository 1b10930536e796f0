package io.keepsake.core.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keepsake.core.process.CommandResult;
import io.keepsake.core.process.CommandRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads mounted partitions from {@code lsblk -J}. Device ids are the kernel names lsblk reports
 * ({@code sda1}, {@code nvme0n1p2}).
 */
public final class LsblkDeviceResolver implements DeviceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(LsblkDeviceResolver.class);
    private static final List<String> COMMAND = List.of("lsblk", "-J", "-o", "+LABEL");

    private final CommandRunner runner;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    public LsblkDeviceResolver(CommandRunner runner, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public Map<String, List<Path>> listMounts() throws IOException {
        LOG.info("Listing all mounted partitions");
        CommandResult result = runner.run(COMMAND, null, Map.of(), timeout);
        if (!result.succeeded()) {
            throw new IOException("Unable to get list of all mounted partitions: " + result.output().trim());
        }
        return parse(result.output());
    }

    Map<String, List<Path>> parse(String json) throws IOException {
        Map<String, List<Path>> mounts = new LinkedHashMap<>();
        JsonNode devices = mapper.readTree(json).path("blockdevices");
        if (!devices.isArray()) {
            LOG.error("no block devices found in lsblk output");
            return mounts;
        }

        for (JsonNode device : devices) {
            String deviceName = device.path("name").asText("unnamed device");
            List<Path> ownMounts = mountPoints(device);
            if (!ownMounts.isEmpty()) {
                mounts.put(deviceName, ownMounts);
            }

            JsonNode children = device.path("children");
            if (!children.isArray()) {
                LOG.debug("No children found in block device \"{}\"", deviceName);
                continue;
            }
            for (JsonNode child : children) {
                String childName = child.path("name").asText("unnamed child");
                List<Path> points = mountPoints(child);
                mounts.put(childName, points);
                LOG.debug("{} mount points found for child \"{}\" for block device \"{}\"", points.size(), childName, deviceName);
            }
        }
        return mounts;
    }

    // lsblk >= 2.37 reports "mountpoints", older releases a single "mountpoint"
    private List<Path> mountPoints(JsonNode node) {
        List<Path> points = new ArrayList<>();
        JsonNode many = node.path("mountpoints");
        if (many.isArray()) {
            for (JsonNode point : many) {
                if (!point.isNull() && !point.asText().isBlank()) {
                    points.add(Path.of(point.asText()));
                }
            }
        } else {
            JsonNode single = node.path("mountpoint");
            if (single.isTextual() && !single.asText().isBlank()) {
                points.add(Path.of(single.asText()));
            }
        }
        return points;
    }
}
