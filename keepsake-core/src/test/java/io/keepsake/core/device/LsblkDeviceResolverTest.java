package io.keepsake.core.device;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keepsake.core.support.ScriptedCommandRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LsblkDeviceResolverTest {

    @Test
    void shouldMapPartitionsToTheirMountPoints() throws Exception {
        ScriptedCommandRunner runner = new ScriptedCommandRunner().thenReturn(0, """
            {
              "blockdevices": [
                {"name": "sda", "mountpoints": [null], "children": [
                  {"name": "sda1", "mountpoints": ["/mnt/backup", "/srv/backup"]},
                  {"name": "sda2", "mountpoints": [null]}
                ]},
                {"name": "sr0", "mountpoints": ["/media/cdrom"]},
                {"name": "sdb", "children": [
                  {"name": "sdb1", "mountpoint": "/mnt/legacy"}
                ]}
              ]
            }
            """);

        Map<String, List<Path>> mounts = new LsblkDeviceResolver(runner, Duration.ofSeconds(5)).listMounts();

        assertThat(mounts.get("sda1")).containsExactly(Path.of("/mnt/backup"), Path.of("/srv/backup"));
        assertThat(mounts.get("sda2")).isEmpty();
        assertThat(mounts.get("sr0")).containsExactly(Path.of("/media/cdrom"));
        assertThat(mounts.get("sdb1")).containsExactly(Path.of("/mnt/legacy"));
        assertThat(mounts).doesNotContainKey("sda");
        assertThat(runner.last().command()).containsExactly("lsblk", "-J", "-o", "+LABEL");
    }

    @Test
    void shouldTreatDevicesWithoutMountsAsUnavailable() throws Exception {
        ScriptedCommandRunner runner = new ScriptedCommandRunner().thenReturn(0, """
            {"blockdevices": [{"name": "sda", "children": [{"name": "sda1", "mountpoints": [null]}]}]}
            """);

        MountTable table = MountTable.of(new LsblkDeviceResolver(runner, Duration.ofSeconds(5)).listMounts());

        assertThat(table.isMounted("sda1")).isFalse();
        assertThat(table.firstMount("missing")).isEmpty();
    }

    @Test
    void shouldFailWhenLsblkFails() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner().thenReturn(32, "lsblk: failed to access sysfs");

        assertThatThrownBy(() -> new LsblkDeviceResolver(runner, Duration.ofSeconds(5)).listMounts())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("sysfs");
    }
}
