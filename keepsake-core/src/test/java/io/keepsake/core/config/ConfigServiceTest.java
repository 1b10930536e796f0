package io.keepsake.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.TaskConfig;
import io.keepsake.core.job.JobKind;
import io.keepsake.core.schedule.PeriodKind;
import io.keepsake.core.schedule.PeriodSpec;
import io.keepsake.core.target.RemoteType;
import io.keepsake.core.target.RetentionPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    private final ConfigService service = new ConfigService();

    @Test
    void shouldLoadTasksAndInheritDefaults() throws Exception {
        Path configPath = write("""
            {
              "ntfy": { "topic_url": "https://ntfy.example.com/backups", "token": "tk_1" },
              "default": {
                "repo_roots": {
                  "local_devices": [
                    { "name": "main", "device_id": "sda1", "primary": true },
                    { "name": "spare", "device_id": "sdb1" }
                  ],
                  "cloud_repos": [
                    { "type": "s3-compatible", "path": "s3.example.com/bucket", "key": "secret", "key_id": "id" }
                  ]
                },
                "retention": { "days": 7, "weeks": 4 }
              },
              "tasks": {
                "photos": {
                  "type": "data-backup",
                  "repo": "photos",
                  "root": "/srv/data",
                  "pw_file": "/etc/keepsake/photos.pw",
                  "paths": ["photos", "scans"],
                  "exclude_files": ["/etc/keepsake/photos.exclude"],
                  "period": { "type": "Daily", "frequency": 2, "run_time": "2:30" },
                  "retention": { "months": 6 }
                },
                "verify": {
                  "type": "check",
                  "repo": "photos",
                  "pw_file": "/etc/keepsake/photos.pw",
                  "read_data": true,
                  "subset": "1/5",
                  "period": { "type": "weekly", "weekday": "Saturday" }
                }
              }
            }
            """);

        KeepsakeConfig config = service.load(configPath);

        assertThat(config.notificationsConfigured()).isTrue();
        assertThat(config.restic().binary()).isEqualTo("restic");
        assertThat(config.restic().timeout()).isEqualTo(Duration.ofHours(12));
        assertThat(config.tasks()).containsOnlyKeys("photos", "verify");

        TaskConfig photos = config.tasks().get("photos");
        assertThat(photos.type()).isEqualTo(JobKind.DATA_BACKUP);
        assertThat(photos.period().toSpec()).isEqualTo(PeriodSpec.daily(2, LocalTime.of(2, 30)));
        assertThat(photos.retention()).isEqualTo(new RetentionPolicy(7, 4, 6, RetentionPolicy.DEFAULT_YEARLY));
        assertThat(photos.repoRoots().localDevices()).hasSize(2);
        assertThat(photos.repoRoots().cloudRepos().get(0).type()).isEqualTo(RemoteType.S3_COMPATIBLE);
        assertThat(photos.stopContainer()).isTrue();
        assertThat(photos.excludeFiles()).containsExactly("/etc/keepsake/photos.exclude");

        TaskConfig verify = config.tasks().get("verify");
        assertThat(verify.retention()).isNull();
        assertThat(verify.readData()).isTrue();
        assertThat(verify.subset()).isEqualTo("1/5");
        assertThat(verify.period().toSpec().kind()).isEqualTo(PeriodKind.WEEKLY);
        assertThat(verify.period().toSpec().weekday()).isEqualTo(DayOfWeek.SATURDAY);
    }

    @Test
    void shouldPreferTaskRepoRootsOverDefaults() throws Exception {
        Path configPath = write("""
            {
              "default": {
                "repo_roots": { "local_devices": [{ "name": "main", "device_id": "sda1", "primary": true }] },
                "retention": {}
              },
              "tasks": {
                "music": {
                  "type": "data-backup", "repo": "music", "root": "/srv", "pw_file": "/pw", "paths": ["music"],
                  "period": { "type": "hourly" },
                  "repo_roots": { "local_devices": [{ "name": "usb", "device_id": "sdc1", "primary": true }] }
                }
              }
            }
            """);

        TaskConfig music = service.load(configPath).tasks().get("music");

        assertThat(music.repoRoots().localDevices()).extracting(device -> device.deviceId()).containsExactly("sdc1");
        assertThat(music.retention()).isEqualTo(RetentionPolicy.defaults());
    }

    @Test
    void shouldFailWhenConfigMissing() {
        assertThatThrownBy(() -> service.load(tempDir.resolve("missing.json")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void shouldWrapMalformedJson() throws Exception {
        Path configPath = write("{ \"tasks\": ");

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void shouldRequireRetentionForBackupTasks() throws Exception {
        Path configPath = write(task("""
            "type": "data-backup", "repo": "r", "root": "/srv", "pw_file": "/pw", "paths": ["a"],
            "period": { "type": "daily" }
            """));

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Task 'job'")
            .hasMessageContaining("retention");
    }

    @Test
    void shouldRejectMoreThanOnePrimary() throws Exception {
        Path configPath = write("""
            {
              "tasks": {
                "job": {
                  "type": "check", "repo": "r", "pw_file": "/pw", "period": { "type": "daily" },
                  "repo_roots": { "local_devices": [
                    { "name": "a", "device_id": "sda1", "primary": true },
                    { "name": "b", "device_id": "sdb1", "primary": true }
                  ] }
                }
              }
            }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("only one local device may be primary");
    }

    @Test
    void shouldRejectInvalidPeriods() throws Exception {
        for (String period : List.of(
            "{ \"type\": \"daily\", \"frequency\": 0 }",
            "{ \"type\": \"daily\", \"run_time\": \"25:99\" }",
            "{ \"type\": \"daily\", \"weekday\": \"monday\" }",
            "{ \"type\": \"monthly\" }",
            "{ \"type\": \"monthly\", \"day_of_month\": 32 }"
        )) {
            Path configPath = write(task("""
                "type": "check", "repo": "r", "pw_file": "/pw", "period": %s
                """.formatted(period)));

            assertThatThrownBy(() -> service.load(configPath))
                .as(period)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid period");
        }
    }

    @Test
    void shouldRequireAtLeastOneTask() throws Exception {
        Path configPath = write("{ \"tasks\": {} }");

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("No tasks configured");
    }

    @Test
    void shouldSelectNamedTasks() throws Exception {
        Path configPath = write(task("""
            "type": "check", "repo": "r", "pw_file": "/pw", "period": { "type": "daily" }
            """));
        KeepsakeConfig config = service.load(configPath);

        assertThat(config.select(List.of("job")).tasks()).containsOnlyKeys("job");
        assertThat(config.select(List.of()).tasks()).containsOnlyKeys("job");
        assertThatThrownBy(() -> config.select(List.of("nope")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }

    private String task(String body) {
        return """
            {
              "tasks": {
                "job": {
                  %s,
                  "repo_roots": { "local_devices": [{ "name": "a", "device_id": "sda1", "primary": true }] }
                }
              }
            }
            """.formatted(body.strip());
    }

    private Path write(String json) throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, json);
        return configPath;
    }
}
