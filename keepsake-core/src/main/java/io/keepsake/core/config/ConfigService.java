package io.keepsake.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.keepsake.core.config.model.KeepsakeConfig;
import io.keepsake.core.config.model.RepoRootsConfig;
import io.keepsake.core.config.model.TaskConfig;
import io.keepsake.core.job.JobKind;
import io.keepsake.core.target.LocalTarget;
import io.keepsake.core.target.RemoteTarget;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the task configuration file.
 *
 * <p>The {@code default} block is merged into every task node before binding: {@code repo_roots}
 * for all tasks, {@code retention} for backup tasks. Values set on the task win.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    }

    /**
     * @throws ConfigurationException when the file is missing, is not valid JSON or fails validation
     */
    public KeepsakeConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            throw new ConfigurationException("Config file \"" + configPath + "\" does not exist");
        }

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(configPath));
        } catch (CharacterCodingException e) {
            throw new ConfigurationException("Config file " + configPath + " is not valid UTF-8", e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse config file " + configPath + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Config file " + configPath + " must contain a JSON object");
        }

        JsonNode merged = applyDefaults((ObjectNode) root);
        KeepsakeConfig config;
        try {
            config = mapper.treeToValue(merged, KeepsakeConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Config file " + configPath + " failed validation: " + e.getOriginalMessage(), e);
        }
        validate(config);
        LOG.info("Config file {} loaded with {} task(s)", configPath, config.tasks().size());
        return config;
    }

    private JsonNode applyDefaults(ObjectNode root) {
        JsonNode defaults = root.has("default") ? root.get("default") : root.get("defaults");
        JsonNode tasks = root.get("tasks");
        if (defaults == null || !defaults.isObject() || tasks == null || !tasks.isObject()) {
            return root;
        }
        ObjectNode merged = root.deepCopy();
        ObjectNode mergedTasks = (ObjectNode) merged.get("tasks");
        tasks.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isObject()) {
                return;
            }
            ObjectNode task = (ObjectNode) entry.getValue().deepCopy();
            inherit(task, defaults, "repo_roots", "repoRoots");
            if (isBackupTask(task)) {
                inherit(task, defaults, "retention");
            }
            mergedTasks.set(entry.getKey(), task);
        });
        return merged;
    }

    private void inherit(ObjectNode task, JsonNode defaults, String... names) {
        JsonNode inherited = null;
        for (String name : names) {
            if (defaults.has(name)) {
                inherited = defaults.get(name);
                break;
            }
        }
        if (inherited == null) {
            return;
        }
        String key = names[0];
        for (String name : names) {
            if (task.has(name)) {
                key = name;
                break;
            }
        }
        task.set(key, deepMerge(inherited, task.get(key)));
    }

    private boolean isBackupTask(JsonNode task) {
        JsonNode type = task.get("type");
        if (type == null || !type.isTextual()) {
            return false;
        }
        String value = type.asText();
        return "data-backup".equalsIgnoreCase(value) || "docker-compose-backup".equalsIgnoreCase(value);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base.deepCopy();
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    void validate(KeepsakeConfig config) {
        if (config.tasks().isEmpty()) {
            throw new ConfigurationException("No tasks configured");
        }
        for (Map.Entry<String, TaskConfig> entry : config.tasks().entrySet()) {
            validateTask(entry.getKey(), entry.getValue());
        }
    }

    private void validateTask(String name, TaskConfig task) {
        if (task == null) {
            throw invalid(name, "task definition is empty");
        }
        if (task.type() == null) {
            throw invalid(name, "type is required (data-backup, docker-compose-backup or check)");
        }
        requireText(name, "repo", task.repo());
        requireText(name, "pw_file", task.passwordFile());
        if (task.period() == null) {
            throw invalid(name, "period is required");
        }
        try {
            task.period().toSpec();
        } catch (IllegalArgumentException e) {
            throw invalid(name, "invalid period: " + e.getMessage());
        }
        validateRepoRoots(name, task.repoRoots());

        if (task.type() != JobKind.CHECK) {
            requireText(name, "root", task.root());
            if (task.paths().isEmpty()) {
                throw invalid(name, "paths must list at least one path for backup tasks");
            }
            if (task.retention() == null) {
                throw invalid(name, "retention policy must be specified for backup tasks");
            }
        }
    }

    private void validateRepoRoots(String name, RepoRootsConfig roots) {
        if (roots == null) {
            throw invalid(name, "repository roots must be specified");
        }
        if (roots.localDevices().isEmpty()) {
            throw invalid(name, "repo_roots.local_devices must list at least one device");
        }
        long primaries = roots.localDevices().stream().filter(LocalTarget::primary).count();
        if (primaries > 1) {
            throw invalid(name, "only one local device may be primary, found " + primaries);
        }
        for (LocalTarget device : roots.localDevices()) {
            if (device == null || device.deviceId() == null || device.deviceId().isBlank()) {
                throw invalid(name, "every local device needs a device_id");
            }
        }
        for (RemoteTarget remote : roots.cloudRepos()) {
            if (remote == null || remote.type() == null) {
                throw invalid(name, "every cloud repo needs a type");
            }
            if (remote.path() == null || remote.path().isBlank()) {
                throw invalid(name, "every cloud repo needs a path");
            }
        }
    }

    private void requireText(String name, String field, String value) {
        if (value == null || value.isBlank()) {
            throw invalid(name, field + " is required");
        }
    }

    private ConfigurationException invalid(String name, String detail) {
        return new ConfigurationException("Task '" + name + "': " + detail);
    }
}
