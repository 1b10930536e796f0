package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeepsakeConfig(
    NtfyConfig ntfy,
    ResticConfig restic,
    @JsonProperty("default") @JsonAlias({"defaults"}) DefaultsConfig taskDefaults,
    Map<String, TaskConfig> tasks
) {

    public KeepsakeConfig {
        restic = restic == null ? ResticConfig.defaults() : restic;
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    /**
     * @throws IllegalArgumentException when a name does not match a configured task
     */
    public KeepsakeConfig select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        Map<String, TaskConfig> selected = new LinkedHashMap<>();
        for (String name : names) {
            TaskConfig task = tasks.get(name);
            if (task == null) {
                throw new IllegalArgumentException("Unknown task '" + name + "', configured tasks: " + tasks.keySet());
            }
            selected.put(name, task);
        }
        return new KeepsakeConfig(ntfy, restic, taskDefaults, selected);
    }

    public boolean notificationsConfigured() {
        return ntfy != null && ntfy.configured();
    }
}
