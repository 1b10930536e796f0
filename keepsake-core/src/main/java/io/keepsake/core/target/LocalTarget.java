package io.keepsake.core.target;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A block device that holds a copy of the repository under its first mount point.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocalTarget(
    String name,
    @JsonAlias({"device_id"}) String deviceId,
    boolean primary
) {

    public TargetRole role() {
        return primary ? TargetRole.PRIMARY : TargetRole.SECONDARY;
    }

    public String label() {
        return name == null || name.isBlank() ? deviceId : name + " (" + deviceId + ")";
    }
}
