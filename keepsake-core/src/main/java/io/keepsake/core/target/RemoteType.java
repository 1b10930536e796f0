package io.keepsake.core.target;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public enum RemoteType {
    @JsonProperty("s3-compatible")
    S3_COMPATIBLE("s3:") {
        @Override
        Map<String, String> credentials(String keyId, String key) {
            return Map.of(
                "AWS_ACCESS_KEY_ID", keyId,
                "AWS_SECRET_ACCESS_KEY", key
            );
        }
    };

    private final String prefix;

    RemoteType(String prefix) {
        this.prefix = prefix;
    }

    String prefix() {
        return prefix;
    }

    abstract Map<String, String> credentials(String keyId, String key);
}
