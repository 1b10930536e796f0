package io.keepsake.core.target;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.file.Path;
import java.util.Map;

/**
 * An object-storage endpoint that receives a replica of the primary repository.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteTarget(
    RemoteType type,
    String path,
    String key,
    @JsonAlias({"key_id"}) String keyId
) {

    public Map<String, String> credentials() {
        return type.credentials(keyId == null ? "" : keyId, key == null ? "" : key);
    }

    public String endpoint() {
        return type.prefix() + path;
    }

    public RepositoryLocation repository(String repoName, Path passwordFile) {
        String root = endpoint();
        if (!root.endsWith("/")) {
            root += "/";
        }
        return new RepositoryLocation(root + repoName, passwordFile, credentials());
    }

    @Override
    public String toString() {
        return "RemoteTarget[type=" + type + ", path=" + path + ", keyId=" + keyId + ", key=****]";
    }
}
