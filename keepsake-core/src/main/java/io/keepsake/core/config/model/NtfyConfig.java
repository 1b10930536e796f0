package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NtfyConfig(
    @JsonAlias({"topic_url"}) String topicUrl,
    String token,
    List<String> tags
) {

    public NtfyConfig {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean configured() {
        return topicUrl != null && !topicUrl.isBlank();
    }
}
