package io.keepsake.core.notify;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes notifications to an ntfy topic.
 */
public final class NtfyNotificationSink implements NotificationSink {
    private static final Logger LOG = LoggerFactory.getLogger(NtfyNotificationSink.class);
    private static final MediaType TEXT = MediaType.get("text/plain; charset=utf-8");

    private final HttpUrl topicUrl;
    private final String token;
    private final List<String> tags;
    private final OkHttpClient client;

    public NtfyNotificationSink(String topicUrl, String token, List<String> tags) {
        this(topicUrl, token, tags, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(20))
            .writeTimeout(Duration.ofSeconds(20))
            .build());
    }

    public NtfyNotificationSink(String topicUrl, String token, List<String> tags, OkHttpClient client) {
        this.topicUrl = HttpUrl.get(Objects.requireNonNull(topicUrl, "topicUrl must not be null"));
        this.token = token == null ? "" : token;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public void notify(String title, String body, Priority priority) {
        try (Response response = client.newCall(buildRequest(title, body, priority)).execute()) {
            if (response.isSuccessful()) {
                LOG.debug("ntfy message sent: {}", title);
            } else {
                String errorBody = response.body() == null ? "" : response.body().string();
                LOG.error("Unable to send ntfy message: {} - {}", response.code(), errorBody);
            }
        } catch (IOException | RuntimeException e) {
            // okhttp rejects non-ascii header values with IllegalArgumentException
            LOG.error("Failed to send ntfy message '{}'", title, e);
        }
    }

    private Request buildRequest(String title, String body, Priority priority) {
        Request.Builder builder = new Request.Builder()
            .url(topicUrl)
            .post(RequestBody.create(body == null ? "" : body, TEXT))
            .header("Title", title == null ? "" : title)
            .header("Priority", priority.wireValue());
        if (!tags.isEmpty()) {
            builder.header("Tags", String.join(",", tags));
        }
        if (!token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }
}
