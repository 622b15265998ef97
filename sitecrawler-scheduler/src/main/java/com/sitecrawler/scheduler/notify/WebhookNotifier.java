package com.sitecrawler.scheduler.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitecrawler.common.config.SiteCrawlerConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts notifications as JSON to a webhook:
 * {@code {"subject": ..., "body": ..., "to": ..., "sentAt": ...}}.
 *
 * <p>
 * Delivery is asynchronous; transport errors and non-2xx responses are logged
 * and otherwise ignored.
 */
@Slf4j
public class WebhookNotifier implements Notifier {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String webhookUrl;
    private final String recipient;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookNotifier(SiteCrawlerConfig.NotifyConfig config) {
        this(config.getWebhookUrl(), config.getRecipient(), Duration.ofMillis(config.getTimeoutMs()),
                Clock.systemUTC());
    }

    public WebhookNotifier(String webhookUrl, String recipient, Duration timeout, Clock clock) {
        this.webhookUrl = webhookUrl;
        this.recipient = recipient;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
        if (isEnabled()) {
            log.info("Webhook notifier initialized (url: {}, to: {})", webhookUrl, recipient);
        } else {
            log.warn("Webhook notifier disabled - no webhook URL configured");
        }
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void send(String subject, String body) {
        if (!isEnabled()) {
            log.debug("Webhook send skipped (disabled): {}", subject);
            return;
        }
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("subject", subject);
            payload.put("body", body);
            payload.put("to", recipient);
            payload.put("sentAt", clock.instant().toString());

            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            httpClient.newCall(request).enqueue(new Callback() {
                @Override
                public void onFailure(Call call, IOException e) {
                    log.error("Failed to deliver notification '{}': {}", subject, e.getMessage());
                }

                @Override
                public void onResponse(Call call, Response response) {
                    try (response) {
                        if (response.isSuccessful()) {
                            log.info("Notification sent: {}", subject);
                        } else {
                            log.error("Notification '{}' rejected: HTTP {}", subject, response.code());
                        }
                    }
                }
            });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build notification '{}': {}", subject, e.getMessage());
        }
    }

    /**
     * Release the HTTP client's threads and connections.
     */
    public void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
