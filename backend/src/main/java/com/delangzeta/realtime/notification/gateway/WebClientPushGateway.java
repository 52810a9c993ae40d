package com.delangzeta.realtime.notification.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FCM legacy-style HTTP gateway: one POST per message with {@code registration_ids}; the response
 * {@code results[]} is positional, one entry per token.
 */
@Slf4j
public class WebClientPushGateway implements PushGateway {

    private static final String TTL_SECONDS = "86400";

    private final WebClient webClient;

    public WebClientPushGateway(WebClient.Builder webClientBuilder, String gatewayUrl, String apiKey) {
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(gatewayUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "key=" + apiKey);
        }
        this.webClient = builder.build();
    }

    @Override
    public Mono<PushResult> send(PushMessage message) {
        return webClient.post()
                .bodyValue(requestBody(message))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> parse(message.tokens(), response));
    }

    static Map<String, Object> requestBody(PushMessage message) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("title", message.title());
        notification.put("body", message.body());
        notification.put("icon", message.icon());
        notification.put("badge", message.badge());
        notification.put("tag", message.tag());

        Map<String, Object> webNotification = new LinkedHashMap<>(notification);
        webNotification.put("requireInteraction", message.requireInteraction());
        webNotification.put("actions", actions(message.data()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("registration_ids", message.tokens());
        body.put("notification", notification);
        body.put("data", message.data());
        body.put("webpush", Map.of("headers", Map.of("TTL", TTL_SECONDS), "notification", webNotification));
        return body;
    }

    private static List<Map<String, String>> actions(Map<String, Object> data) {
        Object type = data == null ? null : data.get("type");
        List<Map<String, String>> actions = new ArrayList<>();
        if ("task_created".equals(type)) {
            actions.add(Map.of("action", "view_task", "title", "View Task"));
        } else if ("reward_received".equals(type)) {
            actions.add(Map.of("action", "view_rewards", "title", "View Rewards"));
        } else {
            actions.add(Map.of("action", "open_app", "title", "Open App"));
        }
        actions.add(Map.of("action", "dismiss", "title", "Dismiss"));
        return actions;
    }

    static PushResult parse(List<String> tokens, JsonNode response) {
        JsonNode results = response == null ? null : response.get("results");
        List<PushResult.TokenResult> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            JsonNode r = results != null && results.size() > i ? results.get(i) : null;
            if (r == null) {
                out.add(PushResult.TokenResult.failed(tokens.get(i), "MissingResult"));
            } else if (r.hasNonNull("error")) {
                out.add(PushResult.TokenResult.failed(tokens.get(i), r.get("error").asText()));
            } else {
                out.add(PushResult.TokenResult.ok(tokens.get(i)));
            }
        }
        return new PushResult(out);
    }
}
