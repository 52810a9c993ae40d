package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.notification.gateway.LoggingPushGateway;
import com.delangzeta.realtime.notification.gateway.PushGateway;
import com.delangzeta.realtime.notification.gateway.WebClientPushGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfig {

    @Bean
    public PushGateway pushGateway(NotificationProperties properties, WebClient.Builder webClientBuilder) {
        String url = properties.getGatewayUrl();
        if (url == null || url.isBlank()) {
            log.warn("realtime.notification.gateway-url not set; push notifications are only logged");
            return new LoggingPushGateway();
        }
        return new WebClientPushGateway(webClientBuilder, url, properties.getGatewayApiKey());
    }
}
