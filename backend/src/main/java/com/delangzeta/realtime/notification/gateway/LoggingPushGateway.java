package com.delangzeta.realtime.notification.gateway;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Used when no gateway url is configured: logs and reports every token as delivered.
 */
@Slf4j
public class LoggingPushGateway implements PushGateway {

    @Override
    public Mono<PushResult> send(PushMessage message) {
        log.info("Push (not sent, no gateway configured): '{}' to {} device(s)", message.title(), message.tokens().size());
        return Mono.just(new PushResult(message.tokens().stream().map(PushResult.TokenResult::ok).toList()));
    }
}
