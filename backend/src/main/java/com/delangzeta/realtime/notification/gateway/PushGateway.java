package com.delangzeta.realtime.notification.gateway;

import reactor.core.publisher.Mono;

public interface PushGateway {

    /**
     * Sends one message to its tokens. Errors signal a transport failure for the whole message; per-token
     * rejections come back inside the result.
     */
    Mono<PushResult> send(PushMessage message);
}
