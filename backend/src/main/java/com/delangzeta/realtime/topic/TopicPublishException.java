package com.delangzeta.realtime.topic;

public class TopicPublishException extends RuntimeException {

    public TopicPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
