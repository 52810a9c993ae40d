package com.delangzeta.realtime.domain;

import java.util.List;

public interface UserNotificationRepositoryCustom {

    /** Newest first, offset based. */
    List<UserNotification> findHistory(String userId, int limit, int offset);
}
