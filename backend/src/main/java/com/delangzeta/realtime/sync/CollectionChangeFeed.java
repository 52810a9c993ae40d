package com.delangzeta.realtime.sync;

import java.util.function.Consumer;

public interface CollectionChangeFeed {

    /**
     * Delivers inserts, updates and replacements on {@code collection}. When {@code ownerUserId} is set only
     * documents whose userId equals it are delivered.
     */
    ChangeSubscription watch(String collection, String ownerUserId, Consumer<DocumentChange> listener);

    @FunctionalInterface
    interface ChangeSubscription {
        void cancel();
    }
}
