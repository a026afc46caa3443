package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.NotificationRequestContract;

public interface NotificationClient {

    /**
     * Creates one notification. Returns normally only if the service accepted it.
     */
    void send(NotificationRequestContract notification);
}
