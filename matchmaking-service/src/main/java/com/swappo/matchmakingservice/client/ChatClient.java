package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.ChatRoomRequestContract;

public interface ChatClient {

    /**
     * Creates the chat room for an accepted offer. Returns normally only if the service accepted it.
     */
    void createRoom(ChatRoomRequestContract chatRoom);
}
