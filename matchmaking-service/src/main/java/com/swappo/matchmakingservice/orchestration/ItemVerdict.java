package com.swappo.matchmakingservice.orchestration;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Catalog facts about one item, built fresh for each validation call.
 */
@Value
@AllArgsConstructor
public class ItemVerdict {
    Long itemId;
    boolean exists;
    boolean active;
    // null when the item does not exist
    String ownerId;

    public static ItemVerdict notFound(Long itemId) {
        return new ItemVerdict(itemId, false, false, null);
    }
}
