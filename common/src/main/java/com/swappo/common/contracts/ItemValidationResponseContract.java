package com.swappo.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog service reply to {@link ItemValidationRequestContract}.
 *
 * The catalog may omit ids it has never heard of; callers must treat a
 * missing id the same as {@code exists=false}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemValidationResponseContract {

    @JsonProperty("validations")
    private List<ItemValidation> validations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemValidation {

        @JsonProperty("item_id")
        private Long itemId;

        @JsonProperty("exists")
        private boolean exists;

        @JsonProperty("is_active")
        private boolean active;

        // null when the item does not exist
        @JsonProperty("owner_id")
        private String ownerId;
    }
}
