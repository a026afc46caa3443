package com.swappo.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch request to the catalog service asking for existence, activity and
 * ownership facts of the given items.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemValidationRequestContract {

    @JsonProperty("item_ids")
    private List<Long> itemIds;
}
