package com.swappo.matchmakingservice.validation;

import com.swappo.matchmakingservice.dto.TradeOfferRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural checks that need no remote call: self trades, duplicate ids, overlap.
 */
@Slf4j
@Component
public class TradeOfferRequestValidator {

    /**
     * Returns list of validation errors. Empty list means valid.
     */
    public List<String> validate(TradeOfferRequest request) {
        List<String> errors = new ArrayList<>();

        if (request == null) {
            errors.add("Trade offer request is null");
            return errors;
        }

        if (Objects.equals(request.getProposerId(), request.getReceiverId())) {
            errors.add("Cannot create trade offer with yourself");
        }

        List<Long> offered = request.getOfferedItemIds() == null ? List.of() : request.getOfferedItemIds();
        List<Long> requested = request.getRequestedItemIds() == null ? List.of() : request.getRequestedItemIds();

        if (offered.isEmpty()) {
            errors.add("Offer must contain at least one offered item");
        }
        if (requested.isEmpty()) {
            errors.add("Offer must request at least one item");
        }

        Set<Long> offeredSet = new HashSet<>(offered);
        Set<Long> requestedSet = new HashSet<>(requested);

        if (offeredSet.size() != offered.size()) {
            errors.add("Duplicate item IDs in offered items");
        }
        if (requestedSet.size() != requested.size()) {
            errors.add("Duplicate item IDs in requested items");
        }

        offeredSet.retainAll(requestedSet);
        if (!offeredSet.isEmpty()) {
            errors.add("Same item cannot be both offered and requested: " + offeredSet);
        }

        if (!errors.isEmpty()) {
            log.debug("Trade offer request rejected: proposer={}, receiver={}, errors={}",
                    request.getProposerId(), request.getReceiverId(), errors);
        }
        return errors;
    }
}
