package com.swappo.matchmakingservice.validation;

import com.swappo.matchmakingservice.exception.ItemValidationException;
import com.swappo.matchmakingservice.model.TradeRole;
import com.swappo.matchmakingservice.orchestration.ItemVerdict;
import com.swappo.matchmakingservice.orchestration.ResilientCallOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Verifies through the catalog that every item of a proposed trade exists, is active
 * and belongs to the right party.
 *
 * One batched catalog call, then checks in fixed order: existence, activity, proposer
 * ownership of offered items, receiver ownership of requested items. The first failing
 * check is reported with every offending id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemOwnershipValidator {

    private final ResilientCallOrchestrator orchestrator;

    /**
     * @throws ItemValidationException  if any item check fails
     * @throws com.swappo.matchmakingservice.exception.DependencyUnavailableException if the catalog cannot answer
     */
    public void validateOwnership(Collection<Long> offeredIds, Collection<Long> requestedIds,
                                  String proposerId, String receiverId) {
        List<Long> allIds = new ArrayList<>(offeredIds);
        allIds.addAll(requestedIds);

        List<ItemVerdict> verdicts = orchestrator.validateItems(allIds);
        Map<Long, ItemVerdict> byId = verdicts.stream()
                .collect(Collectors.toMap(ItemVerdict::getItemId, Function.identity(), (first, second) -> first));

        List<Long> missing = offending(allIds, byId, verdict -> !verdict.isExists());
        if (!missing.isEmpty()) {
            log.warn("Trade offer items not found: proposer={}, itemIds={}", proposerId, missing);
            throw ItemValidationException.notFound(missing);
        }

        List<Long> inactive = offending(allIds, byId, verdict -> !verdict.isActive());
        if (!inactive.isEmpty()) {
            log.warn("Trade offer items not active: proposer={}, itemIds={}", proposerId, inactive);
            throw ItemValidationException.inactive(inactive);
        }

        List<Long> notProposers = offending(offeredIds, byId, verdict -> !Objects.equals(verdict.getOwnerId(), proposerId));
        if (!notProposers.isEmpty()) {
            log.warn("Proposer does not own offered items: proposer={}, itemIds={}", proposerId, notProposers);
            throw ItemValidationException.wrongOwner(notProposers, TradeRole.PROPOSER);
        }

        List<Long> notReceivers = offending(requestedIds, byId, verdict -> !Objects.equals(verdict.getOwnerId(), receiverId));
        if (!notReceivers.isEmpty()) {
            log.warn("Receiver does not own requested items: receiver={}, itemIds={}", receiverId, notReceivers);
            throw ItemValidationException.wrongOwner(notReceivers, TradeRole.RECEIVER);
        }

        log.info("All {} items validated via catalog: proposer={}, receiver={}", allIds.size(), proposerId, receiverId);
    }

    private static List<Long> offending(Collection<Long> ids, Map<Long, ItemVerdict> byId, Predicate<ItemVerdict> fails) {
        return ids.stream()
                .distinct()
                .filter(id -> fails.test(byId.getOrDefault(id, ItemVerdict.notFound(id))))
                .collect(Collectors.toList());
    }
}
