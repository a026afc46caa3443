package com.swappo.matchmakingservice.service;

import com.swappo.common.exception.AccessDeniedException;
import com.swappo.common.exception.ResourceNotFoundException;
import com.swappo.matchmakingservice.dto.TradeOfferRequest;
import com.swappo.matchmakingservice.dto.TradeOfferResponse;
import com.swappo.matchmakingservice.dto.TradeStatisticsResponse;
import com.swappo.matchmakingservice.event.TradeOfferTransitionedEvent;
import com.swappo.matchmakingservice.exception.InvalidTradeStateException;
import com.swappo.matchmakingservice.exception.InvalidTradeTransitionException;
import com.swappo.matchmakingservice.lifecycle.TradeOfferTransitions;
import com.swappo.matchmakingservice.mapper.TradeOfferMapper;
import com.swappo.matchmakingservice.metrics.MatchmakingMetrics;
import com.swappo.matchmakingservice.model.TradeOffer;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.model.TradeRole;
import com.swappo.matchmakingservice.repository.OffsetLimitRequest;
import com.swappo.matchmakingservice.repository.TradeOfferRepository;
import com.swappo.matchmakingservice.validation.ItemOwnershipValidator;
import com.swappo.matchmakingservice.validation.TradeOfferRequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class TradeOfferServiceImpl implements TradeOfferService {

    static final int MAX_TRANSITION_ATTEMPTS = 3;
    static final int MAX_PAGE_SIZE = 100;

    private final TradeOfferRepository tradeOfferRepository;
    private final TradeOfferMapper tradeOfferMapper;
    private final TradeOfferRequestValidator requestValidator;
    private final ItemOwnershipValidator itemOwnershipValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final MatchmakingMetrics metrics;
    private final Clock clock;

    // Not transactional: the catalog round trip must not hold a database connection.
    @Override
    public TradeOfferResponse proposeTradeOffer(TradeOfferRequest request, String actorId) {
        log.info("Trade offer proposal started: proposer={}, receiver={}, actor={}",
                request.getProposerId(), request.getReceiverId(), actorId);

        if (!Objects.equals(request.getProposerId(), actorId)) {
            log.warn("Proposer mismatch: proposer={}, actor={}", request.getProposerId(), actorId);
            throw new AccessDeniedException("You can only propose trade offers on your own behalf");
        }

        List<String> errors = requestValidator.validate(request);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }

        itemOwnershipValidator.validateOwnership(request.getOfferedItemIds(), request.getRequestedItemIds(),
                request.getProposerId(), request.getReceiverId());

        TradeOffer offer = new TradeOffer();
        offer.setProposerId(request.getProposerId());
        offer.setReceiverId(request.getReceiverId());
        offer.setOfferedItemIds(new LinkedHashSet<>(request.getOfferedItemIds()));
        offer.setRequestedItemIds(new LinkedHashSet<>(request.getRequestedItemIds()));
        offer.setMessage(request.getMessage());
        offer.setStatus(TradeOfferStatus.PENDING);

        TradeOffer saved = tradeOfferRepository.save(offer);
        metrics.recordOfferCreated();
        log.info("Trade offer created: offerId={}, proposer={}, receiver={}, offered={}, requested={}",
                saved.getId(), saved.getProposerId(), saved.getReceiverId(),
                saved.getOfferedItemIds(), saved.getRequestedItemIds());

        return tradeOfferMapper.toTradeOfferResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public TradeOfferResponse getTradeOffer(Long offerId) {
        return tradeOfferMapper.toTradeOfferResponse(findOffer(offerId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeOfferResponse> listTradeOffers(String userId, TradeOfferStatus status,
                                                    boolean asProposer, boolean asReceiver,
                                                    int limit, int offset) {
        // neither flag means "any role", same as both
        boolean proposerSide = asProposer || !asReceiver;
        boolean receiverSide = asReceiver || !asProposer;

        List<TradeOffer> offers = tradeOfferRepository.findForUser(userId, proposerSide, receiverSide, status,
                page(limit, offset));
        log.debug("Listed {} trade offers: userId={}, status={}, asProposer={}, asReceiver={}",
                offers.size(), userId, status, proposerSide, receiverSide);
        return tradeOfferMapper.toTradeOfferResponses(offers);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeOfferResponse> getReceivedOffers(String userId, TradeOfferStatus status, int limit, int offset) {
        return listTradeOffers(userId, status, false, true, limit, offset);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeOfferResponse> getSentOffers(String userId, TradeOfferStatus status, int limit, int offset) {
        return listTradeOffers(userId, status, true, false, limit, offset);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeOfferResponse> getOffersByItem(Long itemId, TradeOfferStatus status) {
        return tradeOfferMapper.toTradeOfferResponses(tradeOfferRepository.findByItemId(itemId, status));
    }

    /**
     * Applies a status change requested by one of the two parties.
     *
     * The write is conditional on the status this method read. If another request changed the
     * offer in between, the offer is re-read and the request evaluated again against the new
     * status, which normally ends in {@link InvalidTradeTransitionException}.
     */
    @Override
    @Transactional
    public TradeOfferResponse transition(Long offerId, TradeOfferStatus newStatus, String actorId) {
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            TradeOffer offer = findOffer(offerId);
            TradeOfferStatus current = offer.getStatus();

            TradeRole role = TradeRole.of(offer, actorId).orElseThrow(() -> {
                log.warn("Unauthorized transition attempt: offerId={}, actor={}", offerId, actorId);
                return new AccessDeniedException("You are not a party to this trade offer");
            });

            if (!TradeOfferTransitions.isAllowed(current, newStatus, role)) {
                log.warn("Invalid transition: offerId={}, {} -> {}, role={}",
                        offerId, current.getValue(), newStatus.getValue(), role.getValue());
                throw new InvalidTradeTransitionException(
                        "Cannot change trade offer from " + current.getValue() + " to " + newStatus.getValue()
                                + " as " + role.getValue());
            }

            Instant now = clock.instant();
            Instant respondedAt = TradeOfferTransitions.isResponse(current, newStatus) ? now : offer.getRespondedAt();

            int updated = tradeOfferRepository.updateStatus(offerId, newStatus, current, respondedAt, now);
            if (updated == 1) {
                TradeOffer saved = findOffer(offerId);
                log.info("Trade offer transitioned: offerId={}, {} -> {}, actor={}",
                        offerId, current.getValue(), newStatus.getValue(), actorId);

                eventPublisher.publishEvent(TradeOfferTransitionedEvent.builder()
                        .offerId(saved.getId())
                        .proposerId(saved.getProposerId())
                        .receiverId(saved.getReceiverId())
                        .newStatus(newStatus)
                        .actorId(actorId)
                        .build());
                metrics.recordTransition(newStatus);

                return tradeOfferMapper.toTradeOfferResponse(saved);
            }

            log.info("Concurrent status change detected, re-evaluating: offerId={}, expected={}, attempt={}",
                    offerId, current.getValue(), attempt);
        }

        throw new OptimisticLockingFailureException("Trade offer " + offerId + " keeps changing, giving up");
    }

    @Override
    @Transactional
    public void deleteOffer(Long offerId, String actorId) {
        TradeOffer offer = findOffer(offerId);

        if (!Objects.equals(offer.getProposerId(), actorId)) {
            log.warn("Unauthorized delete attempt: offerId={}, actor={}", offerId, actorId);
            throw new AccessDeniedException("Only the proposer can delete a trade offer");
        }
        if (offer.getStatus() != TradeOfferStatus.PENDING) {
            throw new InvalidTradeStateException(
                    "Only pending trade offers can be deleted, current status: " + offer.getStatus().getValue());
        }

        tradeOfferRepository.delete(offer);
        log.info("Trade offer deleted: offerId={}, proposer={}", offerId, actorId);
    }

    @Override
    @Transactional(readOnly = true)
    public TradeStatisticsResponse getStatistics(String userId) {
        Map<TradeOfferStatus, Long> counts = new EnumMap<>(TradeOfferStatus.class);
        for (TradeOfferRepository.StatusCount row : tradeOfferRepository.countByStatusForUser(userId)) {
            counts.put(row.getStatus(), row.getTotal());
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        return TradeStatisticsResponse.builder()
                .totalOffers(total)
                .pendingOffers(counts.getOrDefault(TradeOfferStatus.PENDING, 0L))
                .acceptedOffers(counts.getOrDefault(TradeOfferStatus.ACCEPTED, 0L))
                .rejectedOffers(counts.getOrDefault(TradeOfferStatus.REJECTED, 0L))
                .completedOffers(counts.getOrDefault(TradeOfferStatus.COMPLETED, 0L))
                .build();
    }

    private TradeOffer findOffer(Long offerId) {
        return tradeOfferRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Trade offer not found: " + offerId));
    }

    private static OffsetLimitRequest page(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return OffsetLimitRequest.newestFirst(offset, limit);
    }
}
