package com.swappo.matchmakingservice.service;

import com.swappo.common.exception.AccessDeniedException;
import com.swappo.common.exception.ResourceNotFoundException;
import com.swappo.matchmakingservice.dto.TradeOfferRequest;
import com.swappo.matchmakingservice.dto.TradeOfferResponse;
import com.swappo.matchmakingservice.dto.TradeStatisticsResponse;
import com.swappo.matchmakingservice.event.TradeOfferTransitionedEvent;
import com.swappo.matchmakingservice.exception.DependencyUnavailableException;
import com.swappo.matchmakingservice.exception.InvalidTradeStateException;
import com.swappo.matchmakingservice.exception.InvalidTradeTransitionException;
import com.swappo.matchmakingservice.exception.ItemValidationException;
import com.swappo.matchmakingservice.mapper.TradeOfferMapper;
import com.swappo.matchmakingservice.metrics.MatchmakingMetrics;
import com.swappo.matchmakingservice.model.TradeOffer;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.orchestration.ItemVerdict;
import com.swappo.matchmakingservice.orchestration.ResilientCallOrchestrator;
import com.swappo.matchmakingservice.repository.TradeOfferRepository;
import com.swappo.matchmakingservice.resilience.DependencyName;
import com.swappo.matchmakingservice.validation.ItemOwnershipValidator;
import com.swappo.matchmakingservice.validation.TradeOfferRequestValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradeOfferServiceImplTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";
    private static final Long OFFER_ID = 7L;
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TradeOfferRepository tradeOfferRepository;
    @Mock
    private ResilientCallOrchestrator orchestrator;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private TradeOfferServiceImpl tradeOfferService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        TradeOfferMapper mapper = Mappers.getMapper(TradeOfferMapper.class);
        tradeOfferService = new TradeOfferServiceImpl(
                tradeOfferRepository,
                mapper,
                new TradeOfferRequestValidator(),
                new ItemOwnershipValidator(orchestrator),
                eventPublisher,
                new MatchmakingMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TradeOfferRequest offerRequest() {
        return TradeOfferRequest.builder()
                .proposerId(ALICE)
                .receiverId(BOB)
                .offeredItemIds(List.of(1L, 2L))
                .requestedItemIds(List.of(3L))
                .message("Swap my two books for your lamp?")
                .build();
    }

    private static TradeOffer offer(TradeOfferStatus status) {
        TradeOffer offer = new TradeOffer();
        offer.setId(OFFER_ID);
        offer.setProposerId(ALICE);
        offer.setReceiverId(BOB);
        offer.setOfferedItemIds(new LinkedHashSet<>(List.of(1L, 2L)));
        offer.setRequestedItemIds(new LinkedHashSet<>(List.of(3L)));
        offer.setStatus(status);
        offer.setCreatedAt(NOW.minusSeconds(3600));
        offer.setVersion(0L);
        return offer;
    }

    private static TradeOffer copyWith(TradeOffer source, TradeOfferStatus status, Instant respondedAt) {
        TradeOffer copy = offer(status);
        copy.setRespondedAt(respondedAt);
        copy.setUpdatedAt(NOW);
        copy.setVersion(source.getVersion() + 1);
        return copy;
    }

    // --- PROPOSE ---

    @Test
    void proposeTradeOffer_CreatesPendingOffer_WhenItemsValid() {
        // Arrange
        when(orchestrator.validateItems(List.of(1L, 2L, 3L))).thenReturn(List.of(
                new ItemVerdict(1L, true, true, ALICE),
                new ItemVerdict(2L, true, true, ALICE),
                new ItemVerdict(3L, true, true, BOB)));
        when(tradeOfferRepository.save(any(TradeOffer.class))).thenAnswer(i -> {
            TradeOffer o = i.getArgument(0);
            o.setId(OFFER_ID);
            o.setCreatedAt(NOW);
            return o;
        });

        // Act
        TradeOfferResponse response = tradeOfferService.proposeTradeOffer(offerRequest(), ALICE);

        // Assert
        assertThat(response.getId()).isEqualTo(OFFER_ID);
        assertThat(response.getStatus()).isEqualTo(TradeOfferStatus.PENDING);
        assertThat(response.getOfferedItemIds()).containsExactly(1L, 2L);
        assertThat(response.getRequestedItemIds()).containsExactly(3L);
        assertThat(response.getRespondedAt()).isNull();

        ArgumentCaptor<TradeOffer> saved = ArgumentCaptor.forClass(TradeOffer.class);
        verify(tradeOfferRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(TradeOfferStatus.PENDING);
        assertThat(saved.getValue().getMessage()).isEqualTo("Swap my two books for your lamp?");
        assertThat(meterRegistry.counter("matchmaking.offers.created").count()).isEqualTo(1.0);
    }

    @Test
    void proposeTradeOffer_Fails_WhenActorIsNotProposer() {
        assertThatThrownBy(() -> tradeOfferService.proposeTradeOffer(offerRequest(), BOB))
                .isInstanceOf(AccessDeniedException.class);

        verifyNoInteractions(orchestrator, tradeOfferRepository);
    }

    @Test
    void proposeTradeOffer_SkipsCatalog_WhenStructurallyInvalid() {
        TradeOfferRequest request = offerRequest();
        request.setRequestedItemIds(List.of(2L));

        assertThatThrownBy(() -> tradeOfferService.proposeTradeOffer(request, ALICE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Same item cannot be both offered and requested");

        verifyNoInteractions(orchestrator, tradeOfferRepository);
    }

    @Test
    void proposeTradeOffer_StoresNothing_WhenItemValidationFails() {
        when(orchestrator.validateItems(anyList())).thenReturn(List.of(
                new ItemVerdict(1L, true, true, ALICE),
                new ItemVerdict(2L, true, false, ALICE),
                new ItemVerdict(3L, true, true, BOB)));

        assertThatThrownBy(() -> tradeOfferService.proposeTradeOffer(offerRequest(), ALICE))
                .isInstanceOf(ItemValidationException.class)
                .hasMessage("Items are not active: [2]");

        verify(tradeOfferRepository, never()).save(any());
    }

    @Test
    void proposeTradeOffer_StoresNothing_WhenCatalogUnavailable() {
        when(orchestrator.validateItems(anyList())).thenThrow(new DependencyUnavailableException(
                DependencyName.CATALOG, "Catalog service unavailable", null));

        assertThatThrownBy(() -> tradeOfferService.proposeTradeOffer(offerRequest(), ALICE))
                .isInstanceOf(DependencyUnavailableException.class);

        verify(tradeOfferRepository, never()).save(any());
    }

    // --- TRANSITION ---

    @Test
    void transition_ReceiverAccepts_StampsRespondedAtAndPublishesEvent() {
        // Arrange
        TradeOffer pending = offer(TradeOfferStatus.PENDING);
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(
                Optional.of(pending),
                Optional.of(copyWith(pending, TradeOfferStatus.ACCEPTED, NOW)));
        when(tradeOfferRepository.updateStatus(OFFER_ID, TradeOfferStatus.ACCEPTED, TradeOfferStatus.PENDING, NOW, NOW))
                .thenReturn(1);

        // Act
        TradeOfferResponse response = tradeOfferService.transition(OFFER_ID, TradeOfferStatus.ACCEPTED, BOB);

        // Assert
        assertThat(response.getStatus()).isEqualTo(TradeOfferStatus.ACCEPTED);
        assertThat(response.getRespondedAt()).isEqualTo(NOW);

        ArgumentCaptor<TradeOfferTransitionedEvent> event = ArgumentCaptor.forClass(TradeOfferTransitionedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getNewStatus()).isEqualTo(TradeOfferStatus.ACCEPTED);
        assertThat(event.getValue().getActorId()).isEqualTo(BOB);
        assertThat(event.getValue().counterpartyId()).isEqualTo(ALICE);
        assertThat(meterRegistry.counter("matchmaking.offers.transitions", "status", "accepted").count())
                .isEqualTo(1.0);
    }

    @Test
    void transition_Completed_KeepsOriginalRespondedAt() {
        Instant respondedAt = NOW.minusSeconds(600);
        TradeOffer accepted = offer(TradeOfferStatus.ACCEPTED);
        accepted.setRespondedAt(respondedAt);
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(
                Optional.of(accepted),
                Optional.of(copyWith(accepted, TradeOfferStatus.COMPLETED, respondedAt)));
        when(tradeOfferRepository.updateStatus(any(), any(), any(), any(), any())).thenReturn(1);

        TradeOfferResponse response = tradeOfferService.transition(OFFER_ID, TradeOfferStatus.COMPLETED, ALICE);

        verify(tradeOfferRepository).updateStatus(OFFER_ID, TradeOfferStatus.COMPLETED, TradeOfferStatus.ACCEPTED,
                respondedAt, NOW);
        assertThat(response.getRespondedAt()).isEqualTo(respondedAt);
    }

    @Test
    void transition_Cancelled_DoesNotStampRespondedAt() {
        TradeOffer pending = offer(TradeOfferStatus.PENDING);
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(
                Optional.of(pending),
                Optional.of(copyWith(pending, TradeOfferStatus.CANCELLED, null)));
        when(tradeOfferRepository.updateStatus(any(), any(), any(), any(), any())).thenReturn(1);

        tradeOfferService.transition(OFFER_ID, TradeOfferStatus.CANCELLED, ALICE);

        verify(tradeOfferRepository).updateStatus(eq(OFFER_ID), eq(TradeOfferStatus.CANCELLED),
                eq(TradeOfferStatus.PENDING), isNull(), eq(NOW));
    }

    @Test
    void transition_Fails_ForStranger_BeforeCheckingTheTable() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(offer(TradeOfferStatus.COMPLETED)));

        assertThatThrownBy(() -> tradeOfferService.transition(OFFER_ID, TradeOfferStatus.ACCEPTED, "mallory"))
                .isInstanceOf(AccessDeniedException.class);

        verify(tradeOfferRepository, never()).updateStatus(any(), any(), any(), any(), any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void transition_Fails_WhenProposerAcceptsOwnOffer() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(offer(TradeOfferStatus.PENDING)));

        assertThatThrownBy(() -> tradeOfferService.transition(OFFER_ID, TradeOfferStatus.ACCEPTED, ALICE))
                .isInstanceOf(InvalidTradeTransitionException.class)
                .hasMessage("Cannot change trade offer from pending to accepted as proposer");
    }

    @Test
    void transition_Fails_WhenOfferMissing() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tradeOfferService.transition(OFFER_ID, TradeOfferStatus.ACCEPTED, BOB))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void transition_ConcurrentLoser_ReReadsAndFailsWithInvalidTransition() {
        // Arrange: proposer cancelled between our read and our conditional write
        TradeOffer pending = offer(TradeOfferStatus.PENDING);
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(
                Optional.of(pending),
                Optional.of(copyWith(pending, TradeOfferStatus.CANCELLED, null)));
        when(tradeOfferRepository.updateStatus(OFFER_ID, TradeOfferStatus.ACCEPTED, TradeOfferStatus.PENDING, NOW, NOW))
                .thenReturn(0);

        // Act & Assert
        assertThatThrownBy(() -> tradeOfferService.transition(OFFER_ID, TradeOfferStatus.ACCEPTED, BOB))
                .isInstanceOf(InvalidTradeTransitionException.class)
                .hasMessageContaining("from cancelled to accepted");

        verify(tradeOfferRepository, times(2)).findById(OFFER_ID);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void transition_GivesUp_WhenConditionalWriteKeepsLosing() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(offer(TradeOfferStatus.PENDING)));
        when(tradeOfferRepository.updateStatus(any(), any(), any(), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> tradeOfferService.transition(OFFER_ID, TradeOfferStatus.REJECTED, BOB))
                .isInstanceOf(OptimisticLockingFailureException.class);

        verify(tradeOfferRepository, times(TradeOfferServiceImpl.MAX_TRANSITION_ATTEMPTS))
                .updateStatus(any(), any(), any(), any(), any());
    }

    // --- DELETE ---

    @Test
    void deleteOffer_Succeeds_ForProposerWhilePending() {
        TradeOffer pending = offer(TradeOfferStatus.PENDING);
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(pending));

        tradeOfferService.deleteOffer(OFFER_ID, ALICE);

        verify(tradeOfferRepository).delete(pending);
    }

    @Test
    void deleteOffer_Fails_ForProposerWhenAccepted() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(offer(TradeOfferStatus.ACCEPTED)));

        assertThatThrownBy(() -> tradeOfferService.deleteOffer(OFFER_ID, ALICE))
                .isInstanceOf(InvalidTradeStateException.class);

        verify(tradeOfferRepository, never()).delete(any());
    }

    @Test
    void deleteOffer_Fails_ForReceiverWhilePending() {
        when(tradeOfferRepository.findById(OFFER_ID)).thenReturn(Optional.of(offer(TradeOfferStatus.PENDING)));

        assertThatThrownBy(() -> tradeOfferService.deleteOffer(OFFER_ID, BOB))
                .isInstanceOf(AccessDeniedException.class);

        verify(tradeOfferRepository, never()).delete(any());
    }

    // --- QUERIES ---

    @Test
    void listTradeOffers_NeitherRoleFlag_MeansBothRoles() {
        when(tradeOfferRepository.findForUser(eq(ALICE), eq(true), eq(true), isNull(), any(Pageable.class)))
                .thenReturn(List.of(offer(TradeOfferStatus.PENDING)));

        List<TradeOfferResponse> offers = tradeOfferService.listTradeOffers(ALICE, null, false, false, 20, 0);

        assertThat(offers).hasSize(1);
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(tradeOfferRepository).findForUser(eq(ALICE), eq(true), eq(true), isNull(), page.capture());
        assertThat(page.getValue().getOffset()).isZero();
        assertThat(page.getValue().getPageSize()).isEqualTo(20);
        assertThat(page.getValue().getSort().getOrderFor("createdAt").isDescending()).isTrue();
    }

    @Test
    void getReceivedOffers_FiltersToReceiverSide() {
        tradeOfferService.getReceivedOffers(BOB, TradeOfferStatus.PENDING, 10, 30);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(tradeOfferRepository).findForUser(eq(BOB), eq(false), eq(true), eq(TradeOfferStatus.PENDING),
                page.capture());
        assertThat(page.getValue().getOffset()).isEqualTo(30);
    }

    @Test
    void listTradeOffers_RejectsLimitOutOfRange() {
        assertThatThrownBy(() -> tradeOfferService.listTradeOffers(ALICE, null, true, false, 101, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tradeOfferService.listTradeOffers(ALICE, null, true, false, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tradeOfferService.listTradeOffers(ALICE, null, true, false, 20, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getStatistics_SumsStatusCounts() {
        when(tradeOfferRepository.countByStatusForUser(ALICE)).thenReturn(List.of(
                statusCount(TradeOfferStatus.PENDING, 2),
                statusCount(TradeOfferStatus.ACCEPTED, 1),
                statusCount(TradeOfferStatus.CANCELLED, 4)));

        TradeStatisticsResponse statistics = tradeOfferService.getStatistics(ALICE);

        assertThat(statistics.getTotalOffers()).isEqualTo(7);
        assertThat(statistics.getPendingOffers()).isEqualTo(2);
        assertThat(statistics.getAcceptedOffers()).isEqualTo(1);
        assertThat(statistics.getRejectedOffers()).isZero();
        assertThat(statistics.getCompletedOffers()).isZero();
    }

    @Test
    void getOffersByItem_MapsRepositoryResult() {
        when(tradeOfferRepository.findByItemId(3L, null)).thenReturn(List.of(offer(TradeOfferStatus.PENDING)));

        List<TradeOfferResponse> offers = tradeOfferService.getOffersByItem(3L, null);

        assertThat(offers).hasSize(1);
        assertThat(offers.get(0).getRequestedItemIds()).containsExactly(3L);
        assertThat(offers.get(0).getOfferedItemIds()).containsExactly(1L, 2L);
    }

    private static TradeOfferRepository.StatusCount statusCount(TradeOfferStatus status, long total) {
        return new TradeOfferRepository.StatusCount() {
            @Override
            public TradeOfferStatus getStatus() {
                return status;
            }

            @Override
            public Long getTotal() {
                return total;
            }
        };
    }
}
