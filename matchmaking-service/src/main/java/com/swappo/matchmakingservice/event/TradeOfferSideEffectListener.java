package com.swappo.matchmakingservice.event;

import com.swappo.common.contracts.ChatRoomRequestContract;
import com.swappo.common.contracts.NotificationRequestContract;
import com.swappo.matchmakingservice.lifecycle.TradeNotificationTemplate;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.orchestration.ResilientCallOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs the side effects of a committed status change on the side-effect executor:
 * a notification to the other party and, for accepted offers, a chat room.
 * Failures are logged and counted by the orchestrator; the transition stands.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeOfferSideEffectListener {

    private final ResilientCallOrchestrator orchestrator;

    @Async("sideEffectExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTradeOfferTransitioned(TradeOfferTransitionedEvent event) {
        log.info("Dispatching side effects after commit: offerId={}, status={}, actor={}",
                event.getOfferId(), event.getNewStatus().getValue(), event.getActorId());

        TradeNotificationTemplate.forStatus(event.getNewStatus()).ifPresent(template -> {
            NotificationRequestContract notification = NotificationRequestContract.builder()
                    .recipientId(event.counterpartyId())
                    .type(template.getType())
                    .title(template.getTitle())
                    .body(template.getBody())
                    .relatedOfferId(event.getOfferId())
                    .relatedUserId(event.getActorId())
                    .build();
            orchestrator.notify(notification);
        });

        if (event.getNewStatus() == TradeOfferStatus.ACCEPTED) {
            ChatRoomRequestContract chatRoom = ChatRoomRequestContract.builder()
                    .tradeOfferId(event.getOfferId())
                    .userAId(event.getProposerId())
                    .userBId(event.getReceiverId())
                    .build();
            orchestrator.provisionChatRoom(chatRoom);
        }
    }
}
