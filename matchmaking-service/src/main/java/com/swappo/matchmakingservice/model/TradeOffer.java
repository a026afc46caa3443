package com.swappo.matchmakingservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "trade_offers", indexes = {
        @Index(name = "ix_trade_offers_proposer", columnList = "proposer_id"),
        @Index(name = "ix_trade_offers_receiver", columnList = "receiver_id"),
        @Index(name = "ix_trade_offers_status", columnList = "status")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class TradeOffer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    // User making the offer
    @Column(name = "proposer_id", nullable = false, length = 100)
    @ToString.Include
    private String proposerId;

    // User receiving the offer
    @Column(name = "receiver_id", nullable = false, length = 100)
    @ToString.Include
    private String receiverId;

    // Items given by the proposer (catalog ids, owned by the catalog service)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_offer_offered_items", joinColumns = @JoinColumn(name = "trade_offer_id"))
    @Column(name = "item_id", nullable = false)
    private Set<Long> offeredItemIds = new LinkedHashSet<>();

    // Items asked from the receiver
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_offer_requested_items", joinColumns = @JoinColumn(name = "trade_offer_id"))
    @Column(name = "item_id", nullable = false)
    private Set<Long> requestedItemIds = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @ToString.Include
    private TradeOfferStatus status;

    @Column(length = 1000)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // First time the receiver answered (accepted or rejected); never overwritten
    @Column(name = "responded_at")
    private Instant respondedAt;

    // Optimistic locking: a delete racing a status change fails instead of winning silently
    @Version
    @Column(name = "version")
    private Long version;
}
