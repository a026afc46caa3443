package com.swappo.matchmakingservice.repository;

import com.swappo.matchmakingservice.model.TradeOffer;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TradeOfferRepository extends JpaRepository<TradeOffer, Long> {

    /**
     * Conditional status write: only applies if the row is still in expectedStatus.
     * Returns 0 when a concurrent transition got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update TradeOffer o set o.status = :newStatus, o.respondedAt = :respondedAt, "
            + "o.updatedAt = :updatedAt, o.version = o.version + 1 "
            + "where o.id = :id and o.status = :expectedStatus")
    int updateStatus(@Param("id") Long id,
                     @Param("newStatus") TradeOfferStatus newStatus,
                     @Param("expectedStatus") TradeOfferStatus expectedStatus,
                     @Param("respondedAt") Instant respondedAt,
                     @Param("updatedAt") Instant updatedAt);

    // offers where the user is proposer and/or receiver, optionally of one status
    @Query("select o from TradeOffer o "
            + "where ((:asProposer = true and o.proposerId = :userId) "
            + "or (:asReceiver = true and o.receiverId = :userId)) "
            + "and (:status is null or o.status = :status)")
    List<TradeOffer> findForUser(@Param("userId") String userId,
                                 @Param("asProposer") boolean asProposer,
                                 @Param("asReceiver") boolean asReceiver,
                                 @Param("status") TradeOfferStatus status,
                                 Pageable pageable);

    // offers involving an item on either side
    @Query("select distinct o from TradeOffer o "
            + "where (:itemId member of o.offeredItemIds or :itemId member of o.requestedItemIds) "
            + "and (:status is null or o.status = :status) "
            + "order by o.createdAt desc")
    List<TradeOffer> findByItemId(@Param("itemId") Long itemId, @Param("status") TradeOfferStatus status);

    @Query("select o.status as status, count(o) as total from TradeOffer o "
            + "where o.proposerId = :userId or o.receiverId = :userId "
            + "group by o.status")
    List<StatusCount> countByStatusForUser(@Param("userId") String userId);

    interface StatusCount {
        TradeOfferStatus getStatus();

        Long getTotal();
    }
}
