package com.swappo.matchmakingservice.service;

import com.swappo.matchmakingservice.dto.TradeOfferRequest;
import com.swappo.matchmakingservice.dto.TradeOfferResponse;
import com.swappo.matchmakingservice.dto.TradeStatisticsResponse;
import com.swappo.matchmakingservice.model.TradeOfferStatus;

import java.util.List;

public interface TradeOfferService {

    TradeOfferResponse proposeTradeOffer(TradeOfferRequest request, String actorId);

    TradeOfferResponse getTradeOffer(Long offerId);

    List<TradeOfferResponse> listTradeOffers(String userId, TradeOfferStatus status,
                                             boolean asProposer, boolean asReceiver,
                                             int limit, int offset);

    List<TradeOfferResponse> getReceivedOffers(String userId, TradeOfferStatus status, int limit, int offset);

    List<TradeOfferResponse> getSentOffers(String userId, TradeOfferStatus status, int limit, int offset);

    List<TradeOfferResponse> getOffersByItem(Long itemId, TradeOfferStatus status);

    TradeOfferResponse transition(Long offerId, TradeOfferStatus newStatus, String actorId);

    void deleteOffer(Long offerId, String actorId);

    TradeStatisticsResponse getStatistics(String userId);
}
