package com.swappo.matchmakingservice.mapper;

import com.swappo.matchmakingservice.dto.TradeOfferResponse;
import com.swappo.matchmakingservice.model.TradeOffer;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TradeOfferMapper {

    // TradeOffer -> TradeOfferResponse
    // (item id sets become lists, insertion order kept)
    TradeOfferResponse toTradeOfferResponse(TradeOffer tradeOffer);

    List<TradeOfferResponse> toTradeOfferResponses(List<TradeOffer> tradeOffers);

    // Note: no request -> entity mapping here.
    // The entity is only built after item ownership has been checked against the catalog.
}
