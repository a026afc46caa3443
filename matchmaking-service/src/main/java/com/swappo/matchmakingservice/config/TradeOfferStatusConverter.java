package com.swappo.matchmakingservice.config;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets query parameters use the lowercase wire form, e.g. {@code ?status=pending}.
 */
@Component
public class TradeOfferStatusConverter implements Converter<String, TradeOfferStatus> {

    @Override
    public TradeOfferStatus convert(String source) {
        return TradeOfferStatus.fromValue(source);
    }
}
