package com.swappo.matchmakingservice.controller;

import com.swappo.matchmakingservice.dto.TradeStatisticsResponse;
import com.swappo.matchmakingservice.service.TradeOfferService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/statistics")
@RequiredArgsConstructor
public class TradeStatisticsController {

    private final TradeOfferService tradeOfferService;

    @GetMapping("/{userId}")
    public ResponseEntity<TradeStatisticsResponse> getStatistics(@PathVariable String userId) {
        return ResponseEntity.ok(tradeOfferService.getStatistics(userId));
    }
}
