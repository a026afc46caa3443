package com.swappo.matchmakingservice.controller;

import com.swappo.matchmakingservice.dto.TradeOfferRequest;
import com.swappo.matchmakingservice.dto.TradeOfferResponse;
import com.swappo.matchmakingservice.dto.TradeOfferStatusUpdateRequest;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.service.TradeOfferService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/offers")
@RequiredArgsConstructor
public class TradeOfferController {

    private final TradeOfferService tradeOfferService;

    @PostMapping
    public ResponseEntity<TradeOfferResponse> proposeTradeOffer(
            @Valid @RequestBody TradeOfferRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        TradeOfferResponse response = tradeOfferService.proposeTradeOffer(request, jwt.getSubject());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{offerId}")
    public ResponseEntity<TradeOfferResponse> getTradeOffer(@PathVariable Long offerId) {
        return ResponseEntity.ok(tradeOfferService.getTradeOffer(offerId));
    }

    @GetMapping
    public ResponseEntity<List<TradeOfferResponse>> listTradeOffers(
            @RequestParam String userId,
            @RequestParam(required = false) TradeOfferStatus status,
            @RequestParam(defaultValue = "false") boolean asProposer,
            @RequestParam(defaultValue = "false") boolean asReceiver,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(
                tradeOfferService.listTradeOffers(userId, status, asProposer, asReceiver, limit, offset));
    }

    @GetMapping("/received/{userId}")
    public ResponseEntity<List<TradeOfferResponse>> getReceivedOffers(
            @PathVariable String userId,
            @RequestParam(required = false) TradeOfferStatus status,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(tradeOfferService.getReceivedOffers(userId, status, limit, offset));
    }

    @GetMapping("/sent/{userId}")
    public ResponseEntity<List<TradeOfferResponse>> getSentOffers(
            @PathVariable String userId,
            @RequestParam(required = false) TradeOfferStatus status,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(tradeOfferService.getSentOffers(userId, status, limit, offset));
    }

    @GetMapping("/by-item/{itemId}")
    public ResponseEntity<List<TradeOfferResponse>> getOffersByItem(
            @PathVariable Long itemId,
            @RequestParam(required = false) TradeOfferStatus status) {
        return ResponseEntity.ok(tradeOfferService.getOffersByItem(itemId, status));
    }

    @PatchMapping("/{offerId}")
    public ResponseEntity<TradeOfferResponse> updateStatus(
            @PathVariable Long offerId,
            @Valid @RequestBody TradeOfferStatusUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        TradeOfferResponse response = tradeOfferService.transition(offerId, request.getStatus(), jwt.getSubject());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{offerId}")
    public ResponseEntity<Void> deleteOffer(
            @PathVariable Long offerId,
            @AuthenticationPrincipal Jwt jwt) {
        tradeOfferService.deleteOffer(offerId, jwt.getSubject());
        return ResponseEntity.noContent().build();
    }
}
