package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.CoinExchangeResponse;
import com.flagship.wallet_ledger.api.dto.ExchangeCoinsRequest;
import com.flagship.wallet_ledger.api.dto.ExchangeRateResponse;
import com.flagship.wallet_ledger.config.CoinExchangeSettings;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.movement.MoneyMovementService;
import com.flagship.wallet_ledger.movement.MovementQueryService;
import com.flagship.wallet_ledger.movement.exchange.CoinExchange;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/coins")
@RequiredArgsConstructor
@Slf4j
public class CoinController {

    private final MoneyMovementService movementService;
    private final MovementQueryService queryService;
    private final CoinExchangeSettings coinSettings;
    private final CurrentUserProvider currentUser;

    @PostMapping("/exchange")
    public ResponseEntity<CoinExchangeResponse> exchange(@Valid @RequestBody ExchangeCoinsRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received coin exchange request: coins={}", request.getCoins());

        CoinExchange exchange = movementService.exchangeCoins(userId, request.getCoins());
        return ResponseEntity.status(HttpStatus.CREATED).body(CoinExchangeResponse.from(exchange));
    }

    @GetMapping("/exchanges")
    public ResponseEntity<List<CoinExchangeResponse>> exchanges() {
        return ResponseEntity.ok(queryService.coinExchangeHistory(currentUser.currentUserId()).stream()
            .map(CoinExchangeResponse::from)
            .toList());
    }

    @GetMapping("/rate")
    public ResponseEntity<ExchangeRateResponse> rate() {
        return ResponseEntity.ok(ExchangeRateResponse.builder()
            .exchangeRate(coinSettings.exchangeRate())
            .minimumExchange(coinSettings.minimumExchange())
            .build());
    }
}
