package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.CreatePurchaseRequest;
import com.flagship.wallet_ledger.api.dto.ProductResponse;
import com.flagship.wallet_ledger.api.dto.PurchaseResponse;
import com.flagship.wallet_ledger.catalog.ProductCatalog;
import com.flagship.wallet_ledger.catalog.ProductType;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.movement.MoneyMovementService;
import com.flagship.wallet_ledger.movement.MovementQueryService;
import com.flagship.wallet_ledger.movement.purchase.Purchase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final MoneyMovementService movementService;
    private final MovementQueryService queryService;
    private final ProductCatalog productCatalog;
    private final CurrentUserProvider currentUser;

    /**
     * Buys a product. The price is debited immediately; coins are awarded once
     * the provider reports the purchase completed.
     */
    @PostMapping
    public ResponseEntity<PurchaseResponse> createPurchase(@Valid @RequestBody CreatePurchaseRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received purchase request: productId={}", request.getProductId());

        Purchase purchase = movementService.createPurchase(userId, request.getProductId(), request.getTargetNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseResponse.from(purchase));
    }

    @GetMapping
    public ResponseEntity<List<PurchaseResponse>> history(
            @RequestParam(value = "limit", defaultValue = "" + MovementQueryService.DEFAULT_HISTORY_LIMIT) int limit) {
        return ResponseEntity.ok(queryService.purchaseHistory(currentUser.currentUserId(), limit).stream()
            .map(PurchaseResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PurchaseResponse> getPurchase(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PurchaseResponse.from(queryService.getPurchase(currentUser.currentUserId(), id)));
    }

    @GetMapping("/products")
    public ResponseEntity<List<ProductResponse>> products(@RequestParam("type") String type) {
        return ResponseEntity.ok(productCatalog.findActiveByType(ProductType.fromValue(type)).stream()
            .map(ProductResponse::from)
            .toList());
    }
}
