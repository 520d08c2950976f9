package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.AccountResponse;
import com.flagship.wallet_ledger.api.dto.RegisterAccountRequest;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.ledger.WalletAccount;
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

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final CurrentUserProvider currentUser;

    /**
     * Opens a wallet. The only endpoint that does not need an acting user.
     */
    @PostMapping("/register")
    public ResponseEntity<AccountResponse> register(@Valid @RequestBody RegisterAccountRequest request) {
        log.info("Received registration request: referralCode={}", request.getReferralCode());

        WalletAccount account = accountService.register(
            request.getName(),
            request.getEmail(),
            request.getPhone(),
            request.getReferralCode()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/me")
    public ResponseEntity<AccountResponse> me() {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(currentUser.currentUserId())));
    }
}
