package com.flagship.wallet_ledger.wallet;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
public class WalletController {

    private final WalletAccountService walletAccountService;

    /**
     * Erases the caller's wallet together with its whole ledger.
     */
    @DeleteMapping
    public ResponseEntity<Void> eraseWallet(@RequestHeader("X-User-Id") UUID userId) {
        walletAccountService.eraseAccount(userId);
        return ResponseEntity.noContent().build();
    }
}
