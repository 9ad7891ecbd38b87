package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.exception.CounterpartyNotFoundException;
import com.flagship.wallet_ledger.exception.InsufficientFundsException;

import java.util.UUID;

/**
 * Single source of truth for spendable balances. All amounts are minor units.
 *
 * Ledger entries only snapshot balances; nothing derives a live balance from them.
 */
public interface BalanceAccessor {

    /**
     * @throws CounterpartyNotFoundException if the user has no wallet
     */
    long getBalance(UUID userId);

    /**
     * Adds {@code delta} (negative for a debit) to the balance, atomically and
     * only if the result stays non-negative.
     *
     * @return the balance after the adjustment
     * @throws InsufficientFundsException if a debit would overdraw the wallet
     * @throws CounterpartyNotFoundException if the user has no wallet
     */
    long atomicAdjust(UUID userId, long delta);

    /**
     * Resolves an e-mail, phone number or UPI address to a user.
     *
     * @throws CounterpartyNotFoundException if nobody matches
     */
    UUID findUserByEmailOrPhone(String identifier);

    /**
     * @throws CounterpartyNotFoundException if the user has no wallet
     */
    WalletAccount getAccount(UUID userId);
}
