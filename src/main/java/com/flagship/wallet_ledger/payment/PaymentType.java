package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.TransactionType;

/**
 * Money-movement use cases and how each one is recorded.
 *
 * Gateway-settled use cases go through {@link SettlementGateway} before the
 * wallet is touched. Card payments are funded by the card, so the wallet
 * balance is not involved at all.
 */
public enum PaymentType {
    TRANSFER(TransactionType.TRANSFER, PaymentMethod.WALLET, false, true, true),
    UPI(TransactionType.PAYMENT, PaymentMethod.UPI, false, true, true),
    BIOMETRIC(TransactionType.PAYMENT, PaymentMethod.BIOMETRIC, false, true, true),
    RECHARGE(TransactionType.RECHARGE, PaymentMethod.WALLET, true, true, true),
    BILL(TransactionType.BILL_PAYMENT, PaymentMethod.WALLET, true, true, true),
    CARD(TransactionType.PAYMENT, PaymentMethod.CARD, true, false, true),
    ADD_MONEY(TransactionType.ADD_MONEY, PaymentMethod.CARD, true, true, false);

    private final TransactionType transactionType;
    private final PaymentMethod defaultMethod;
    private final boolean gatewaySettled;
    private final boolean balanceAffecting;
    private final boolean authorisationRequired;

    PaymentType(TransactionType transactionType, PaymentMethod defaultMethod, boolean gatewaySettled,
                boolean balanceAffecting, boolean authorisationRequired) {
        this.transactionType = transactionType;
        this.defaultMethod = defaultMethod;
        this.gatewaySettled = gatewaySettled;
        this.balanceAffecting = balanceAffecting;
        this.authorisationRequired = authorisationRequired;
    }

    public TransactionType transactionType() {
        return transactionType;
    }

    public PaymentMethod defaultMethod() {
        return defaultMethod;
    }

    public boolean isGatewaySettled() {
        return gatewaySettled;
    }

    public boolean isBalanceAffecting() {
        return balanceAffecting;
    }

    public boolean isAuthorisationRequired() {
        return authorisationRequired;
    }
}
