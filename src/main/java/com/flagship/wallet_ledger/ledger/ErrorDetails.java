package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Structured failure recorded on an entry that ended in {@code FAILED} or {@code ON_HOLD}.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ErrorDetails {

    @Column(name = "error_code", length = 64)
    private String code;

    @Column(name = "error_message", length = 1000)
    private String message;

    @Column(name = "error_retryable")
    private boolean retryable;
}
