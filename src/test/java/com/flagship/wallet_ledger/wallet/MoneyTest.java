package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Major units convert to paisa exactly")
    void toMinor() {
        assertEquals(50_000, Money.toMinor(new BigDecimal("500")));
        assertEquals(19_950, Money.toMinor(new BigDecimal("199.5")));
        assertEquals(1, Money.toMinor(new BigDecimal("0.01")));
    }

    @Test
    @DisplayName("Sub-paisa precision, overflow and null are validation errors")
    void rejectsUnrepresentable() {
        assertThrows(ValidationException.class, () -> Money.toMinor(new BigDecimal("10.005")));
        assertThrows(ValidationException.class, () -> Money.toMinor(new BigDecimal("1e30")));
        assertThrows(ValidationException.class, () -> Money.toMinor(null));
    }

    @Test
    @DisplayName("Paisa render with two decimals")
    void toMajor() {
        assertEquals(new BigDecimal("199.50"), Money.toMajor(19_950));
        assertNull(Money.toMajor((Long) null));
    }
}
