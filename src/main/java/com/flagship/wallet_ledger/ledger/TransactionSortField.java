package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.exception.ValidationException;

/**
 * Columns a statement can be ordered by.
 */
public enum TransactionSortField {
    CREATED_AT("createdAt"),
    AMOUNT("amount"),
    UPDATED_AT("updatedAt");

    private final String property;

    TransactionSortField(String property) {
        this.property = property;
    }

    public String property() {
        return property;
    }

    /**
     * Accepts the entity property name ({@code createdAt}) as well as the constant name.
     */
    public static TransactionSortField fromParam(String value) {
        for (TransactionSortField field : values()) {
            if (field.property.equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new ValidationException("Cannot sort by " + value);
    }
}
