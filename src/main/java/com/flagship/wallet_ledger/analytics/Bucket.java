package com.flagship.wallet_ledger.analytics;

import lombok.Value;

/**
 * Count and summed amount (minor units) of one group of entries.
 */
@Value
public class Bucket {
    long count;
    long amount;

    public static final Bucket EMPTY = new Bucket(0, 0);

    public Bucket plus(long entries, long minorAmount) {
        return new Bucket(count + entries, Math.addExact(amount, minorAmount));
    }
}
