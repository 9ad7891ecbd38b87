package com.flagship.wallet_ledger.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.analytics.Bucket;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class BucketResponse {

    @JsonProperty("count")
    long count;

    @JsonProperty("amount")
    BigDecimal amount;

    public static BucketResponse from(Bucket bucket) {
        return new BucketResponse(bucket.getCount(), Money.toMajor(bucket.getAmount()));
    }

    public static <K extends Enum<K>> Map<String, BucketResponse> fromMap(Map<K, Bucket> buckets) {
        Map<String, BucketResponse> result = new LinkedHashMap<>();
        buckets.forEach((key, bucket) -> result.put(key.name(), from(bucket)));
        return result;
    }
}
