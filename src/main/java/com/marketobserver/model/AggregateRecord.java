package com.marketobserver.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AggregateRecord {
    public final double totalScore;
    public final double domesticScore;
    public final double foreignScore;
    public final double domesticForeignGap;
    public final int newsCount;
    public final int zeroScoreCount;

    public static AggregateRecord empty() {
        return new AggregateRecord(0.0, 0.0, 0.0, 0.0, 0, 0);
    }
}
