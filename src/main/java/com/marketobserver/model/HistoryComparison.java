package com.marketobserver.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class HistoryComparison {
    public final boolean hasHistory;
    public final int daysCount;
    public final double avgTotalScore;
    public final double avgZeroRatio;
    public final double avgPlus2Ratio;
    public final double avgMinus2Ratio;
    public final double currentTotalScore;
    public final double currentZeroRatio;
    public final double currentPlus2Ratio;
    public final double currentMinus2Ratio;

    /**
     * Marker returned when no prior entry exists in the comparison window.
     */
    public static HistoryComparison none() {
        return HistoryComparison.builder().hasHistory(false).daysCount(0).build();
    }
}
