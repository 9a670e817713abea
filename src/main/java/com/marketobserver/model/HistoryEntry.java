package com.marketobserver.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class HistoryEntry {
    public final LocalDate date;
    public final double totalScore;
    public final double zeroRatio;
    public final double plus2Ratio;
    public final double minus2Ratio;
    public final int newsCount;
    public final double macroRatio;
}
