package com.marketobserver.model;

/**
 * Share of a batch, in percent (0..100), falling into each observation bucket.
 */
public record BatchRatios(
        double zeroRatio,
        double plus2Ratio,
        double minus2Ratio,
        double macroRatio
) {
    public static BatchRatios empty() {
        return new BatchRatios(0.0, 0.0, 0.0, 0.0);
    }
}
