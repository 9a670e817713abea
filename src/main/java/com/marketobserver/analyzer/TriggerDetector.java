package com.marketobserver.analyzer;

import com.marketobserver.model.Trigger;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless observation notes over batch ratios. Independent of the total score and
 * never a call to act; zero to four rules may fire per call.
 */
public final class TriggerDetector {
    static final double MATERIAL_ZERO_MAX = 50.0;
    static final double MATERIAL_SIDE_MIN = 30.0;
    static final double NOISE_ZERO_MIN = 80.0;
    static final int NOISE_MIN_DAYS = 2;
    static final double SKEW_SIDE_MIN = 50.0;
    static final double MACRO_MIN = 30.0;

    public List<Trigger> detect(
            double zeroRatio,
            double plus2Ratio,
            double minus2Ratio,
            double macroRatio,
            int consecutiveHighZeroDays
    ) {
        List<Trigger> fired = new ArrayList<>();
        for (Trigger t : evaluate(zeroRatio, plus2Ratio, minus2Ratio, macroRatio, consecutiveHighZeroDays)) {
            if (t.fired()) {
                fired.add(t);
            }
        }
        return fired;
    }

    /**
     * All four rules in A-D order, fired or not.
     */
    public List<Trigger> evaluate(
            double zeroRatio,
            double plus2Ratio,
            double minus2Ratio,
            double macroRatio,
            int consecutiveHighZeroDays
    ) {
        return List.of(
                new Trigger(
                        "A",
                        "材料出揃いの兆候",
                        "市場が評価可能な材料に反応し始めている可能性があります。",
                        zeroRatio < MATERIAL_ZERO_MAX
                                && (plus2Ratio > MATERIAL_SIDE_MIN || minus2Ratio > MATERIAL_SIDE_MIN)
                ),
                new Trigger(
                        "B",
                        "ノイズ優勢状態",
                        "判断材料として使いにくいニュースが多い状態が続いています。",
                        zeroRatio > NOISE_ZERO_MIN && consecutiveHighZeroDays >= NOISE_MIN_DAYS
                ),
                new Trigger(
                        "C",
                        "評価の偏り",
                        "市場の受け止め方が一方向に偏っている可能性があります。",
                        plus2Ratio > SKEW_SIDE_MIN || minus2Ratio > SKEW_SIDE_MIN
                ),
                new Trigger(
                        "D",
                        "マクロ前提変化",
                        "株価以外の前提条件（金利・為替など）への注目が高まっています。",
                        macroRatio > MACRO_MIN
                )
        );
    }
}
