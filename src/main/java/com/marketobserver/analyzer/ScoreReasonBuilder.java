package com.marketobserver.analyzer;

import java.util.List;

/**
 * Templated explanation for an impact score. Wording only; never changes the number.
 */
public final class ScoreReasonBuilder {
    static final List<String> NEUTRAL_REASONS = List.of(
            "市場影響が限定的と判断",
            "定性的情報に留まり、価格材料不足",
            "市場全体への波及が不明確",
            "個別・話題性中心で指数影響は限定的",
            "事実報道で方向性を断定できず"
    );
    static final String ONE_SIDED_ZERO_REASON = "定性的情報に留まり、価格材料不足";

    public String build(int score, List<String> positive, List<String> negative, String text) {
        List<String> pos = positive == null ? List.of() : positive;
        List<String> neg = negative == null ? List.of() : negative;

        if (score == 0) {
            if (pos.isEmpty() && neg.isEmpty()) {
                return neutralReason(text);
            }
            if (!pos.isEmpty() && !neg.isEmpty()) {
                return "好悪材料が混在（+: " + head(pos, 2) + " / -: " + head(neg, 2) + "）";
            }
            return ONE_SIDED_ZERO_REASON;
        }
        if (score > 0) {
            if (score >= 5) {
                return "強い好材料あり（" + head(pos, 3) + "）";
            }
            if (score >= 2) {
                return "やや好材料（" + head(pos, 2) + "）";
            }
            return "弱い好材料の示唆（" + head(pos, 2) + "）";
        }
        if (score <= -5) {
            return "強い懸念材料あり（" + head(neg, 3) + "）";
        }
        if (score <= -2) {
            return "やや懸念材料（" + head(neg, 2) + "）";
        }
        return "弱い懸念材料の示唆（" + head(neg, 2) + "）";
    }

    /**
     * Picks from the fixed pool by hashing the text, so one text always gets the same phrase.
     */
    String neutralReason(String text) {
        String key = text == null ? "" : text;
        return NEUTRAL_REASONS.get(Math.floorMod(key.hashCode(), NEUTRAL_REASONS.size()));
    }

    private String head(List<String> keywords, int max) {
        return String.join(", ", keywords.subList(0, Math.min(max, keywords.size())));
    }
}
