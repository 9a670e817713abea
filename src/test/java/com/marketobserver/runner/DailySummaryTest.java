package com.marketobserver.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DailySummaryTest {

    private final DailySummary summary = new DailySummary();

    @Test
    void oneLiner_shouldPreferZeroRatioOverScore() {
        assertEquals("判断材料が少なく、方向性を決めにくい日です。", summary.oneLiner(5.0, 70.0, false));
        assertEquals("はっきりしたニュースが少なめの日です。", summary.oneLiner(-5.0, 50.0, false));
    }

    @Test
    void oneLiner_shouldDescribeScoreDirection() {
        assertEquals("良いニュースが目立つ日です。", summary.oneLiner(3.0, 10.0, false));
        assertEquals("心配なニュースが目立つ日です。", summary.oneLiner(-3.0, 10.0, false));
        assertEquals("特に大きな動きがない日です。", summary.oneLiner(2.9, 49.9, false));
    }

    @Test
    void oneLiner_shouldLeadWithPriorityNews() {
        assertEquals("重要な情報が出ていますが、全体的には判断材料が少ない日です。", summary.oneLiner(5.0, 50.0, true));
        assertEquals("判断材料が揃っている日です。重要情報を確認してください。", summary.oneLiner(-5.0, 49.9, true));
    }
}
