package com.marketobserver.runner;

/**
 * One fixed sentence describing how much usable material the day had. Days with priority
 * macro news get their own pair of sentences.
 */
public final class DailySummary {

    public String oneLiner(double totalScore, double zeroRatio, boolean hasPriority) {
        if (hasPriority) {
            if (zeroRatio >= 50.0) {
                return "重要な情報が出ていますが、全体的には判断材料が少ない日です。";
            }
            return "判断材料が揃っている日です。重要情報を確認してください。";
        }
        if (zeroRatio >= 70.0) {
            return "判断材料が少なく、方向性を決めにくい日です。";
        }
        if (zeroRatio >= 50.0) {
            return "はっきりしたニュースが少なめの日です。";
        }
        if (totalScore >= 3.0) {
            return "良いニュースが目立つ日です。";
        }
        if (totalScore <= -3.0) {
            return "心配なニュースが目立つ日です。";
        }
        return "特に大きな動きがない日です。";
    }
}
