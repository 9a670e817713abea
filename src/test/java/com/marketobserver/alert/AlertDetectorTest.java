package com.marketobserver.alert;

import com.marketobserver.model.AggregateRecord;
import com.marketobserver.model.Alert;
import com.marketobserver.model.AlertType;
import com.marketobserver.model.HistoryEntry;
import com.marketobserver.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertDetectorTest {

    @Test
    void detectAlerts_shouldSkipDailyChangeWithoutHistory() {
        AlertDetector detector = new AlertDetector();

        assertTrue(detector.detectAlerts(total(9.0)).isEmpty());
    }

    @Test
    void detectAlerts_shouldUseInfoFromThreeAndWarningFromFive() {
        assertEquals(Severity.INFO, dailyChange(1.0, 4.0).severity());
        assertEquals(Severity.INFO, dailyChange(0.0, 4.9).severity());
        assertEquals(Severity.WARNING, dailyChange(0.0, 5.0).severity());
        assertTrue(detectorWith(0.0).detectAlerts(total(2.9)).isEmpty());
    }

    @Test
    void detectAlerts_shouldFireOnOneDecimalDeltaOfExactlyThree() {
        double[][] pairs = {
                {1.1, 4.1}, {0.3, 3.3}, {0.1, 3.1}, {0.7, 3.7}, {-0.2, 2.8}, {0.6, -2.4}
        };
        for (double[] pair : pairs) {
            List<Alert> alerts = detectorWith(pair[0]).detectAlerts(total(pair[1]));
            assertEquals(1, alerts.size(), pair[0] + "->" + pair[1]);
            assertEquals(Severity.INFO, alerts.get(0).severity(), pair[0] + "->" + pair[1]);
        }
        assertEquals(Severity.WARNING, dailyChange(0.2, 5.2).severity());
    }

    @Test
    void detectAlerts_shouldDescribeDirectionAndSignedDelta() {
        Alert up = dailyChange(0.0, 3.0);
        Alert down = dailyChange(0.0, -3.0);

        assertEquals(AlertType.DAILY_CHANGE, up.type());
        assertTrue(up.message().contains("+3.0"), up.message());
        assertTrue(up.message().contains("上昇"), up.message());
        assertTrue(down.message().contains("-3.0"), down.message());
        assertTrue(down.message().contains("下落"), down.message());
    }

    @Test
    void detectAlerts_shouldFlagMovingAverageTurningPositive() {
        AlertDetector detector = detectorWith(-3.0, -1.0, 1.0, 2.0);

        List<Alert> alerts = detector.detectAlerts(total(2.0));

        assertEquals(1, alerts.size());
        assertEquals(AlertType.MA_REVERSAL, alerts.get(0).type());
        assertEquals(Severity.INFO, alerts.get(0).severity());
    }

    @Test
    void detectAlerts_shouldTreatZeroAverageAsNonNegative() {
        List<Alert> alerts = detectorWith(-3.0, -1.0, 0.0, 1.0).detectAlerts(total(1.0));

        assertEquals(1, alerts.size());
        assertEquals(Severity.INFO, alerts.get(0).severity());
    }

    @Test
    void detectAlerts_shouldFlagMovingAverageTurningNegative() {
        List<Alert> alerts = detectorWith(3.0, 1.0, -1.0, -2.0).detectAlerts(total(-2.0));

        assertEquals(1, alerts.size());
        assertEquals(AlertType.MA_REVERSAL, alerts.get(0).type());
        assertEquals(Severity.WARNING, alerts.get(0).severity());
    }

    @Test
    void detectAlerts_shouldNotFlagWhenAverageKeepsSign() {
        assertTrue(detectorWith(1.0, 2.0, 3.0, 4.0).detectAlerts(total(4.0)).isEmpty());
    }

    @Test
    void detectAlerts_shouldNeedMoreThanWindowEntriesForReversal() {
        AlertDetector detector = detectorWith(-3.0, -1.0, 1.0);

        List<Alert> alerts = detector.detectAlerts(total(1.0));

        assertTrue(alerts.stream().noneMatch(a -> a.type() == AlertType.MA_REVERSAL));
    }

    @Test
    void detectAlerts_shouldFlagDomesticAheadOfForeignAsInfo() {
        AggregateRecord current = AggregateRecord.builder()
                .totalScore(6.0)
                .domesticScore(6.0)
                .domesticForeignGap(6.0)
                .newsCount(3)
                .build();

        List<Alert> alerts = new AlertDetector().detectAlerts(current);

        assertEquals(1, alerts.size());
        assertEquals(AlertType.DOMESTIC_FOREIGN_GAP, alerts.get(0).type());
        assertEquals(Severity.INFO, alerts.get(0).severity());
        assertTrue(alerts.get(0).message().contains("+6.0"), alerts.get(0).message());
    }

    @Test
    void detectAlerts_shouldFlagDomesticBehindForeignAsWarning() {
        AggregateRecord current = AggregateRecord.builder().domesticForeignGap(-5.0).build();

        List<Alert> alerts = new AlertDetector().detectAlerts(current);

        assertEquals(Severity.WARNING, alerts.get(0).severity());
        assertTrue(alerts.get(0).message().contains("-5.0"), alerts.get(0).message());
        assertTrue(new AlertDetector().detectAlerts(AggregateRecord.builder().domesticForeignGap(4.9).build()).isEmpty());
    }

    @Test
    void addDailyScore_shouldAppendEvenForRepeatedRecord() {
        AlertDetector detector = new AlertDetector();
        AggregateRecord record = total(1.0);

        detector.addDailyScore(record);
        detector.addDailyScore(record);

        assertEquals(2, detector.history().size());
    }

    @Test
    void seed_shouldReplayPersistedTotalsInOrder() {
        AlertDetector detector = new AlertDetector();
        detector.seed(List.of(
                new HistoryEntry(LocalDate.of(2026, 10, 16), -1.0, 0.0, 0.0, 0.0, 4, 0.0),
                new HistoryEntry(LocalDate.of(2026, 10, 17), 2.0, 0.0, 0.0, 0.0, 6, 0.0)
        ));

        assertEquals(2, detector.history().size());
        assertEquals(2.0, detector.history().get(1).totalScore, 1e-9);
        assertEquals(6, detector.history().get(1).newsCount);
        assertEquals(0.5, detector.movingAverage(2).getAsDouble(), 1e-9);
        assertFalse(detector.movingAverage(3).isPresent());
    }

    private static Alert dailyChange(double previous, double current) {
        List<Alert> alerts = detectorWith(previous).detectAlerts(total(current));
        assertEquals(1, alerts.size());
        assertEquals(AlertType.DAILY_CHANGE, alerts.get(0).type());
        return alerts.get(0);
    }

    private static AlertDetector detectorWith(double... totals) {
        AlertDetector detector = new AlertDetector();
        for (double t : totals) {
            detector.addDailyScore(total(t));
        }
        return detector;
    }

    private static AggregateRecord total(double totalScore) {
        return AggregateRecord.builder().totalScore(totalScore).newsCount(1).build();
    }
}
