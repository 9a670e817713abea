package com.marketobserver.history;

import com.marketobserver.core.Decimals;
import com.marketobserver.model.BatchRatios;
import com.marketobserver.model.HistoryComparison;
import com.marketobserver.model.HistoryEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：HistoryStore（class）。
 * 主要职责：按自然日保存一条观测记录（JSON 文件），提供保留期清理、近 N 日查询与 7 日对比。
 * 使用建议：同一文件只应由一个实例读写；并发调用由内部锁串行化读-改-写过程。
 */
public final class HistoryStore {
    private static final Logger LOG = LogManager.getLogger(HistoryStore.class);

    public static final int RETENTION_DAYS = 30;
    public static final int COMPARISON_DAYS = 7;
    public static final double HIGH_ZERO_RATIO = 80.0;

    private final Path path;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<HistoryEntry> entries = new ArrayList<>();

    public HistoryStore(Path path, Clock clock) {
        if (path == null) {
            throw new IllegalArgumentException("history path must not be null");
        }
        this.path = path;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.entries.addAll(readAll(path));
    }

    public Path path() {
        return path;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

/**
 * 方法说明：addDailyRecord，负责写入当日记录。
 * 处理流程：加锁后重新读取文件，按日期更新或追加，清理 30 天前的记录，经临时文件原子替换。
 * 维护提示：写入失败抛出 IOException，内存状态保持写入前的样子。
 */
    public void addDailyRecord(
            double totalScore,
            double zeroRatio,
            double plus2Ratio,
            double minus2Ratio,
            int newsCount,
            double macroRatio
    ) throws IOException {
        LocalDate today = today();
        HistoryEntry record = new HistoryEntry(
                today,
                totalScore,
                zeroRatio,
                plus2Ratio,
                minus2Ratio,
                Math.max(0, newsCount),
                macroRatio
        );
        lock.lock();
        try {
            List<HistoryEntry> working = new ArrayList<>(readAll(path));
            boolean updated = false;
            for (int i = 0; i < working.size(); i++) {
                if (today.equals(working.get(i).date)) {
                    working.set(i, record);
                    updated = true;
                    break;
                }
            }
            if (!updated) {
                working.add(record);
            }
            LocalDate cutoff = today.minusDays(RETENTION_DAYS);
            working.removeIf(e -> e.date.isBefore(cutoff));

            writeAll(working);
            entries.clear();
            entries.addAll(working);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entries dated in {@code [today - n, today)}; today itself is excluded.
     */
    public List<HistoryEntry> getLastNDays(int n) {
        LocalDate today = today();
        LocalDate from = today.minusDays(Math.max(0, n));
        List<HistoryEntry> out = new ArrayList<>();
        for (HistoryEntry e : entries()) {
            if (!e.date.isBefore(from) && e.date.isBefore(today)) {
                out.add(e);
            }
        }
        return out;
    }

    public HistoryComparison get7DayComparison(double currentTotalScore, BatchRatios current) {
        List<HistoryEntry> past = getLastNDays(COMPARISON_DAYS);
        if (past.isEmpty()) {
            return HistoryComparison.none();
        }
        BatchRatios cur = current == null ? BatchRatios.empty() : current;
        double total = 0.0;
        double zero = 0.0;
        double plus2 = 0.0;
        double minus2 = 0.0;
        for (HistoryEntry e : past) {
            total += e.totalScore;
            zero += e.zeroRatio;
            plus2 += e.plus2Ratio;
            minus2 += e.minus2Ratio;
        }
        int n = past.size();
        return HistoryComparison.builder()
                .hasHistory(true)
                .daysCount(n)
                .avgTotalScore(Decimals.round(total / n, 2))
                .avgZeroRatio(Decimals.round1(zero / n))
                .avgPlus2Ratio(Decimals.round1(plus2 / n))
                .avgMinus2Ratio(Decimals.round1(minus2 / n))
                .currentTotalScore(currentTotalScore)
                .currentZeroRatio(cur.zeroRatio())
                .currentPlus2Ratio(cur.plus2Ratio())
                .currentMinus2Ratio(cur.minus2Ratio())
                .build();
    }

    /**
     * Length of the run of recorded entries, newest first and excluding today, whose zero
     * ratio is above 80. A day with no entry does not break the run.
     */
    public int getConsecutiveHighZeroDays() {
        LocalDate today = today();
        List<HistoryEntry> sorted = entries();
        sorted.sort(Comparator.comparing((HistoryEntry e) -> e.date).reversed());
        int count = 0;
        for (HistoryEntry e : sorted) {
            if (today.equals(e.date)) {
                continue;
            }
            if (e.zeroRatio > HIGH_ZERO_RATIO) {
                count++;
            } else {
                break;
            }
        }
        return count;
    }

    /**
     * Snapshot sorted by date ascending.
     */
    public List<HistoryEntry> entries() {
        lock.lock();
        try {
            List<HistoryEntry> out = new ArrayList<>(entries);
            out.sort(Comparator.comparing((HistoryEntry e) -> e.date));
            return out;
        } finally {
            lock.unlock();
        }
    }

    private void writeAll(List<HistoryEntry> values) throws IOException {
        JSONArray array = new JSONArray();
        for (HistoryEntry e : values) {
            array.put(toJson(e));
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, array.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Missing file yields an empty log. So does any unreadable or malformed content.
     */
    static List<HistoryEntry> readAll(Path path) {
        List<HistoryEntry> out = new ArrayList<>();
        if (!Files.exists(path)) {
            return out;
        }
        try {
            String txt = Files.readString(path, StandardCharsets.UTF_8);
            JSONArray array = new JSONArray(txt);
            for (int i = 0; i < array.length(); i++) {
                out.add(fromJson(array.getJSONObject(i)));
            }
            return out;
        } catch (Exception e) {
            LOG.warn("history log unreadable, starting empty. path={} err={}", path, e.toString());
            return new ArrayList<>();
        }
    }

    static JSONObject toJson(HistoryEntry e) {
        JSONObject o = new JSONObject();
        o.put("date", e.date.toString());
        o.put("total_score", e.totalScore);
        o.put("zero_ratio", e.zeroRatio);
        o.put("plus2_ratio", e.plus2Ratio);
        o.put("minus2_ratio", e.minus2Ratio);
        o.put("news_count", e.newsCount);
        o.put("macro_ratio", e.macroRatio);
        return o;
    }

    static HistoryEntry fromJson(JSONObject o) {
        return new HistoryEntry(
                LocalDate.parse(o.getString("date")),
                o.optDouble("total_score", 0.0),
                o.optDouble("zero_ratio", 0.0),
                o.optDouble("plus2_ratio", 0.0),
                o.optDouble("minus2_ratio", 0.0),
                o.optInt("news_count", 0),
                o.optDouble("macro_ratio", 0.0)
        );
    }
}
