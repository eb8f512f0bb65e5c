package com.climate.quality.validators;

import com.climate.quality.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 时间连续性检查器。
 * 按时间升序排列后，逐行计算与前一条记录的时间间隔，间隔超过阈值的记录判定为不连续。
 * 排序后的第一条记录没有前驱，永不标记。返回的是原始行索引。
 */
public class TemporalConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(TemporalConsistencyChecker.class);

    private final String timestampColumn;
    private final long maxGapMillis;

    public TemporalConsistencyChecker(String timestampColumn, long maxGapMillis) {
        this.timestampColumn = timestampColumn;
        this.maxGapMillis = maxGapMillis;
    }

    public SortedSet<Integer> check(Dataset data) {
        SortedSet<Integer> inconsistent = new TreeSet<>();
        if (!data.hasColumn(timestampColumn)) {
            return inconsistent;
        }

        List<Integer> ordered = data.rowsInTimeOrder(timestampColumn);
        for (int k = 1; k < ordered.size(); k++) {
            long previous = data.getTimeMillis(ordered.get(k - 1), timestampColumn);
            long current = data.getTimeMillis(ordered.get(k), timestampColumn);
            if (current - previous > maxGapMillis) {
                inconsistent.add(ordered.get(k));
            }
        }

        if (!inconsistent.isEmpty()) {
            log.debug("Found {} time gap(s) longer than {}ms", inconsistent.size(), maxGapMillis);
        }
        return inconsistent;
    }
}
