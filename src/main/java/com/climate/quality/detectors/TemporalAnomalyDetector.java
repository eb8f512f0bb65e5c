package com.climate.quality.detectors;

import com.climate.quality.core.AnomalyDetector;
import com.climate.quality.model.Dataset;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 时序突变检测器。
 * 按时间升序排列后，对每个数值列计算固定长度滑动窗口（含当前行）的均值与样本标准差，
 * 偏离度 |x - rolling_mean| / rolling_std 超过阈值的行判定为突变。
 *
 * 以下行不参与判定：
 * - 排序后前 window-1 行（窗口未满）
 * - 窗口内含缺失值的行
 * - 窗口标准差为0的行
 */
public class TemporalAnomalyDetector implements AnomalyDetector<Map<String, SortedSet<Integer>>> {

    private static final Logger log = LoggerFactory.getLogger(TemporalAnomalyDetector.class);

    public static final String DETECTOR_ID = "temporal_rolling";

    private final String timestampColumn;
    private final int window;
    private final double threshold;

    public TemporalAnomalyDetector(String timestampColumn, int window, double threshold) {
        this.timestampColumn = timestampColumn;
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public String getDetectorId() {
        return DETECTOR_ID;
    }

    @Override
    public Map<String, SortedSet<Integer>> detect(Dataset data) {
        Map<String, SortedSet<Integer>> anomalies = new LinkedHashMap<>();
        if (!data.hasColumn(timestampColumn)) {
            return anomalies;
        }

        List<Integer> ordered = data.rowsInTimeOrder(timestampColumn);
        for (String column : data.getNumericColumns()) {
            if (column.equals(timestampColumn)) continue;

            List<Double> values = data.getNumericColumn(column);
            SortedSet<Integer> flagged = new TreeSet<>();
            anomalies.put(column, flagged);

            DescriptiveStatistics rolling = new DescriptiveStatistics(window);
            int validInWindow = 0;
            for (int k = 0; k < ordered.size(); k++) {
                Double value = values.get(ordered.get(k));
                // 缺失值以NaN入窗，窗口含NaN时统计量无定义
                rolling.addValue(value != null ? value : Double.NaN);
                validInWindow = (value != null) ? Math.min(validInWindow + 1, window) : 0;
                if (k < window - 1 || validInWindow < window) continue;

                double std = rolling.getStandardDeviation();
                if (!(std > 0)) continue;

                double deviation = Math.abs(value - rolling.getMean()) / std;
                if (deviation > threshold) {
                    flagged.add(ordered.get(k));
                }
            }
            if (!flagged.isEmpty()) {
                log.debug("Column '{}' has {} abrupt change(s) within window {}", column, flagged.size(), window);
            }
        }
        return anomalies;
    }

    @Override
    public Map<String, SortedSet<Integer>> emptyResult() {
        return Collections.emptyMap();
    }
}
