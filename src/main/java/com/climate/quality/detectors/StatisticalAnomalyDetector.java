package com.climate.quality.detectors;

import com.climate.quality.core.AnomalyDetector;
import com.climate.quality.model.Dataset;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Z-score 统计检测器。
 * 对每个数值列计算 z = |x - mean| / std（样本标准差），z 超过阈值的行判定为异常。
 * 标准差为0（常量列）或无定义（有效值少于2个）时，该列不产生异常。
 */
public class StatisticalAnomalyDetector implements AnomalyDetector<Map<String, SortedSet<Integer>>> {

    private static final Logger log = LoggerFactory.getLogger(StatisticalAnomalyDetector.class);

    public static final String DETECTOR_ID = "statistical_zscore";

    private final double threshold;

    public StatisticalAnomalyDetector(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String getDetectorId() {
        return DETECTOR_ID;
    }

    @Override
    public Map<String, SortedSet<Integer>> detect(Dataset data) {
        Map<String, SortedSet<Integer>> anomalies = new LinkedHashMap<>();

        for (String column : data.getNumericColumns()) {
            List<Double> values = data.getNumericColumn(column);
            SortedSet<Integer> flagged = new TreeSet<>();
            anomalies.put(column, flagged);

            SummaryStatistics stats = new SummaryStatistics();
            for (Double value : values) {
                if (value != null) stats.addValue(value);
            }
            double std = stats.getStandardDeviation();
            if (stats.getN() < 2 || !(std > 0)) {
                log.debug("Column '{}' has zero or undefined deviation, skipped.", column);
                continue;
            }

            double mean = stats.getMean();
            for (int i = 0; i < values.size(); i++) {
                Double value = values.get(i);
                if (value != null && Math.abs(value - mean) / std > threshold) {
                    flagged.add(i);
                }
            }
        }
        return anomalies;
    }

    @Override
    public Map<String, SortedSet<Integer>> emptyResult() {
        return Collections.emptyMap();
    }
}
