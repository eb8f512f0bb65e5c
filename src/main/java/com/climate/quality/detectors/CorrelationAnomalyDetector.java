package com.climate.quality.detectors;

import com.climate.quality.core.AnomalyDetector;
import com.climate.quality.model.CorrelationAnomaly;
import com.climate.quality.model.Dataset;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 相关性异常检测器。
 * 对数值列两两计算 Pearson 相关系数（仅使用两列均非缺失的行），
 * |r| 超过阈值的列对视为可疑（可能是重复录入或派生列）。
 * 每个无序列对最多输出一次，columnA 在列顺序上位于 columnB 之前；不输出自身配对。
 */
public class CorrelationAnomalyDetector implements AnomalyDetector<List<CorrelationAnomaly>> {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAnomalyDetector.class);

    public static final String DETECTOR_ID = "correlation";

    private final double threshold;

    public CorrelationAnomalyDetector(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String getDetectorId() {
        return DETECTOR_ID;
    }

    @Override
    public List<CorrelationAnomaly> detect(Dataset data) {
        List<String> columns = data.getNumericColumns();
        List<CorrelationAnomaly> anomalies = new ArrayList<>();
        if (columns.size() < 2) {
            return anomalies;
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (int i = 0; i < columns.size(); i++) {
            for (int j = i + 1; j < columns.size(); j++) {
                double r = pairwiseCorrelation(pearson,
                        data.getNumericColumn(columns.get(i)),
                        data.getNumericColumn(columns.get(j)));
                // NaN（常量列等）不参与比较
                if (!Double.isNaN(r) && Math.abs(r) > threshold) {
                    anomalies.add(new CorrelationAnomaly(columns.get(i), columns.get(j), r));
                }
            }
        }

        if (!anomalies.isEmpty()) {
            log.debug("Found {} strongly correlated column pair(s)", anomalies.size());
        }
        return anomalies;
    }

    @Override
    public List<CorrelationAnomaly> emptyResult() {
        return Collections.emptyList();
    }

    private static double pairwiseCorrelation(PearsonsCorrelation pearson, List<Double> a, List<Double> b) {
        double[] x = new double[a.size()];
        double[] y = new double[a.size()];
        int n = 0;
        for (int k = 0; k < a.size(); k++) {
            if (a.get(k) != null && b.get(k) != null) {
                x[n] = a.get(k);
                y[n] = b.get(k);
                n++;
            }
        }
        if (n < 2) {
            return Double.NaN;
        }
        return pearson.correlation(Arrays.copyOf(x, n), Arrays.copyOf(y, n));
    }
}
