package com.climate.quality.detectors;

import com.climate.quality.core.AnomalyDetector;
import com.climate.quality.model.Dataset;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 多变量离群检测器。
 * 将全部数值列标准化为零均值、单位方差（总体标准差；常量列缩放因子取1）后，
 * 交由孤立森林按污染率标记离群行。
 *
 * 标准化参数与模型均在每次调用中新建，固定随机种子保证同一数据集的结果可复现。
 * 零数值列或零行时直接返回空集合，不构建模型。
 * 数值列含缺失值时抛出 IllegalArgumentException，由检测器隔离边界转换为诊断信息。
 */
public class MultivariateOutlierDetector implements AnomalyDetector<SortedSet<Integer>> {

    private static final Logger log = LoggerFactory.getLogger(MultivariateOutlierDetector.class);

    public static final String DETECTOR_ID = "multivariate_isolation_forest";

    private final double contamination;
    private final long seed;
    private final int treeCount;
    private final int maxSamples;

    public MultivariateOutlierDetector(double contamination, long seed, int treeCount, int maxSamples) {
        this.contamination = contamination;
        this.seed = seed;
        this.treeCount = treeCount;
        this.maxSamples = maxSamples;
    }

    @Override
    public String getDetectorId() {
        return DETECTOR_ID;
    }

    @Override
    public SortedSet<Integer> detect(Dataset data) {
        List<String> columns = data.getNumericColumns();
        if (columns.isEmpty() || data.isEmpty()) {
            return new TreeSet<>();
        }

        double[][] scaled = standardize(data, columns);
        IsolationForest forest = new IsolationForest(treeCount, maxSamples, contamination, seed);
        SortedSet<Integer> outliers = forest.fitPredict(scaled);

        log.debug("Isolation forest flagged {} of {} row(s) over {} column(s)",
                outliers.size(), data.getRowCount(), columns.size());
        return outliers;
    }

    @Override
    public SortedSet<Integer> emptyResult() {
        return Collections.emptySortedSet();
    }

    private static double[][] standardize(Dataset data, List<String> columns) {
        int rows = data.getRowCount();
        double[][] matrix = new double[rows][columns.size()];

        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            List<Double> values = data.getNumericColumn(column);
            double[] raw = new double[rows];
            for (int i = 0; i < rows; i++) {
                Double value = values.get(i);
                if (value == null) {
                    throw new IllegalArgumentException("Column '" + column
                            + "' contains missing values at row " + i);
                }
                raw[i] = value;
            }

            double mean = new Mean().evaluate(raw);
            double std = new StandardDeviation(false).evaluate(raw);
            double scale = std > 0 ? std : 1.0;
            for (int i = 0; i < rows; i++) {
                matrix[i][c] = (raw[i] - mean) / scale;
            }
        }
        return matrix;
    }
}
