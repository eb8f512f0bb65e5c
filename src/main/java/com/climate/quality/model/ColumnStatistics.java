package com.climate.quality.model;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.io.Serializable;
import java.util.List;

/**
 * 数值列描述统计：样本数、均值、样本标准差、最小值、四分位数、最大值。
 * 无有效值时除 count 外均为 NaN。
 */
public final class ColumnStatistics implements Serializable {
    private final long count;
    private final double mean;
    private final double std;
    private final double min;
    private final double p25;
    private final double median;
    private final double p75;
    private final double max;

    private ColumnStatistics(long count, double mean, double std, double min,
                             double p25, double median, double p75, double max) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.p25 = p25;
        this.median = median;
        this.p75 = p75;
        this.max = max;
    }

    public static ColumnStatistics of(List<Double> values) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (Double value : values) {
            if (value != null) stats.addValue(value);
        }
        // 与常见数据分析工具一致，分位数使用线性插值
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        return new ColumnStatistics(stats.getN(), stats.getMean(), stats.getStandardDeviation(),
                stats.getMin(), stats.getPercentile(25), stats.getPercentile(50),
                stats.getPercentile(75), stats.getMax());
    }

    public long getCount() { return count; }
    public double getMean() { return mean; }
    public double getStd() { return std; }
    public double getMin() { return min; }
    public double getP25() { return p25; }
    public double getMedian() { return median; }
    public double getP75() { return p75; }
    public double getMax() { return max; }

    @Override
    public String toString() {
        return "ColumnStatistics{count=" + count + ", mean=" + mean + ", std=" + std
                + ", min=" + min + ", 25%=" + p25 + ", 50%=" + median + ", 75%=" + p75
                + ", max=" + max + "}";
    }
}
