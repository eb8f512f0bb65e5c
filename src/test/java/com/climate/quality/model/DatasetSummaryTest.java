package com.climate.quality.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DatasetSummary 单元测试")
class DatasetSummaryTest {

    private static Dataset sample() {
        return Dataset.builder()
                .column("Location", ColumnType.TEXT)
                .column("temperature", ColumnType.NUMERIC)
                .row("Zurich", 1.0)
                .row(null, 2.0)
                .row("Bern", 3.0)
                .row("Basel", 4.0)
                .row(null, null)
                .build();
    }

    @Test
    @DisplayName("统计行列数、类型与缺失值")
    void describesShapeAndMissingValues() {
        DatasetSummary summary = DatasetSummary.of(sample(),
                ValidationReport.of(Map.of(), List.of(), List.of()),
                new AnomalyReport(Map.of(), List.of(), Map.of(), List.of(), List.of()));

        assertThat(summary.getRowCount()).isEqualTo(5);
        assertThat(summary.getColumnCount()).isEqualTo(2);
        assertThat(summary.getColumns()).containsExactly("Location", "temperature");
        assertThat(summary.getColumnTypes()).containsEntry("temperature", ColumnType.NUMERIC);
        assertThat(summary.getMissingValues()).containsEntry("Location", 2).containsEntry("temperature", 1);
        assertThat(summary.getTotalMissing()).isEqualTo(3);
        assertThat(summary.getNumericSummary()).containsOnlyKeys("temperature");
    }

    @Test
    @DisplayName("摘要基于清洗后的数据表，填充前的缺失值单独记录")
    void describesProcessedDataAndKeepsOriginalMissingCounts() {
        Dataset original = sample();
        Dataset processed = original
                .withColumn("Location", Arrays.asList("Zurich", "Bern", "Bern", "Basel", "Bern"))
                .withColumn("temperature", Arrays.asList(1.0, 2.0, 3.0, 4.0, 2.5));

        DatasetSummary summary = DatasetSummary.of(processed, original,
                ValidationReport.of(Map.of(), List.of(), List.of()),
                new AnomalyReport(Map.of(), List.of(), Map.of(), List.of(), List.of()));

        assertThat(summary.getMissingValues()).containsEntry("Location", 0).containsEntry("temperature", 0);
        assertThat(summary.getMissingBeforeImputation())
                .containsEntry("Location", 2).containsEntry("temperature", 1);
        assertThat(summary.getNumericSummary().get("temperature").getCount()).isEqualTo(5);
        assertThat(summary.getNumericSummary().get("temperature").getMean()).isCloseTo(2.5, within(1e-12));
    }

    @Test
    @DisplayName("数值列描述统计使用线性插值分位数")
    void numericSummaryUsesLinearPercentiles() {
        ColumnStatistics stats = ColumnStatistics.of(Arrays.asList(1.0, 2.0, null, 3.0, 4.0));

        assertThat(stats.getCount()).isEqualTo(4);
        assertThat(stats.getMean()).isCloseTo(2.5, within(1e-12));
        assertThat(stats.getStd()).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getP25()).isCloseTo(1.75, within(1e-12));
        assertThat(stats.getMedian()).isCloseTo(2.5, within(1e-12));
        assertThat(stats.getP75()).isCloseTo(3.25, within(1e-12));
        assertThat(stats.getMax()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("无有效值时统计量为NaN")
    void emptyColumnYieldsNaN() {
        ColumnStatistics stats = ColumnStatistics.of(Arrays.asList(null, null));

        assertThat(stats.getCount()).isZero();
        assertThat(stats.getMean()).isNaN();
        assertThat(stats.getMedian()).isNaN();
    }

    @Test
    @DisplayName("汇总两份报告中的计数")
    void countsFindingsFromReports() {
        ValidationReport validation = ValidationReport.of(
                Map.of("temperature", List.of(1), "humidity", List.of(2, 3)), List.of(4), List.of());
        AnomalyReport anomalies = new AnomalyReport(
                Map.of("temperature", List.of(0, 3)), List.of(1),
                Map.of("temperature", List.of()),
                List.of(new CorrelationAnomaly("a", "b", 0.99)), List.of());

        DatasetSummary summary = DatasetSummary.of(sample(), validation, anomalies);

        assertThat(summary.getRangeAnomalyColumnCount()).isEqualTo(2);
        assertThat(summary.getTemporalInconsistencyCount()).isEqualTo(1);
        assertThat(summary.getStatisticalAnomalyCount()).isEqualTo(2);
        assertThat(summary.getMultivariateOutlierCount()).isEqualTo(1);
        assertThat(summary.getCorrelationAnomalyCount()).isEqualTo(1);
    }
}
