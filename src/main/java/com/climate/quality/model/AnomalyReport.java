package com.climate.quality.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 异常检测报告。
 * 四类检测结果彼此独立，同一行可同时出现在多个字段中，不做去重或综合评分。
 * diagnostics 记录执行失败的检测器，失败检测器对应字段为空结果。
 */
public final class AnomalyReport implements Serializable {

    private final Map<String, SortedSet<Integer>> statisticalAnomalies;
    private final SortedSet<Integer> multivariateOutliers;
    private final Map<String, SortedSet<Integer>> temporalAnomalies;
    private final List<CorrelationAnomaly> correlationAnomalies;
    private final List<DetectorDiagnostic> diagnostics;

    public AnomalyReport(Map<String, ? extends Collection<Integer>> statisticalAnomalies,
                         Collection<Integer> multivariateOutliers,
                         Map<String, ? extends Collection<Integer>> temporalAnomalies,
                         List<CorrelationAnomaly> correlationAnomalies,
                         List<DetectorDiagnostic> diagnostics) {
        this.statisticalAnomalies = IndexSets.copyOf(statisticalAnomalies);
        this.multivariateOutliers = IndexSets.copyOf(multivariateOutliers);
        this.temporalAnomalies = IndexSets.copyOf(temporalAnomalies);
        this.correlationAnomalies = correlationAnomalies != null
                ? List.copyOf(correlationAnomalies) : Collections.emptyList();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : Collections.emptyList();
    }

    public Map<String, SortedSet<Integer>> getStatisticalAnomalies() { return statisticalAnomalies; }
    public SortedSet<Integer> getMultivariateOutliers() { return multivariateOutliers; }
    public Map<String, SortedSet<Integer>> getTemporalAnomalies() { return temporalAnomalies; }
    public List<CorrelationAnomaly> getCorrelationAnomalies() { return correlationAnomalies; }
    public List<DetectorDiagnostic> getDiagnostics() { return diagnostics; }

    public SortedSet<Integer> getStatisticalAnomalies(String column) {
        return statisticalAnomalies.getOrDefault(column, Collections.emptySortedSet());
    }

    public SortedSet<Integer> getTemporalAnomalies(String column) {
        return temporalAnomalies.getOrDefault(column, Collections.emptySortedSet());
    }

    public int getStatisticalAnomalyCount() {
        return IndexSets.total(statisticalAnomalies);
    }

    public int getTemporalAnomalyCount() {
        return IndexSets.total(temporalAnomalies);
    }

    public boolean hasFailures() {
        return !diagnostics.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnomalyReport)) return false;
        AnomalyReport that = (AnomalyReport) o;
        return statisticalAnomalies.equals(that.statisticalAnomalies)
                && multivariateOutliers.equals(that.multivariateOutliers)
                && temporalAnomalies.equals(that.temporalAnomalies)
                && correlationAnomalies.equals(that.correlationAnomalies)
                && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statisticalAnomalies, multivariateOutliers, temporalAnomalies,
                correlationAnomalies, diagnostics);
    }

    @Override
    public String toString() {
        return "AnomalyReport{statistical=" + statisticalAnomalies
                + ", multivariate=" + multivariateOutliers
                + ", temporal=" + temporalAnomalies
                + ", correlation=" + correlationAnomalies
                + ", diagnostics=" + diagnostics + "}";
    }
}
