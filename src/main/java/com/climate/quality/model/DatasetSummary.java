package com.climate.quality.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 数据集摘要，供问答等下游协作方作为只读上下文使用。
 * 摘要仅从数据表与两份报告派生，不会重新运行任何检测。
 * 形状、类型、缺失值与描述统计均基于清洗后的数据表；填充前的缺失情况单独记录。
 */
public final class DatasetSummary implements Serializable {

    private final int rowCount;
    private final int columnCount;
    private final List<String> columns;
    private final Map<String, ColumnType> columnTypes;
    private final Map<String, Integer> missingValues;
    private final Map<String, Integer> missingBeforeImputation;
    private final Map<String, ColumnStatistics> numericSummary;
    private final ValidationReport validationReport;
    private final AnomalyReport anomalyReport;

    private DatasetSummary(Dataset data, Dataset original,
                           ValidationReport validationReport, AnomalyReport anomalyReport) {
        this.rowCount = data.getRowCount();
        this.columnCount = data.getColumnCount();
        this.columns = data.getColumnNames();

        Map<String, ColumnType> types = new LinkedHashMap<>();
        Map<String, Integer> missing = new LinkedHashMap<>();
        Map<String, ColumnStatistics> numeric = new LinkedHashMap<>();
        for (String column : data.getColumnNames()) {
            types.put(column, data.getColumnType(column));
            missing.put(column, data.countMissing(column));
            if (data.getColumnType(column) == ColumnType.NUMERIC) {
                numeric.put(column, ColumnStatistics.of(data.getNumericColumn(column)));
            }
        }
        this.columnTypes = Collections.unmodifiableMap(types);
        this.missingValues = Collections.unmodifiableMap(missing);
        this.numericSummary = Collections.unmodifiableMap(numeric);

        Map<String, Integer> originalMissing = new LinkedHashMap<>();
        for (String column : original.getColumnNames()) {
            originalMissing.put(column, original.countMissing(column));
        }
        this.missingBeforeImputation = Collections.unmodifiableMap(originalMissing);
        this.validationReport = validationReport;
        this.anomalyReport = anomalyReport;
    }

    /**
     * @param data             被描述的数据表，填充前后视为同一份
     * @param validationReport 预处理校验报告
     * @param anomalyReport    异常检测报告
     */
    public static DatasetSummary of(Dataset data, ValidationReport validationReport, AnomalyReport anomalyReport) {
        return of(data, data, validationReport, anomalyReport);
    }

    /**
     * @param processed        预处理输出的数据表，摘要的主体基于此表
     * @param original         预处理之前的原始数据表，仅用于统计填充前的缺失值
     * @param validationReport 预处理校验报告
     * @param anomalyReport    异常检测报告
     */
    public static DatasetSummary of(Dataset processed, Dataset original,
                                    ValidationReport validationReport, AnomalyReport anomalyReport) {
        Objects.requireNonNull(processed, "processed");
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(validationReport, "validationReport");
        Objects.requireNonNull(anomalyReport, "anomalyReport");
        return new DatasetSummary(processed, original, validationReport, anomalyReport);
    }

    public int getRowCount() { return rowCount; }
    public int getColumnCount() { return columnCount; }
    public List<String> getColumns() { return columns; }
    public Map<String, ColumnType> getColumnTypes() { return columnTypes; }
    public Map<String, Integer> getMissingValues() { return missingValues; }
    public Map<String, Integer> getMissingBeforeImputation() { return missingBeforeImputation; }
    public Map<String, ColumnStatistics> getNumericSummary() { return numericSummary; }
    public ValidationReport getValidationReport() { return validationReport; }
    public AnomalyReport getAnomalyReport() { return anomalyReport; }

    public int getTotalMissing() {
        int total = 0;
        for (int count : missingValues.values()) total += count;
        return total;
    }

    /** 存在范围异常的列数 */
    public int getRangeAnomalyColumnCount() {
        return validationReport.getRangeAnomalies().size();
    }

    public int getTemporalInconsistencyCount() {
        return validationReport.getTemporalInconsistencies().size();
    }

    public int getStatisticalAnomalyCount() {
        return anomalyReport.getStatisticalAnomalyCount();
    }

    public int getMultivariateOutlierCount() {
        return anomalyReport.getMultivariateOutliers().size();
    }

    public int getCorrelationAnomalyCount() {
        return anomalyReport.getCorrelationAnomalies().size();
    }
}
