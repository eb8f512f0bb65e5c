package com.climate.quality.model;

import java.util.Objects;

/**
 * 一次完整质量评估的结果：原始数据、清洗后数据、两份报告及摘要
 */
public final class QualityAssessment {
    private final Dataset rawDataset;
    private final Dataset cleanedDataset;
    private final ValidationReport validationReport;
    private final AnomalyReport anomalyReport;
    private final DatasetSummary summary;

    public QualityAssessment(Dataset rawDataset, Dataset cleanedDataset,
                             ValidationReport validationReport, AnomalyReport anomalyReport,
                             DatasetSummary summary) {
        this.rawDataset = Objects.requireNonNull(rawDataset, "rawDataset");
        this.cleanedDataset = Objects.requireNonNull(cleanedDataset, "cleanedDataset");
        this.validationReport = Objects.requireNonNull(validationReport, "validationReport");
        this.anomalyReport = Objects.requireNonNull(anomalyReport, "anomalyReport");
        this.summary = Objects.requireNonNull(summary, "summary");
    }

    public Dataset getRawDataset() { return rawDataset; }
    public Dataset getCleanedDataset() { return cleanedDataset; }
    public ValidationReport getValidationReport() { return validationReport; }
    public AnomalyReport getAnomalyReport() { return anomalyReport; }
    public DatasetSummary getSummary() { return summary; }
}
