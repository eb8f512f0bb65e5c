package com.climate.quality.core.imp;

import com.climate.quality.core.AnomalyDetector;
import com.climate.quality.core.AnomalyOrchestrator;
import com.climate.quality.model.AnomalyReport;
import com.climate.quality.model.CorrelationAnomaly;
import com.climate.quality.model.Dataset;
import com.climate.quality.model.DetectorDiagnostic;
import com.climate.quality.model.DetectorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 异常检测编排器默认实现。
 * 依次在各自的隔离边界内运行四个检测器，失败的检测器记录诊断信息并以空结果参与汇总。
 */
public class DefaultAnomalyOrchestrator implements AnomalyOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultAnomalyOrchestrator.class);

    private final AnomalyDetector<Map<String, SortedSet<Integer>>> statisticalDetector;
    private final AnomalyDetector<SortedSet<Integer>> multivariateDetector;
    private final AnomalyDetector<Map<String, SortedSet<Integer>>> temporalDetector;
    private final AnomalyDetector<List<CorrelationAnomaly>> correlationDetector;

    public DefaultAnomalyOrchestrator(AnomalyDetector<Map<String, SortedSet<Integer>>> statisticalDetector,
                                      AnomalyDetector<SortedSet<Integer>> multivariateDetector,
                                      AnomalyDetector<Map<String, SortedSet<Integer>>> temporalDetector,
                                      AnomalyDetector<List<CorrelationAnomaly>> correlationDetector) {
        this.statisticalDetector = statisticalDetector;
        this.multivariateDetector = multivariateDetector;
        this.temporalDetector = temporalDetector;
        this.correlationDetector = correlationDetector;
    }

    @Override
    public AnomalyReport detect(Dataset data) {
        Objects.requireNonNull(data, "No dataset supplied for anomaly detection");

        List<DetectorDiagnostic> diagnostics = new ArrayList<>();
        Map<String, SortedSet<Integer>> statistical = run(statisticalDetector, data, diagnostics);
        SortedSet<Integer> multivariate = run(multivariateDetector, data, diagnostics);
        Map<String, SortedSet<Integer>> temporal = run(temporalDetector, data, diagnostics);
        List<CorrelationAnomaly> correlation = run(correlationDetector, data, diagnostics);

        AnomalyReport report = new AnomalyReport(statistical, multivariate, temporal, correlation, diagnostics);
        log.info("Anomaly detection over {} row(s): {} statistical, {} multivariate, {} temporal, {} correlation, {} failed detector(s)",
                data.getRowCount(), report.getStatisticalAnomalyCount(), multivariate.size(),
                report.getTemporalAnomalyCount(), correlation.size(), diagnostics.size());
        return report;
    }

    private <R> R run(AnomalyDetector<R> detector, Dataset data, List<DetectorDiagnostic> diagnostics) {
        long start = System.currentTimeMillis();
        DetectorResult<R> result = detector.detectSafely(data);
        if (!result.isSuccess()) {
            diagnostics.add(result.getDiagnostic());
            log.warn("Detector '{}' failed, reporting empty result: {}",
                    detector.getDetectorId(), result.getDiagnostic().getMessage(), result.getCause());
        } else {
            log.debug("Detector '{}' completed in {}ms", detector.getDetectorId(),
                    System.currentTimeMillis() - start);
        }
        return result.getValue();
    }
}
