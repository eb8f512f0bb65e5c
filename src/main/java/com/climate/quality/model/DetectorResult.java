package com.climate.quality.model;

import java.util.Objects;

/**
 * 单个检测器的执行结果：成功时携带检测结果，失败时携带该检测器的空结果与诊断信息。
 *
 * @param <R> 检测结果类型
 */
public final class DetectorResult<R> {

    private final String detectorId;
    private final R value;
    private final DetectorDiagnostic diagnostic;
    private final Throwable cause;

    private DetectorResult(String detectorId, R value, DetectorDiagnostic diagnostic, Throwable cause) {
        this.detectorId = Objects.requireNonNull(detectorId, "detectorId");
        this.value = Objects.requireNonNull(value, "value");
        this.diagnostic = diagnostic;
        this.cause = cause;
    }

    public static <R> DetectorResult<R> success(String detectorId, R value) {
        return new DetectorResult<>(detectorId, value, null, null);
    }

    public static <R> DetectorResult<R> failure(String detectorId, R emptyValue, Throwable cause) {
        String message = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new DetectorResult<>(detectorId, emptyValue,
                new DetectorDiagnostic(detectorId, message), cause);
    }

    public boolean isSuccess() {
        return diagnostic == null;
    }

    public String getDetectorId() { return detectorId; }
    public R getValue() { return value; }

    /** @return 失败诊断；成功时为null */
    public DetectorDiagnostic getDiagnostic() { return diagnostic; }

    /** @return 失败原因；成功时为null */
    public Throwable getCause() { return cause; }
}
