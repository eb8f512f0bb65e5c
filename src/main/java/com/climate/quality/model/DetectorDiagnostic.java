package com.climate.quality.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 检测器执行失败的诊断信息
 */
public final class DetectorDiagnostic implements Serializable {
    private final String detectorId;
    private final String message;

    public DetectorDiagnostic(String detectorId, String message) {
        this.detectorId = Objects.requireNonNull(detectorId, "detectorId");
        this.message = message;
    }

    public String getDetectorId() { return detectorId; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectorDiagnostic)) return false;
        DetectorDiagnostic that = (DetectorDiagnostic) o;
        return detectorId.equals(that.detectorId) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorId, message);
    }

    @Override
    public String toString() {
        return detectorId + ": " + message;
    }
}
