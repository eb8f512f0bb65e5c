package com.climate.quality.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 强相关列对。columnA 在列顺序上总位于 columnB 之前。
 */
public final class CorrelationAnomaly implements Serializable {
    private final String columnA;
    private final String columnB;
    /** Pearson相关系数，取值 [-1, 1] */
    private final double correlation;

    public CorrelationAnomaly(String columnA, String columnB, double correlation) {
        this.columnA = Objects.requireNonNull(columnA, "columnA");
        this.columnB = Objects.requireNonNull(columnB, "columnB");
        this.correlation = Math.max(-1.0, Math.min(1.0, correlation));
    }

    public String getColumnA() { return columnA; }
    public String getColumnB() { return columnB; }
    public double getCorrelation() { return correlation; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationAnomaly)) return false;
        CorrelationAnomaly that = (CorrelationAnomaly) o;
        return Double.compare(correlation, that.correlation) == 0
                && columnA.equals(that.columnA)
                && columnB.equals(that.columnB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnA, columnB, correlation);
    }

    @Override
    public String toString() {
        return "CorrelationAnomaly{" + columnA + " ~ " + columnB + ", r=" + correlation + "}";
    }
}
