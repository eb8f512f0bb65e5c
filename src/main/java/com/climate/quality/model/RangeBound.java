package com.climate.quality.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 物理量合理取值范围，闭区间 [min, max]
 */
public final class RangeBound implements Serializable {
    private final String variableName;
    private final double min;
    private final double max;

    public RangeBound(String variableName, double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("Range for '" + variableName + "' has min " + min
                    + " greater than max " + max);
        }
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.min = min;
        this.max = max;
    }

    public String getVariableName() { return variableName; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    /**
     * @return 值是否落在区间外
     */
    public boolean isViolatedBy(double value) {
        return value < min || value > max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeBound)) return false;
        RangeBound that = (RangeBound) o;
        return Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && variableName.equals(that.variableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableName, min, max);
    }

    @Override
    public String toString() {
        return variableName + "[" + min + ", " + max + "]";
    }
}
