package com.climate.quality.model;

import java.io.Serializable;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 观测数据表：按行有序、按列定型的内存表格。
 *
 * 行的身份即其原始位置索引（从0开始），所有报告均以此索引引用行。
 * 数据表不可变，任何变换（如缺失值填充）都返回新实例，行的顺序与数量保持不变。
 *
 * 单元格取值约定：
 * - NUMERIC 列存放有限的 Double，NaN 与无穷按缺失处理
 * - TEXT 列存放 String
 * - TIMESTAMP 列存放 java.sql.Timestamp；无法解析的原始值按原样保留，供结构校验发现
 * - null 表示缺失
 */
public final class Dataset implements Serializable {

    private final List<String> columnNames;
    private final Map<String, ColumnType> columnTypes;
    /** 列存储：列名 -> 按行索引排列的取值 */
    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private Dataset(List<String> columnNames,
                    Map<String, ColumnType> columnTypes,
                    Map<String, List<Object>> columns,
                    int rowCount) {
        this.columnNames = Collections.unmodifiableList(columnNames);
        this.columnTypes = Collections.unmodifiableMap(columnTypes);
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getRowCount() { return rowCount; }
    public int getColumnCount() { return columnNames.size(); }
    public List<String> getColumnNames() { return columnNames; }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return columnTypes.containsKey(name);
    }

    /**
     * @return 列类型；列不存在时返回null
     */
    public ColumnType getColumnType(String name) {
        return columnTypes.get(name);
    }

    /**
     * 按声明顺序返回全部数值列名
     */
    public List<String> getNumericColumns() {
        return getColumnsOfType(ColumnType.NUMERIC);
    }

    public List<String> getColumnsOfType(ColumnType type) {
        List<String> result = new ArrayList<>();
        for (String name : columnNames) {
            if (columnTypes.get(name) == type) {
                result.add(name);
            }
        }
        return result;
    }

    /**
     * @return 指定列的全部取值（只读视图）
     * @throws IllegalArgumentException 列不存在
     */
    public List<Object> getColumn(String name) {
        List<Object> column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return Collections.unmodifiableList(column);
    }

    /**
     * 读取数值列，缺失值以null表示
     */
    public List<Double> getNumericColumn(String name) {
        List<Object> column = getColumn(name);
        List<Double> values = new ArrayList<>(column.size());
        for (Object value : column) {
            values.add(value == null ? null : ((Number) value).doubleValue());
        }
        return values;
    }

    public Object getValue(int row, String column) {
        return getColumn(column).get(row);
    }

    /**
     * @return 指定行按列顺序排列的取值
     */
    public List<Object> getRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
        }
        List<Object> values = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            values.add(columns.get(name).get(row));
        }
        return values;
    }

    /**
     * 按时间列升序排列的行索引（稳定排序）。
     * 时间值缺失或无法解析的行不参与排序，也不出现在结果中。
     *
     * @param timestampColumn 时间列名
     * @return 原始行索引序列；列不存在时返回空列表
     */
    public List<Integer> rowsInTimeOrder(String timestampColumn) {
        if (!hasColumn(timestampColumn)) {
            return Collections.emptyList();
        }
        List<Object> column = columns.get(timestampColumn);
        List<Integer> rows = new ArrayList<>();
        List<Long> times = new ArrayList<>(Collections.nCopies(rowCount, (Long) null));
        for (int i = 0; i < rowCount; i++) {
            Timestamp ts = TimestampParser.parse(column.get(i));
            if (ts != null) {
                rows.add(i);
                times.set(i, ts.getTime());
            }
        }
        rows.sort(Comparator.comparingLong(times::get));
        return rows;
    }

    /**
     * 读取指定行的时间值（毫秒），无法解析时返回null
     */
    public Long getTimeMillis(int row, String timestampColumn) {
        Timestamp ts = TimestampParser.parse(getValue(row, timestampColumn));
        return ts != null ? ts.getTime() : null;
    }

    /**
     * 统计指定列的缺失单元格数
     */
    public int countMissing(String column) {
        int missing = 0;
        for (Object value : getColumn(column)) {
            if (value == null) missing++;
        }
        return missing;
    }

    /**
     * 替换一列的取值，返回新的数据表。列的位置与类型不变。
     *
     * @throws IllegalArgumentException 列不存在或行数不一致
     */
    public Dataset withColumn(String name, List<?> values) {
        if (!columns.containsKey(name)) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + name + "' expects " + rowCount
                    + " values, got " + values.size());
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.put(name, normalizeColumn(name, columnTypes.get(name), values));
        return new Dataset(new ArrayList<>(columnNames), new LinkedHashMap<>(columnTypes), copy, rowCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset)) return false;
        Dataset other = (Dataset) o;
        return rowCount == other.rowCount
                && columnNames.equals(other.columnNames)
                && columnTypes.equals(other.columnTypes)
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnNames, columnTypes, columns, rowCount);
    }

    @Override
    public String toString() {
        return "Dataset{rows=" + rowCount + ", columns=" + columnTypes + "}";
    }

    private static List<Object> normalizeColumn(String name, ColumnType type, List<?> values) {
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalizeValue(name, type, value));
        }
        return normalized;
    }

    private static Object normalizeValue(String column, ColumnType type, Object value) {
        if (value == null) return null;
        switch (type) {
            case NUMERIC:
                if (!(value instanceof Number)) {
                    throw new IllegalArgumentException("Column '" + column
                            + "' expects NUMERIC values, got: " + value.getClass().getSimpleName());
                }
                double number = ((Number) value).doubleValue();
                // NaN 与无穷视为缺失；-0.0 归一为 0.0，保证行比较一致
                if (!Double.isFinite(number)) return null;
                return number == 0.0 ? 0.0 : number;
            case TEXT:
                return value instanceof String ? value : String.valueOf(value);
            case TIMESTAMP:
                // 无法解析的值按原样保留
                Object parsed = TimestampParser.parse(value);
                return parsed != null ? parsed : value;
            default:
                return value;
        }
    }

    /**
     * 数据表构建器：先声明列，再逐行追加取值。
     */
    public static final class Builder {
        private final List<String> columnNames = new ArrayList<>();
        private final Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder() {}

        public Builder column(String name, ColumnType type) {
            Objects.requireNonNull(name, "column name");
            Objects.requireNonNull(type, "column type");
            if (!rows.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before rows are added");
            }
            if (columnTypes.putIfAbsent(name, type) != null) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
            columnNames.add(name);
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != columnNames.size()) {
                throw new IllegalArgumentException("Row " + rows.size() + " has " + values.length
                        + " values, expected " + columnNames.size());
            }
            rows.add(Arrays.copyOf(values, values.length));
            return this;
        }

        public Builder row(List<?> values) {
            return row(values.toArray());
        }

        public Dataset build() {
            Map<String, List<Object>> columns = new LinkedHashMap<>();
            for (int c = 0; c < columnNames.size(); c++) {
                String name = columnNames.get(c);
                ColumnType type = columnTypes.get(name);
                List<Object> values = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    values.add(normalizeValue(name, type, row[c]));
                }
                columns.put(name, values);
            }
            return new Dataset(new ArrayList<>(columnNames), new LinkedHashMap<>(columnTypes),
                    columns, rows.size());
        }
    }
}
