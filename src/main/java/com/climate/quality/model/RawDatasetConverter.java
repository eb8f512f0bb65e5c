package com.climate.quality.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 原始文本表格转换器。
 * 将已切分好的字符串单元格（表头 + 数据行）转换为定型的 {@link Dataset}。
 *
 * 列类型推断顺序（尽力而为的启发式规则，调用方可通过覆盖表指定任意列的类型）：
 * 1. 覆盖表中指定的类型
 * 2. 列名包含日期提示词（date / time / year / month，不区分大小写）时视为 TIMESTAMP
 * 3. 全部非缺失单元格均可解析为数字时视为 NUMERIC
 * 4. 其余视为 TEXT
 *
 * 缺失值标记：空串、NA、N/A、NaN、null（去除首尾空白、不区分大小写）。
 * 时间列中无法解析的单元格保留原始文本，不做静默置空。
 */
public class RawDatasetConverter {

    public static final List<String> DATE_HINTS = List.of("date", "time", "year", "month");

    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "n/a", "nan", "null");

    private final Map<String, ColumnType> typeOverrides;

    public RawDatasetConverter() {
        this(Collections.emptyMap());
    }

    public RawDatasetConverter(Map<String, ColumnType> typeOverrides) {
        this.typeOverrides = typeOverrides != null ? Map.copyOf(typeOverrides) : Map.of();
    }

    /**
     * 转换原始表格。
     *
     * @param header 列名
     * @param rows   数据行，每行单元格数量须与表头一致
     * @return 定型后的数据表
     * @throws IllegalArgumentException 行长度与表头不一致，或覆盖为NUMERIC的列含非数字单元格
     */
    public Dataset convert(List<String> header, List<List<String>> rows) {
        for (int r = 0; r < rows.size(); r++) {
            if (rows.get(r).size() != header.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + rows.get(r).size()
                        + " cells, header has " + header.size());
            }
        }

        List<ColumnType> types = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            types.add(inferType(header.get(c), columnCells(rows, c)));
        }

        Dataset.Builder builder = Dataset.builder();
        for (int c = 0; c < header.size(); c++) {
            builder.column(header.get(c), types.get(c));
        }
        for (int r = 0; r < rows.size(); r++) {
            List<String> raw = rows.get(r);
            Object[] values = new Object[header.size()];
            for (int c = 0; c < header.size(); c++) {
                values[c] = convertCell(header.get(c), types.get(c), raw.get(c), r);
            }
            builder.row(values);
        }
        return builder.build();
    }

    /**
     * 推断单列的类型
     */
    public ColumnType inferType(String columnName, List<String> cells) {
        ColumnType override = typeOverrides.get(columnName);
        if (override != null) {
            return override;
        }
        if (looksLikeDateColumn(columnName)) {
            return ColumnType.TIMESTAMP;
        }
        boolean sawValue = false;
        for (String cell : cells) {
            if (isMissing(cell)) continue;
            sawValue = true;
            if (parseNumber(cell) == null) {
                return ColumnType.TEXT;
            }
        }
        return sawValue ? ColumnType.NUMERIC : ColumnType.TEXT;
    }

    public static boolean looksLikeDateColumn(String columnName) {
        String lower = columnName.toLowerCase(Locale.ROOT);
        for (String hint : DATE_HINTS) {
            if (lower.contains(hint)) return true;
        }
        return false;
    }

    public static boolean isMissing(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT));
    }

    private Object convertCell(String column, ColumnType type, String cell, int row) {
        if (isMissing(cell)) return null;
        String trimmed = cell.trim();
        switch (type) {
            case NUMERIC:
                Double number = parseNumber(trimmed);
                if (number == null) {
                    throw new IllegalArgumentException("Column '" + column + "' row " + row
                            + ": '" + cell + "' is not a number");
                }
                return number;
            case TIMESTAMP:
                // 交由 Dataset 解析，无法解析时保留原文
                return trimmed;
            default:
                return trimmed;
        }
    }

    private static Double parseNumber(String text) {
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> columnCells(List<List<String>> rows, int column) {
        List<String> cells = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            cells.add(row.get(column));
        }
        return cells;
    }
}
