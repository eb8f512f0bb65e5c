package com.climate.quality.model;

/**
 * 列数据类型枚举
 */
public enum ColumnType {
    /** 数值型（温度、湿度、降水量等观测值） */
    NUMERIC,
    /** 文本型（站点名称、区域编码等分类值） */
    TEXT,
    /** 时间戳型 */
    TIMESTAMP
}
