package com.climate.quality.core;

import com.climate.quality.model.Dataset;
import com.climate.quality.model.DetectorResult;

/**
 * 异常检测器接口：所有检测方法的统一契约。
 *
 * 检测器之间互不感知，各自读取同一份清洗后的数据表，写入异常报告中互不重叠的字段。
 *
 * 实现约定：
 * - detect 是输入数据与固定配置的纯函数，所需的统计量、标准化器、模型均在调用内部新建，
 *   不得缓存到实例字段中，以免不同数据集之间的统计泄漏
 * - 实例只持有不可变配置，可被多线程共享
 * - 零行、零数值列等空输入返回该检测器的自然空结果，不抛异常
 *
 * @param <R> 检测结果类型
 */
public interface AnomalyDetector<R> {

    /**
     * @return 检测器唯一标识，用于日志与诊断信息
     */
    String getDetectorId();

    /**
     * 对数据表执行检测。
     *
     * @param data 清洗后的数据表
     * @return 检测结果，引用原始行索引
     */
    R detect(Dataset data);

    /**
     * @return 该检测器的空结果，执行失败时作为其输出
     */
    R emptyResult();

    /**
     * 检测器的隔离边界：执行 detect，任何运行时异常都被转换为空结果加诊断信息，
     * 不会向调用方传播。
     *
     * @param data 清洗后的数据表
     * @return 成功结果，或带诊断信息的失败结果
     */
    default DetectorResult<R> detectSafely(Dataset data) {
        try {
            return DetectorResult.success(getDetectorId(), detect(data));
        } catch (RuntimeException e) {
            return DetectorResult.failure(getDetectorId(), emptyResult(), e);
        }
    }
}
