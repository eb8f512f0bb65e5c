package com.climate.quality.detectors;

import com.climate.quality.model.ColumnType;
import com.climate.quality.model.Dataset;
import com.climate.quality.support.TestDatasets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatisticalAnomalyDetector 单元测试")
class StatisticalAnomalyDetectorTest {

    private final StatisticalAnomalyDetector detector = new StatisticalAnomalyDetector(3.0);

    /** 19 个 10/11 交替的正常值，最后一行为 100 */
    private static double[] withSingleOutlier() {
        double[] values = new double[20];
        for (int i = 0; i < 19; i++) {
            values[i] = i % 2 == 0 ? 10.0 : 11.0;
        }
        values[19] = 100.0;
        return values;
    }

    @Test
    @DisplayName("只标记偏离均值超过阈值的行")
    void flagsOnlyTheOutlier() {
        Map<String, SortedSet<Integer>> result = detector.detect(TestDatasets.series("temperature", withSingleOutlier()));

        assertThat(result.get("temperature")).containsExactly(19);
    }

    @Test
    @DisplayName("常量列不产生异常")
    void constantColumnYieldsNothing() {
        Map<String, SortedSet<Integer>> result =
                detector.detect(TestDatasets.series("humidity", 50, 50, 50, 50, 50, 50));

        assertThat(result).containsKey("humidity");
        assertThat(result.get("humidity")).isEmpty();
    }

    @Test
    @DisplayName("缺失值不参与统计也不被标记")
    void ignoresMissingValues() {
        Dataset.Builder builder = Dataset.builder().column("pressure", ColumnType.NUMERIC);
        double[] values = withSingleOutlier();
        for (double value : values) {
            builder.row(value);
        }
        builder.row((Object) null);

        Map<String, SortedSet<Integer>> result = detector.detect(builder.build());

        assertThat(result.get("pressure")).containsExactly(19);
    }

    @Test
    @DisplayName("NaN 单元格按缺失跳过，不影响同列离群值的判定")
    void nanCellDoesNotHideOutlier() {
        Dataset.Builder builder = Dataset.builder().column("temperature", ColumnType.NUMERIC);
        builder.row(Double.NaN);
        for (int i = 1; i < 29; i++) {
            builder.row(10.0 + (i % 3));
        }
        builder.row(55.0);

        Map<String, SortedSet<Integer>> result = detector.detect(builder.build());

        assertThat(result.get("temperature")).containsExactly(29);
    }

    @Test
    @DisplayName("每个数值列都有条目，文本与时间列不检测")
    void coversEveryNumericColumn() {
        Map<String, SortedSet<Integer>> result = detector.detect(TestDatasets.hourlyObservations(8));

        assertThat(result).containsOnlyKeys("temperature", "humidity", "pressure");
        assertThat(detector.detect(TestDatasets.textOnly(5))).isEmpty();
    }

    @Test
    @DisplayName("阈值越低标记越多")
    void lowerThresholdFlagsMore() {
        Dataset data = TestDatasets.series("temperature", withSingleOutlier());

        SortedSet<Integer> strict = new StatisticalAnomalyDetector(3.0).detect(data).get("temperature");
        SortedSet<Integer> loose = new StatisticalAnomalyDetector(0.1).detect(data).get("temperature");

        assertThat(loose).containsAll(strict).hasSizeGreaterThan(strict.size());
    }
}
