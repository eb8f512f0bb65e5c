package com.climate.quality.detectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("IsolationForest 单元测试")
class IsolationForestTest {

    /** 40 个聚集在原点附近的样本，最后一个样本远离其余样本 */
    private static double[][] clusterWithOneFarPoint() {
        double[][] x = new double[41][];
        for (int i = 0; i < 40; i++) {
            x[i] = new double[]{(i % 5) * 0.1, (i % 3) * 0.1};
        }
        x[40] = new double[]{50.0, 50.0};
        return x;
    }

    @Test
    @DisplayName("平均路径长度 c(n)")
    void averagePathLength() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    @DisplayName("远离簇的样本分数最高并被标记")
    void isolatesFarPoint() {
        IsolationForest forest = new IsolationForest(100, 256, 0.1, 42L);
        double[][] x = clusterWithOneFarPoint();

        forest.fit(x);
        double[] scores = forest.scoreSamples(x);

        for (int i = 0; i < 40; i++) {
            assertThat(scores[40]).isGreaterThan(scores[i]);
        }
        for (double score : scores) {
            assertThat(score).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
        assertThat(new IsolationForest(100, 256, 0.1, 42L).fitPredict(x)).contains(40).hasSizeLessThanOrEqualTo(5);
    }

    @Test
    @DisplayName("相同种子结果可复现")
    void sameSeedIsDeterministic() {
        double[][] x = clusterWithOneFarPoint();

        assertThat(new IsolationForest(50, 32, 0.1, 7L).fitPredict(x))
                .isEqualTo(new IsolationForest(50, 32, 0.1, 7L).fitPredict(x));
    }

    @Test
    @DisplayName("非法参数与输入")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new IsolationForest(0, 256, 0.1, 1L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForest(10, 1, 0.1, 1L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForest(10, 256, 0.6, 1L)).isInstanceOf(IllegalArgumentException.class);

        IsolationForest forest = new IsolationForest(10, 256, 0.1, 1L);
        assertThatThrownBy(() -> forest.scoreSamples(new double[][]{{1.0}}))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> forest.fit(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> forest.fit(new double[][]{{1.0}, {Double.NaN}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sample 1");
    }
}
