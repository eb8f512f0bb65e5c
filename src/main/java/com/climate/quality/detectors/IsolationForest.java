package com.climate.quality.detectors;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 孤立森林离群检测模型。
 *
 * 每棵树从数据中无放回抽取 psi = min(maxSamples, n) 个样本，递归地随机选取特征、
 * 在该特征当前取值范围内随机选取切分点，直至样本被孤立或达到高度上限 ceil(log2(psi))。
 * 样本的异常分数 s = 2^(-E[h(x)] / c(psi))，其中 h(x) 为路径长度，c(psi) 为同规模二叉搜索树的平均路径长度。
 * 按污染率取分数分位点作为阈值，高于阈值者标记为离群。
 *
 * 模型实例只服务于一次检测：由调用方在每次检测时新建，fit 之后的树不跨数据集复用。
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int treeCount;
    private final int maxSamples;
    private final double contamination;
    private final RandomGenerator random;

    private final List<Node> trees = new ArrayList<>();
    private int sampleSize;

    public IsolationForest(int treeCount, int maxSamples, double contamination, long seed) {
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be at least 1, got " + treeCount);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("maxSamples must be at least 2, got " + maxSamples);
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        this.treeCount = treeCount;
        this.maxSamples = maxSamples;
        this.contamination = contamination;
        this.random = new MersenneTwister(seed);
    }

    /**
     * 训练并返回离群样本的行位置。
     *
     * @param x 样本矩阵，x[i] 为第 i 个样本的特征向量，不得含 NaN
     * @return 被标记为离群的样本位置
     */
    public SortedSet<Integer> fitPredict(double[][] x) {
        fit(x);
        double[] scores = scoreSamples(x);

        double[] negated = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            negated[i] = -scores[i];
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double offset = percentile.evaluate(negated, contamination * 100);

        SortedSet<Integer> outliers = new TreeSet<>();
        for (int i = 0; i < negated.length; i++) {
            if (negated[i] < offset) {
                outliers.add(i);
            }
        }
        return outliers;
    }

    public void fit(double[][] x) {
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero samples");
        }
        for (int i = 0; i < x.length; i++) {
            for (double v : x[i]) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Sample " + i + " contains a non-finite value");
                }
            }
        }

        trees.clear();
        sampleSize = Math.min(maxSamples, x.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

        for (int t = 0; t < treeCount; t++) {
            int[] sample = drawSample(x.length, sampleSize);
            trees.add(build(x, sample, 0, heightLimit));
        }
    }

    /**
     * @return 每个样本的异常分数，取值 (0, 1]，越接近1越异常
     */
    public double[] scoreSamples(double[][] x) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        double normalizer = averagePathLength(sampleSize);
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double total = 0;
            for (Node tree : trees) {
                total += pathLength(tree, x[i], 0);
            }
            double meanPath = total / trees.size();
            scores[i] = normalizer > 0 ? Math.pow(2, -meanPath / normalizer) : 0.5;
        }
        return scores;
    }

    /**
     * 无放回抽样（部分 Fisher-Yates 洗牌）
     */
    private int[] drawSample(int n, int size) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }

    private Node build(double[][] x, int[] rows, int depth, int heightLimit) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int features = x[rows[0]].length;
        List<Integer> splittable = new ArrayList<>();
        double[] mins = new double[features];
        double[] maxs = new double[features];
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int row : rows) {
                min = Math.min(min, x[row][f]);
                max = Math.max(max, x[row][f]);
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) splittable.add(f);
        }
        // 所有特征在该节点上都是常量，无法继续切分
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }

        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        int leftCount = 0;
        for (int row : rows) {
            if (x[row][feature] < split) leftCount++;
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (x[row][feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }

        return Node.split(feature, split,
                build(x, left, depth + 1, heightLimit),
                build(x, right, depth + 1, heightLimit));
    }

    private static double pathLength(Node node, double[] sample, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = sample[node.feature] < node.threshold ? node.left : node.right;
        return pathLength(next, sample, depth + 1);
    }

    /**
     * 含 n 个样本的二叉搜索树中不成功查找的平均路径长度 c(n)
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
