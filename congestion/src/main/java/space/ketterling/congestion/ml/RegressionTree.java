package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * CART regression tree stored as flat node arrays.
 *
 * <p>
 * Splits minimize the weighted squared error. Rows carry a weight so a
 * bootstrap sample is expressed as repeat counts instead of copied rows.
 * A node with {@code left == -1} is a leaf.
 * </p>
 */
final class RegressionTree {
    private static final double MIN_GAIN = 1e-12;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;
    private final double[] importance;

    private RegressionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value,
            double[] importance) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.value = value;
        this.importance = importance;
    }

    /**
     * Growth limits for one tree.
     *
     * @param maxFeatures columns examined per split; equal to the column count
     *                    disables feature subsampling
     */
    record Params(int maxDepth, int minSamplesSplit, int minSamplesLeaf, int maxFeatures) {
    }

    /**
     * Row indices sorted by each column, computed once per ensemble fit.
     */
    static int[][] presort(double[][] x) {
        int cols = x[0].length;
        int[][] sorted = new int[cols][];
        for (int f = 0; f < cols; f++) {
            final int col = f;
            sorted[f] = IntStream.range(0, x.length)
                    .boxed()
                    .sorted(Comparator.comparingDouble(r -> x[r][col]))
                    .mapToInt(Integer::intValue)
                    .toArray();
        }
        return sorted;
    }

    /**
     * Grows a tree over the rows with a positive weight.
     */
    static RegressionTree grow(double[][] x, double[] y, double[] w, int[][] presorted, Params params,
            Random rnd) {
        int cols = presorted.length;
        int[][] rootRows = new int[cols][];
        for (int f = 0; f < cols; f++) {
            rootRows[f] = Arrays.stream(presorted[f]).filter(r -> w[r] > 0).toArray();
        }
        Grower g = new Grower(x, y, w, params, rnd, cols);
        g.build(rootRows, 0);
        return g.finish();
    }

    double predict(double[] row) {
        int node = 0;
        while (left[node] != -1) {
            node = row[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    /**
     * Normalized importance; zeros for a single-leaf tree.
     */
    double[] featureImportance() {
        double total = 0;
        for (double v : importance)
            total += v;
        double[] out = new double[importance.length];
        if (total <= 0)
            return out;
        for (int i = 0; i < out.length; i++)
            out[i] = importance[i] / total;
        return out;
    }

    int nodeCount() {
        return value.length;
    }

    int depth() {
        return depthOf(0);
    }

    private int depthOf(int node) {
        if (left[node] == -1)
            return 0;
        return 1 + Math.max(depthOf(left[node]), depthOf(right[node]));
    }

    ObjectNode toJson(ObjectMapper om) {
        ObjectNode n = om.createObjectNode();
        ArrayNode f = n.putArray("feature");
        ArrayNode t = n.putArray("threshold");
        ArrayNode l = n.putArray("left");
        ArrayNode r = n.putArray("right");
        ArrayNode v = n.putArray("value");
        for (int i = 0; i < value.length; i++) {
            f.add(feature[i]);
            t.add(threshold[i]);
            l.add(left[i]);
            r.add(right[i]);
            v.add(value[i]);
        }
        ArrayNode imp = n.putArray("importance");
        for (double d : importance)
            imp.add(d);
        return n;
    }

    static RegressionTree fromJson(JsonNode n) {
        int size = n.path("value").size();
        if (size == 0)
            throw new IllegalArgumentException("tree has no nodes");
        int[] feature = new int[size];
        double[] threshold = new double[size];
        int[] left = new int[size];
        int[] right = new int[size];
        double[] value = new double[size];
        for (int i = 0; i < size; i++) {
            feature[i] = n.path("feature").get(i).asInt();
            threshold[i] = n.path("threshold").get(i).asDouble();
            left[i] = n.path("left").get(i).asInt();
            right[i] = n.path("right").get(i).asInt();
            value[i] = n.path("value").get(i).asDouble();
        }
        JsonNode impNode = n.path("importance");
        double[] importance = new double[impNode.size()];
        for (int i = 0; i < importance.length; i++)
            importance[i] = impNode.get(i).asDouble();
        return new RegressionTree(feature, threshold, left, right, value, importance);
    }

    /**
     * Recursive builder. Each node receives its rows sorted by every column;
     * a split partitions those lists stably so no re-sorting happens below
     * the root.
     */
    private static final class Grower {
        private final double[][] x;
        private final double[] y;
        private final double[] w;
        private final Params params;
        private final Random rnd;
        private final int cols;
        private final boolean[] goesLeft;
        private final double[] importance;

        private int[] feature = new int[64];
        private double[] threshold = new double[64];
        private int[] left = new int[64];
        private int[] right = new int[64];
        private double[] value = new double[64];
        private int size;

        Grower(double[][] x, double[] y, double[] w, Params params, Random rnd, int cols) {
            this.x = x;
            this.y = y;
            this.w = w;
            this.params = params;
            this.rnd = rnd;
            this.cols = cols;
            this.goesLeft = new boolean[x.length];
            this.importance = new double[cols];
        }

        int build(int[][] rows, int depth) {
            int[] any = rows[0];
            double n = 0, sum = 0, sumSq = 0;
            for (int r : any) {
                n += w[r];
                sum += w[r] * y[r];
                sumSq += w[r] * y[r] * y[r];
            }
            int node = allocate(sum / n);

            double sse = sumSq - sum * sum / n;
            if (depth >= params.maxDepth() || n < params.minSamplesSplit() || sse <= MIN_GAIN)
                return node;

            int bestFeature = -1;
            double bestThreshold = 0;
            double bestGain = MIN_GAIN;
            double parentScore = sum * sum / n;

            for (int f : candidateFeatures()) {
                int[] sorted = rows[f];
                double wl = 0, sl = 0;
                for (int i = 0; i < sorted.length - 1; i++) {
                    int r = sorted[i];
                    wl += w[r];
                    sl += w[r] * y[r];
                    double here = x[r][f];
                    double next = x[sorted[i + 1]][f];
                    if (here == next)
                        continue;
                    double wr = n - wl;
                    if (wl < params.minSamplesLeaf() || wr < params.minSamplesLeaf())
                        continue;
                    double sr = sum - sl;
                    double gain = sl * sl / wl + sr * sr / wr - parentScore;
                    if (gain > bestGain) {
                        bestGain = gain;
                        bestFeature = f;
                        bestThreshold = (here + next) / 2.0;
                    }
                }
            }

            if (bestFeature < 0)
                return node;

            for (int r : any)
                goesLeft[r] = x[r][bestFeature] <= bestThreshold;

            int[][] leftRows = new int[cols][];
            int[][] rightRows = new int[cols][];
            for (int f = 0; f < cols; f++) {
                int[] src = rows[f];
                int nl = 0;
                for (int r : src)
                    if (goesLeft[r])
                        nl++;
                int[] l = new int[nl];
                int[] rr = new int[src.length - nl];
                int li = 0, ri = 0;
                for (int r : src) {
                    if (goesLeft[r])
                        l[li++] = r;
                    else
                        rr[ri++] = r;
                }
                leftRows[f] = l;
                rightRows[f] = rr;
            }

            importance[bestFeature] += bestGain;
            feature[node] = bestFeature;
            threshold[node] = bestThreshold;
            int l = build(leftRows, depth + 1);
            int r = build(rightRows, depth + 1);
            left[node] = l;
            right[node] = r;
            return node;
        }

        private int[] candidateFeatures() {
            int k = Math.max(1, Math.min(cols, params.maxFeatures()));
            int[] all = IntStream.range(0, cols).toArray();
            if (k == cols)
                return all;
            for (int i = 0; i < k; i++) {
                int j = i + rnd.nextInt(cols - i);
                int tmp = all[i];
                all[i] = all[j];
                all[j] = tmp;
            }
            return Arrays.copyOf(all, k);
        }

        private int allocate(double leafValue) {
            if (size == value.length) {
                int cap = size * 2;
                feature = Arrays.copyOf(feature, cap);
                threshold = Arrays.copyOf(threshold, cap);
                left = Arrays.copyOf(left, cap);
                right = Arrays.copyOf(right, cap);
                value = Arrays.copyOf(value, cap);
            }
            int id = size++;
            feature[id] = -1;
            threshold[id] = 0;
            left[id] = -1;
            right[id] = -1;
            value[id] = leafValue;
            return id;
        }

        RegressionTree finish() {
            return new RegressionTree(
                    Arrays.copyOf(feature, size),
                    Arrays.copyOf(threshold, size),
                    Arrays.copyOf(left, size),
                    Arrays.copyOf(right, size),
                    Arrays.copyOf(value, size),
                    importance.clone());
        }
    }
}
