package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Bagged regression trees. This is the "stable" half of the ensemble.
 *
 * <p>
 * Each tree sees a bootstrap sample and a third of the columns per split.
 * Trees get their own seed derived from the forest seed, so fitting in
 * parallel stays reproducible.
 * </p>
 */
public final class RandomForestRegressor implements Regressor {
    public static final String TYPE = "random_forest";

    private final int trees;
    private final int maxDepth;
    private final int minSamplesSplit;
    private final long seed;

    private List<RegressionTree> forest = List.of();
    private int columns;

    public RandomForestRegressor(int trees, int maxDepth, int minSamplesSplit, long seed) {
        if (trees < 1)
            throw new IllegalArgumentException("trees must be >= 1");
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be >= 1");
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.minSamplesSplit = Math.max(2, minSamplesSplit);
        this.seed = seed;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void fit(double[][] x, double[] y) {
        if (x.length == 0 || x.length != y.length)
            throw new IllegalArgumentException("x and y must be non-empty and the same length");
        int cols = x[0].length;
        int[][] presorted = RegressionTree.presort(x);
        RegressionTree.Params params = new RegressionTree.Params(maxDepth, minSamplesSplit, 1,
                Math.max(1, cols / 3));

        RegressionTree[] grown = new RegressionTree[trees];
        IntStream.range(0, trees).parallel().forEach(t -> {
            Random rnd = new Random(seed * 31 + t);
            double[] w = new double[x.length];
            for (int i = 0; i < x.length; i++)
                w[rnd.nextInt(x.length)] += 1;
            grown[t] = RegressionTree.grow(x, y, w, presorted, params, rnd);
        });
        this.forest = List.of(grown);
        this.columns = cols;
    }

    @Override
    public boolean isFitted() {
        return !forest.isEmpty();
    }

    @Override
    public double predict(double[] x) {
        if (forest.isEmpty())
            throw new IllegalStateException("forest not fitted");
        double sum = 0;
        for (RegressionTree t : forest)
            sum += t.predict(x);
        return sum / forest.size();
    }

    @Override
    public double[] featureImportance() {
        return averageImportance(forest, columns);
    }

    static double[] averageImportance(List<RegressionTree> trees, int columns) {
        double[] out = new double[columns];
        for (RegressionTree t : trees) {
            double[] imp = t.featureImportance();
            for (int i = 0; i < columns && i < imp.length; i++)
                out[i] += imp[i];
        }
        double total = 0;
        for (double v : out)
            total += v;
        if (total > 0) {
            for (int i = 0; i < out.length; i++)
                out[i] /= total;
        }
        return out;
    }

    public int treeCount() {
        return forest.size();
    }

    @Override
    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode n = om.createObjectNode();
        n.put("type", TYPE);
        ObjectNode p = n.putObject("params");
        p.put("trees", trees);
        p.put("max_depth", maxDepth);
        p.put("min_samples_split", minSamplesSplit);
        p.put("seed", seed);
        n.put("columns", columns);
        ArrayNode arr = n.putArray("trees");
        for (RegressionTree t : forest)
            arr.add(t.toJson(om));
        return n;
    }

    static RandomForestRegressor fromJson(JsonNode n) {
        JsonNode p = n.path("params");
        RandomForestRegressor rf = new RandomForestRegressor(
                p.path("trees").asInt(1),
                p.path("max_depth").asInt(1),
                p.path("min_samples_split").asInt(2),
                p.path("seed").asLong());
        List<RegressionTree> list = new ArrayList<>();
        for (JsonNode t : n.path("trees"))
            list.add(RegressionTree.fromJson(t));
        if (list.isEmpty())
            throw new IllegalArgumentException("random forest has no trees");
        rf.forest = List.copyOf(list);
        rf.columns = n.path("columns").asInt();
        return rf;
    }
}
