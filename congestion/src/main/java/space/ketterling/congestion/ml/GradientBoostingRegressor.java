package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Least-squares gradient boosting with shallow trees. The "reactive" half of
 * the ensemble.
 */
public final class GradientBoostingRegressor implements Regressor {
    public static final String TYPE = "gradient_boosting";

    private final int trees;
    private final int maxDepth;
    private final double learningRate;
    private final int minSamplesSplit;
    private final long seed;

    private double init;
    private List<RegressionTree> stages = List.of();
    private int columns;

    public GradientBoostingRegressor(int trees, int maxDepth, double learningRate, int minSamplesSplit, long seed) {
        if (trees < 1)
            throw new IllegalArgumentException("trees must be >= 1");
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be >= 1");
        if (!(learningRate > 0 && learningRate <= 1))
            throw new IllegalArgumentException("learningRate must be in (0, 1]");
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.learningRate = learningRate;
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
        RegressionTree.Params params = new RegressionTree.Params(maxDepth, minSamplesSplit, 1, cols);

        double mean = Arrays.stream(y).average().orElse(0);
        double[] current = new double[y.length];
        Arrays.fill(current, mean);
        double[] w = new double[y.length];
        Arrays.fill(w, 1.0);
        double[] residual = new double[y.length];
        Random rnd = new Random(seed);

        List<RegressionTree> fitted = new ArrayList<>(trees);
        for (int s = 0; s < trees; s++) {
            for (int i = 0; i < y.length; i++)
                residual[i] = y[i] - current[i];
            RegressionTree t = RegressionTree.grow(x, residual, w, presorted, params, rnd);
            for (int i = 0; i < y.length; i++)
                current[i] += learningRate * t.predict(x[i]);
            fitted.add(t);
        }
        this.init = mean;
        this.stages = List.copyOf(fitted);
        this.columns = cols;
    }

    @Override
    public boolean isFitted() {
        return !stages.isEmpty();
    }

    @Override
    public double predict(double[] x) {
        if (stages.isEmpty())
            throw new IllegalStateException("boosting model not fitted");
        double out = init;
        for (RegressionTree t : stages)
            out += learningRate * t.predict(x);
        return out;
    }

    @Override
    public double[] featureImportance() {
        return RandomForestRegressor.averageImportance(stages, columns);
    }

    @Override
    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode n = om.createObjectNode();
        n.put("type", TYPE);
        ObjectNode p = n.putObject("params");
        p.put("trees", trees);
        p.put("max_depth", maxDepth);
        p.put("learning_rate", learningRate);
        p.put("min_samples_split", minSamplesSplit);
        p.put("seed", seed);
        n.put("columns", columns);
        n.put("init", init);
        ArrayNode arr = n.putArray("trees");
        for (RegressionTree t : stages)
            arr.add(t.toJson(om));
        return n;
    }

    static GradientBoostingRegressor fromJson(JsonNode n) {
        JsonNode p = n.path("params");
        GradientBoostingRegressor gb = new GradientBoostingRegressor(
                p.path("trees").asInt(1),
                p.path("max_depth").asInt(1),
                p.path("learning_rate").asDouble(0.1),
                p.path("min_samples_split").asInt(2),
                p.path("seed").asLong());
        List<RegressionTree> list = new ArrayList<>();
        for (JsonNode t : n.path("trees"))
            list.add(RegressionTree.fromJson(t));
        if (list.isEmpty())
            throw new IllegalArgumentException("boosting model has no trees");
        gb.stages = List.copyOf(list);
        gb.init = n.path("init").asDouble();
        gb.columns = n.path("columns").asInt();
        return gb;
    }
}
