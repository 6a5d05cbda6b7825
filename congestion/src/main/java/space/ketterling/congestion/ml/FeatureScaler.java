package space.ketterling.congestion.ml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Standardizes each column to zero mean and unit variance.
 *
 * <p>
 * Parameters are frozen at fit time. A constant column gets a scale of 1.
 * </p>
 */
public final class FeatureScaler {
    private final double[] mean;
    private final double[] std;

    private FeatureScaler(double[] mean, double[] std) {
        this.mean = mean;
        this.std = std;
    }

    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0)
            throw new IllegalArgumentException("cannot fit scaler on no rows");
        int cols = rows[0].length;
        double[] mean = new double[cols];
        double[] std = new double[cols];
        for (double[] r : rows)
            for (int c = 0; c < cols; c++)
                mean[c] += r[c];
        for (int c = 0; c < cols; c++)
            mean[c] /= rows.length;
        for (double[] r : rows)
            for (int c = 0; c < cols; c++) {
                double d = r[c] - mean[c];
                std[c] += d * d;
            }
        for (int c = 0; c < cols; c++) {
            double s = Math.sqrt(std[c] / rows.length);
            std[c] = s < 1e-12 ? 1.0 : s;
        }
        return new FeatureScaler(mean, std);
    }

    public int size() {
        return mean.length;
    }

    public double[] transform(double[] row) {
        if (row.length != mean.length)
            throw new IllegalArgumentException("row has " + row.length + " columns, scaler expects " + mean.length);
        double[] out = new double[row.length];
        for (int c = 0; c < row.length; c++)
            out[c] = (row[c] - mean[c]) / std[c];
        return out;
    }

    public double[][] transformAll(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++)
            out[i] = transform(rows[i]);
        return out;
    }

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode n = om.createObjectNode();
        ArrayNode m = n.putArray("mean");
        ArrayNode s = n.putArray("std");
        for (int c = 0; c < mean.length; c++) {
            m.add(mean[c]);
            s.add(std[c]);
        }
        return n;
    }

    public static FeatureScaler fromJson(JsonNode n) {
        JsonNode m = n.path("mean");
        JsonNode s = n.path("std");
        if (m.size() == 0 || m.size() != s.size())
            throw new IllegalArgumentException("scaler mean/std missing or mismatched");
        double[] mean = new double[m.size()];
        double[] std = new double[s.size()];
        for (int i = 0; i < mean.length; i++) {
            mean[i] = m.get(i).asDouble();
            std[i] = s.get(i).asDouble();
            if (!(std[i] > 0))
                throw new IllegalArgumentException("scaler std must be positive");
        }
        return new FeatureScaler(mean, std);
    }
}
