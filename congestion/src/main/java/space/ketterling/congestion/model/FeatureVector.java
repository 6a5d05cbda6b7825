package space.ketterling.congestion.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, named numeric features for one prediction.
 */
public final class FeatureVector {
    private final List<String> names;
    private final double[] values;

    public FeatureVector(List<String> names, double[] values) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(values, "values");
        if (names.size() != values.length) {
            throw new IllegalArgumentException(
                    "names/values length mismatch: " + names.size() + " vs " + values.length);
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    /**
     * Vector in the current {@link FeatureSchema} ordering.
     */
    public static FeatureVector ofSchema(double[] values) {
        return new FeatureVector(FeatureSchema.NAMES, values);
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String name) {
        int idx = names.indexOf(name);
        if (idx < 0)
            throw new IllegalArgumentException("unknown feature: " + name);
        return values[idx];
    }

    /**
     * Copy of the raw values.
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector other))
            return false;
        return names.equals(other.names) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FeatureVector{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(names.get(i)).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
