package space.ketterling.congestion.training;

/**
 * Produces the rows a model is trained on.
 */
public interface TrainingDataSource {

    /**
     * Short name recorded with the trained model, e.g. {@code synthetic}.
     */
    String name();

    TrainingData load() throws Exception;
}
