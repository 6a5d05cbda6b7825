package space.ketterling.congestion.training;

import space.ketterling.congestion.ml.TrainedModel;
import space.ketterling.congestion.ml.TrainingMetrics;

public record TrainingResult(TrainedModel model, TrainingMetrics metrics) {
}
