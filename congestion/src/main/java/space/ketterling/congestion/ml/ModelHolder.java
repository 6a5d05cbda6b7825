package space.ketterling.congestion.ml;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently served model. A swap is a single reference write, so a
 * reader sees either the old model or the new one, never a mix.
 */
public final class ModelHolder {
    private final AtomicReference<TrainedModel> current = new AtomicReference<>();

    public ModelHolder() {
    }

    public ModelHolder(TrainedModel initial) {
        current.set(initial);
    }

    public Optional<TrainedModel> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isLoaded() {
        TrainedModel m = current.get();
        return m != null && m.isComplete();
    }

    /**
     * Installs {@code next} and returns the model it replaced, if any.
     */
    public TrainedModel swap(TrainedModel next) {
        if (next == null || !next.isComplete())
            throw new IllegalArgumentException("refusing to install an incomplete model");
        return current.getAndSet(next);
    }
}
