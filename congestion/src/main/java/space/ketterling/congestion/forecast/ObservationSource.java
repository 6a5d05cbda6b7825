package space.ketterling.congestion.forecast;

import space.ketterling.congestion.model.Observation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to ingested observations.
 */
public interface ObservationSource {

    Optional<Observation> latest(String locationId) throws Exception;

    /**
     * Up to {@code count} observations for the location, most recent first.
     */
    List<Observation> recent(String locationId, int count) throws Exception;

    /**
     * Every observation with {@code from <= timestamp < to}, ordered by
     * location and then oldest first.
     */
    List<Observation> between(Instant from, Instant to) throws Exception;
}
