package space.ketterling.congestion.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All forecast points computed for one location at one as-of instant.
 *
 * <p>
 * Points are kept sorted by ascending horizon. Horizons that could not be
 * computed are listed in {@link #failures()}, which lets a caller tell a
 * partial answer apart from an empty one. {@link #modelVersion()} names the
 * model snapshot the points were scored with, or is {@code null} when none
 * was loaded.
 * </p>
 */
public record ForecastSet(
        String locationId,
        Instant asOf,
        List<Integer> requestedHorizons,
        List<ForecastPoint> points,
        List<HorizonFailure> failures,
        String modelVersion) {

    public ForecastSet(String locationId, Instant asOf, List<Integer> requestedHorizons,
            List<ForecastPoint> points, List<HorizonFailure> failures) {
        this(locationId, asOf, requestedHorizons, points, failures, null);
    }

    public ForecastSet {
        requestedHorizons = List.copyOf(requestedHorizons);
        List<ForecastPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingInt(ForecastPoint::horizonHours));
        points = List.copyOf(sorted);
        List<HorizonFailure> sortedFailures = new ArrayList<>(failures);
        sortedFailures.sort(Comparator.comparingInt(HorizonFailure::horizonHours));
        failures = List.copyOf(sortedFailures);
    }

    /**
     * The cache bucket this set belongs to: as-of truncated to the hour.
     */
    public Instant hourBucket() {
        return asOf.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * True when no horizon produced a point.
     */
    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * True when some, but not all, requested horizons produced a point.
     */
    public boolean isPartial() {
        return !points.isEmpty() && !failures.isEmpty();
    }

    public boolean isComplete() {
        return failures.isEmpty() && points.size() == requestedHorizons.size();
    }

    /**
     * Whether this set was computed for every horizon in {@code horizons}.
     */
    public boolean covers(Collection<Integer> horizons) {
        return new HashSet<>(requestedHorizons).containsAll(horizons);
    }

    /**
     * Narrows the set to the given horizons, keeping points and failures that
     * belong to them.
     */
    public ForecastSet select(Collection<Integer> horizons) {
        Set<Integer> wanted = new HashSet<>(horizons);
        List<ForecastPoint> keptPoints = points.stream()
                .filter(p -> wanted.contains(p.horizonHours()))
                .toList();
        List<HorizonFailure> keptFailures = failures.stream()
                .filter(f -> wanted.contains(f.horizonHours()))
                .toList();
        List<Integer> keptRequested = requestedHorizons.stream()
                .filter(wanted::contains)
                .toList();
        return new ForecastSet(locationId, asOf, keptRequested, keptPoints, keptFailures, modelVersion);
    }
}
