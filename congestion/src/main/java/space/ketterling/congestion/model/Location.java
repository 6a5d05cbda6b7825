package space.ketterling.congestion.model;

/**
 * A monitored road location.
 */
public record Location(String id, String name, Double latitude, Double longitude) {
}
