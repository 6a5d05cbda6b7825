package space.ketterling.congestion.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.forecast.ObservationSource;
import space.ketterling.congestion.model.Observation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for ingested traffic observations ({@code traffic_data}).
 */
public class ObservationRepo implements ObservationSource {
    private static final Logger log = LoggerFactory.getLogger(ObservationRepo.class);

    private static final String COLUMNS = "location_id, lat, lon, ts, congestion_level, average_speed, "
            + "vehicle_count, temperature, precipitation, visibility, incident_reported, event_nearby, is_holiday";

    private final HikariDataSource ds;

    /**
     * Creates a repo and ensures the table exists.
     */
    public ObservationRepo(HikariDataSource ds) {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() {
        String sql = """
                CREATE TABLE IF NOT EXISTS traffic_data (
                    id BIGSERIAL PRIMARY KEY,
                    location_id TEXT NOT NULL,
                    lat DOUBLE PRECISION NOT NULL,
                    lon DOUBLE PRECISION NOT NULL,
                    ts TIMESTAMPTZ NOT NULL,
                    congestion_level INTEGER,
                    average_speed DOUBLE PRECISION,
                    vehicle_count INTEGER,
                    temperature DOUBLE PRECISION,
                    precipitation DOUBLE PRECISION,
                    visibility DOUBLE PRECISION,
                    incident_reported BOOLEAN,
                    event_nearby BOOLEAN,
                    is_holiday BOOLEAN,
                    UNIQUE(location_id, ts)
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        } catch (Exception e) {
            log.warn("Could not ensure traffic_data table: {}", e.getMessage());
        }
    }

    @Override
    public Optional<Observation> latest(String locationId) throws Exception {
        List<Observation> one = recent(locationId, 1);
        return one.isEmpty() ? Optional.empty() : Optional.of(one.get(0));
    }

    @Override
    public List<Observation> recent(String locationId, int count) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM traffic_data WHERE location_id = ? ORDER BY ts DESC LIMIT ?";
        List<Observation> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            ps.setInt(2, Math.max(1, count));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    @Override
    public List<Observation> between(Instant from, Instant to) throws Exception {
        String sql = "SELECT " + COLUMNS + " FROM traffic_data WHERE ts >= ? AND ts < ? ORDER BY location_id, ts";
        List<Observation> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(from));
            ps.setTimestamp(2, Timestamp.from(to));
            ps.setFetchSize(5_000);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Inserts an observation, replacing any earlier row for the same
     * location and timestamp.
     */
    public void upsert(Observation o) throws Exception {
        String sql = "INSERT INTO traffic_data (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (location_id, ts) DO UPDATE SET "
                + "congestion_level=EXCLUDED.congestion_level, average_speed=EXCLUDED.average_speed, "
                + "vehicle_count=EXCLUDED.vehicle_count, temperature=EXCLUDED.temperature, "
                + "precipitation=EXCLUDED.precipitation, visibility=EXCLUDED.visibility, "
                + "incident_reported=EXCLUDED.incident_reported, event_nearby=EXCLUDED.event_nearby, "
                + "is_holiday=EXCLUDED.is_holiday";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, o.locationId());
            ps.setDouble(2, o.lat());
            ps.setDouble(3, o.lon());
            ps.setTimestamp(4, Timestamp.from(o.timestamp()));
            setInt(ps, 5, o.congestionLevel());
            LocationRepo.setDouble(ps, 6, o.averageSpeed());
            setInt(ps, 7, o.vehicleCount());
            LocationRepo.setDouble(ps, 8, o.temperature());
            LocationRepo.setDouble(ps, 9, o.precipitation());
            LocationRepo.setDouble(ps, 10, o.visibility());
            setBool(ps, 11, o.incidentReported());
            setBool(ps, 12, o.eventNearby());
            setBool(ps, 13, o.holiday());
            ps.executeUpdate();
        }
    }

    private static Observation map(ResultSet rs) throws Exception {
        return new Observation(
                rs.getString("location_id"),
                rs.getDouble("lat"),
                rs.getDouble("lon"),
                rs.getTimestamp("ts").toInstant(),
                (Integer) rs.getObject("congestion_level"),
                (Double) rs.getObject("average_speed"),
                (Integer) rs.getObject("vehicle_count"),
                (Double) rs.getObject("temperature"),
                (Double) rs.getObject("precipitation"),
                (Double) rs.getObject("visibility"),
                (Boolean) rs.getObject("incident_reported"),
                (Boolean) rs.getObject("event_nearby"),
                (Boolean) rs.getObject("is_holiday"));
    }

    private static void setInt(PreparedStatement ps, int idx, Integer v) throws Exception {
        if (v == null)
            ps.setNull(idx, Types.INTEGER);
        else
            ps.setInt(idx, v);
    }

    private static void setBool(PreparedStatement ps, int idx, Boolean v) throws Exception {
        if (v == null)
            ps.setNull(idx, Types.BOOLEAN);
        else
            ps.setBoolean(idx, v);
    }
}
