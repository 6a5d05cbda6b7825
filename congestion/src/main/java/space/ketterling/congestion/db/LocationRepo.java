package space.ketterling.congestion.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.congestion.forecast.LocationLookup;
import space.ketterling.congestion.model.Location;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for monitored locations.
 */
public class LocationRepo implements LocationLookup {
    private static final Logger log = LoggerFactory.getLogger(LocationRepo.class);

    private final HikariDataSource ds;

    /**
     * Creates a repo and ensures the table exists.
     */
    public LocationRepo(HikariDataSource ds) {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() {
        String sql = """
                CREATE TABLE IF NOT EXISTS location (
                    id TEXT PRIMARY KEY,
                    name TEXT,
                    lat DOUBLE PRECISION,
                    lon DOUBLE PRECISION,
                    created_at TIMESTAMPTZ DEFAULT now()
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        } catch (Exception e) {
            log.warn("Could not ensure location table: {}", e.getMessage());
        }
    }

    @Override
    public Optional<Location> find(String locationId) throws Exception {
        String sql = "SELECT id, name, lat, lon FROM location WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public List<Location> list() throws Exception {
        String sql = "SELECT id, name, lat, lon FROM location ORDER BY id";
        List<Location> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(map(rs));
        }
        return out;
    }

    public void upsert(Location l) throws Exception {
        String sql = """
                INSERT INTO location (id, name, lat, lon)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name, lat = EXCLUDED.lat, lon = EXCLUDED.lon
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, l.id());
            ps.setString(2, l.name());
            setDouble(ps, 3, l.latitude());
            setDouble(ps, 4, l.longitude());
            ps.executeUpdate();
        }
    }

    private static Location map(ResultSet rs) throws Exception {
        return new Location(
                rs.getString("id"),
                rs.getString("name"),
                (Double) rs.getObject("lat"),
                (Double) rs.getObject("lon"));
    }

    static void setDouble(PreparedStatement ps, int idx, Double v) throws Exception {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }
}
