package space.ketterling.congestion.db;

import space.ketterling.congestion.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    /**
     * Utility class; no instances.
     */
    private Database() {
    }

    /**
     * Builds a connection pool for API requests.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg, "api", cfg.dbApiPoolMax());
    }

    /**
     * Builds a connection pool for training and other background jobs.
     */
    public static HikariDataSource createJobDataSource(AppConfig cfg) {
        return createDataSource(cfg, "job", cfg.dbJobPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    private static HikariDataSource createDataSource(AppConfig cfg, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("congestion-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
