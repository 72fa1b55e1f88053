package authcore.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;

/**
 * Datenbank-Verbindungsparameter
 * 
 * Verwendet JDBC für PostgreSQL-Verbindung (Docker Container auf localhost:5432)
 * Verbindungen werden nicht direkt geöffnet, sondern über den ConnectionPool verteilt
 */
public class Db {
    private static final String DEFAULT_URL = "jdbc:postgresql://localhost:5432/auth";
    private static final String DEFAULT_USER = "auth";
    private static final String DEFAULT_PASSWORD = "auth";
    private static final int DEFAULT_POOL_SIZE = 4;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;

    public Db(String url, String user, String password, int poolSize) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url required");
        if (poolSize < 1) throw new IllegalArgumentException("pool size must be positive");
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
    }

    // Liest DB_URL, DB_USER, DB_PASSWORD und DB_POOL_SIZE, fehlende Werte fallen auf lokale Defaults zurück
    public static Db fromEnvironment(Map<String, String> env) {
        return new Db(
                env.getOrDefault("DB_URL", DEFAULT_URL),
                env.getOrDefault("DB_USER", DEFAULT_USER),
                env.getOrDefault("DB_PASSWORD", DEFAULT_PASSWORD),
                Integer.parseInt(env.getOrDefault("DB_POOL_SIZE", String.valueOf(DEFAULT_POOL_SIZE)))
        );
    }

    /**
     * Öffnet eine neue Datenbank-Verbindung
     * 
     * Wird vom ConnectionPool als Factory verwendet
     */
    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public String url() { return url; }
    public int poolSize() { return poolSize; }
}
