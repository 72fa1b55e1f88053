package authcore.support;

import authcore.db.ConnectionPool;
import authcore.db.JdbcMigrationHandler;
import authcore.repos.Schema;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.UUID;

/**
 * H2-In-Memory-Datenbank im PostgreSQL-Modus für Integrationstests
 *
 * Jeder Aufruf liefert eine eigene, leere Datenbank
 */
public final class TestDatabase {

    private TestDatabase() {}

    public static String newUrl() {
        return "jdbc:h2:mem:auth-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
    }

    public static ConnectionPool newPool(String url, int size) {
        return new ConnectionPool(size, () -> DriverManager.getConnection(url, "sa", ""));
    }

    // Pool + angewendetes Schema (credentials, tokens)
    public static ConnectionPool migratedPool(int size) throws SQLException {
        var pool = newPool(newUrl(), size);
        new JdbcMigrationHandler().register(Schema.TABLES).migrate(pool);
        return pool;
    }
}
