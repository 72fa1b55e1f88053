package authcore.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC-Implementierung des MigrationHandler Interfaces
 *
 * Merkt sich angewendete Skripte in der Tabelle schema_migrations. Jedes Skript läuft
 * zusammen mit seinem Eintrag in schema_migrations in einer eigenen Transaktion.
 */
public class JdbcMigrationHandler implements MigrationHandler {
    private static final String MIGRATIONS_TABLE = "schema_migrations";

    private final Map<String, MigrationScript> scripts = new LinkedHashMap<>();

    @Override
    public void addScript(String name, MigrationScript script) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("script name required");
        if (scripts.putIfAbsent(name, script) != null) {
            throw new IllegalArgumentException("duplicate migration script: " + name);
        }
    }

    // Registriert die Skripte aller Tabellen (Reihenfolge der Liste = Ausführungsreihenfolge)
    public JdbcMigrationHandler register(List<? extends SqlTable> tables) {
        tables.forEach(table -> table.migration(this));
        return this;
    }

    /**
     * Wendet alle noch nicht ausgeführten Skripte an
     *
     * @return Anzahl der in diesem Lauf angewendeten Skripte
     */
    public int migrate(ConnectionPool pool) throws SQLException {
        pool.use(conn -> {
            try (var st = conn.createStatement()) {
                st.executeUpdate("CREATE TABLE IF NOT EXISTS " + MIGRATIONS_TABLE
                        + " (name VARCHAR(256) PRIMARY KEY, applied_at BIGINT NOT NULL)");
            }
            return null;
        });

        int applied = 0;
        for (var entry : scripts.entrySet()) {
            boolean ran = pool.useTransaction(conn -> applyOnce(conn, entry.getKey(), entry.getValue()));
            if (ran) {
                System.out.println("Migration angewendet: " + entry.getKey());
                applied++;
            }
        }
        return applied;
    }

    private boolean applyOnce(Connection conn, String name, MigrationScript script) throws SQLException {
        try (var ps = conn.prepareStatement("SELECT 1 FROM " + MIGRATIONS_TABLE + " WHERE name = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) return false;
            }
        }

        script.apply(conn);

        try (var ps = conn.prepareStatement("INSERT INTO " + MIGRATIONS_TABLE + "(name, applied_at) VALUES (?, ?)")) {
            ps.setString(1, name);
            ps.setLong(2, System.currentTimeMillis());
            ps.executeUpdate();
        }
        return true;
    }
}
