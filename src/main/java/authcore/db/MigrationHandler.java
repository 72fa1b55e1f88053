package authcore.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Sammelt benannte Migrations-Skripte
 *
 * Vertrag: jedes Skript wird über die gesamte Lebensdauer der Datenbank höchstens
 * einmal ausgeführt, in der Reihenfolge der Registrierung
 */
public interface MigrationHandler {

    @FunctionalInterface
    interface MigrationScript {
        void apply(Connection conn) throws SQLException;
    }

    void addScript(String name, MigrationScript script);
}
