package authcore.db;

import java.util.List;

/**
 * Basisklasse für Tabellendefinitionen
 *
 * Jede Tabelle deklariert ihre Spalten und registriert ihre Erstellungs-Skripte
 * beim MigrationHandler. Skripte werden pro Name genau einmal ausgeführt.
 */
public abstract class SqlTable {
    private final String name;
    private final List<Column> columns;

    protected SqlTable(String name, Column... columns) {
        this.name = name;
        this.columns = List.of(columns);
    }

    public String name() { return name; }

    public List<Column> columns() { return columns; }

    // Registriert die benannten Skripte dieser Tabelle in Deklarationsreihenfolge
    public abstract void migration(MigrationHandler handler);

    @Override
    public String toString() { return name; }

    /**
     * Spaltendeklaration (Name + SQL-Typ). toString() liefert den Spaltennamen,
     * damit Spalten direkt in SQL-Strings eingesetzt werden können.
     */
    public record Column(String name, String type) {
        @Override
        public String toString() { return name; }
    }
}
