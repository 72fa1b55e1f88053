package authcore.repos;

import authcore.db.MigrationHandler;
import authcore.db.SqlTable;

/**
 * Tabelle credentials: ein Eintrag pro Principal
 *
 * username ist der einzige Schlüssel (keine numerische ID). Gespeichert werden nur
 * der abgeleitete Schlüssel und das Salt, nie das Passwort im Klartext.
 */
public final class Credentials extends SqlTable {
    public static final Column USERNAME = new Column("username", "VARCHAR(256)");
    public static final Column ROLE = new Column("principal_role", "VARCHAR(64)");
    public static final Column PASSWORD_HASH = new Column("password_hash", "BYTEA");
    public static final Column SALT = new Column("salt", "BYTEA");

    // Muss nach den Spalten stehen (statische Initialisierungsreihenfolge)
    public static final Credentials TABLE = new Credentials();

    private Credentials() {
        super("credentials", USERNAME, ROLE, PASSWORD_HASH, SALT);
    }

    @Override
    public void migration(MigrationHandler handler) {
        handler.addScript("credentials: initial table", conn -> {
            try (var st = conn.createStatement()) {
                st.executeUpdate("""
                    CREATE TABLE credentials(
                        username VARCHAR(256) NOT NULL,
                        principal_role VARCHAR(64) NOT NULL,
                        password_hash BYTEA NOT NULL,
                        salt BYTEA NOT NULL,
                        PRIMARY KEY (username)
                    )
                    """);
            }
        });
    }
}
