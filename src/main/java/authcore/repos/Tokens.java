package authcore.repos;

import authcore.db.MigrationHandler;
import authcore.db.SqlTable;

/**
 * Tabelle tokens: aktive Sessions
 *
 * Ein User kann mehrere gültige Tokens haben (mehrere Geräte).
 * expiry wird als Epoch-Millis gespeichert. Abgelaufene Zeilen werden nicht gelöscht.
 */
public final class Tokens extends SqlTable {
    public static final Column TOKEN = new Column("token", "VARCHAR(256)");
    public static final Column USERNAME = new Column("username", "VARCHAR(256)");
    public static final Column EXPIRY = new Column("expiry", "BIGINT");

    public static final Tokens TABLE = new Tokens();

    private Tokens() {
        super("tokens", TOKEN, USERNAME, EXPIRY);
    }

    @Override
    public void migration(MigrationHandler handler) {
        handler.addScript("tokens: initial table", conn -> {
            try (var st = conn.createStatement()) {
                st.executeUpdate("""
                    CREATE TABLE tokens(
                        token VARCHAR(256) NOT NULL,
                        username VARCHAR(256) NOT NULL,
                        expiry BIGINT NOT NULL,
                        PRIMARY KEY (token),
                        FOREIGN KEY (username) REFERENCES credentials(username)
                    )
                    """);
            }
        });
    }
}
