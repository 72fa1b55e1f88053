package authcore.repos;

import authcore.db.SqlTable;
import java.util.List;

/**
 * Alle Tabellen in Deklarationsreihenfolge (credentials vor tokens wegen Foreign Key)
 */
public final class Schema {
    public static final List<SqlTable> TABLES = List.of(Credentials.TABLE, Tokens.TABLE);

    private Schema() {}
}
