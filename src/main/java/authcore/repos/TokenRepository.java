package authcore.repos;

import authcore.models.Principal;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Repository Interface für Token-Operationen
 */
public interface TokenRepository {
    // Speichert ein neues Token; username muss in credentials existieren (Foreign Key)
    void create(Connection conn, String token, String username, long expiry) throws SQLException;

    // Liefert Principal + Ablaufzeit, wenn das Token existiert und expiry > now
    Optional<TokenRow> findValid(Connection conn, String token, long now) throws SQLException;

    // Löscht das Token; gibt die Anzahl gelöschter Zeilen zurück (0 ist kein Fehler)
    int delete(Connection conn, String token) throws SQLException;

    record TokenRow(String token, Principal principal, long expiry) {}
}
