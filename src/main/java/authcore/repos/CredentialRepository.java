package authcore.repos;

import authcore.models.Principal;
import authcore.models.PrincipalRole;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Repository Interface für Credential-Operationen
 *
 * Arbeitet auf einer vom Aufrufer ausgeliehenen Verbindung, damit mehrere Statements
 * in einer Transaktion laufen können
 */
public interface CredentialRepository {
    // Legt einen neuen Eintrag an; ein bereits vorhandener Username verletzt den Primary Key (SQLException)
    void create(Connection conn, CredentialRow row) throws SQLException;

    // Findet Credential anhand des Benutzernamens (für Login verwendet)
    Optional<CredentialRow> findByUsername(Connection conn, String username) throws SQLException;

    record CredentialRow(String username, PrincipalRole role, byte[] passwordHash, byte[] salt) {
        public Principal principal() {
            return new Principal(username, role);
        }
    }
}
