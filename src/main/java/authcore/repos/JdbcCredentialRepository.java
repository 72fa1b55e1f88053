package authcore.repos;

import static authcore.repos.Credentials.*;

import authcore.models.PrincipalRole;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC-Implementierung des CredentialRepository Interfaces
 *
 * Verwendet PreparedStatements für SQL-Injection-Schutz
 */
public class JdbcCredentialRepository implements CredentialRepository {

    @Override
    public void create(Connection conn, CredentialRow row) throws SQLException {
        String sql = "INSERT INTO " + TABLE + "(" + USERNAME + ", " + ROLE + ", " + PASSWORD_HASH + ", " + SALT
                + ") VALUES (?, ?, ?, ?)";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, row.username());
            ps.setString(2, row.role().name());
            ps.setBytes(3, row.passwordHash());
            ps.setBytes(4, row.salt());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<CredentialRow> findByUsername(Connection conn, String username) throws SQLException {
        String sql = "SELECT " + USERNAME + ", " + ROLE + ", " + PASSWORD_HASH + ", " + SALT
                + " FROM " + TABLE + " WHERE " + USERNAME + " = ?";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, username);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private CredentialRow mapRow(ResultSet rs) throws SQLException {
        return new CredentialRow(
                rs.getString(1),
                PrincipalRole.valueOf(rs.getString(2)),
                rs.getBytes(3),
                rs.getBytes(4)
        );
    }
}
