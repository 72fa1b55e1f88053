package authcore.repos;

import authcore.models.Principal;
import authcore.models.PrincipalRole;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC-Implementierung des TokenRepository Interfaces
 *
 * Verwendet PreparedStatements für SQL-Injection-Schutz
 */
public class JdbcTokenRepository implements TokenRepository {

    @Override
    public void create(Connection conn, String token, String username, long expiry) throws SQLException {
        String sql = "INSERT INTO " + Tokens.TABLE + "(" + Tokens.TOKEN + ", " + Tokens.USERNAME + ", "
                + Tokens.EXPIRY + ") VALUES (?, ?, ?)";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, token);
            ps.setString(2, username);
            ps.setLong(3, expiry);
            ps.executeUpdate();
        }
    }

    // Join mit credentials, damit die Rolle direkt mitgeliefert wird
    @Override
    public Optional<TokenRow> findValid(Connection conn, String token, long now) throws SQLException {
        String sql = """
            SELECT c.%s, c.%s, t.%s
            FROM %s t
            JOIN %s c ON c.%s = t.%s
            WHERE t.%s = ? AND t.%s > ?
            """.formatted(
                Credentials.USERNAME, Credentials.ROLE, Tokens.EXPIRY,
                Tokens.TABLE, Credentials.TABLE, Credentials.USERNAME, Tokens.USERNAME,
                Tokens.TOKEN, Tokens.EXPIRY);
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, token);
            ps.setLong(2, now);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                var principal = new Principal(rs.getString(1), PrincipalRole.valueOf(rs.getString(2)));
                return Optional.of(new TokenRow(token, principal, rs.getLong(3)));
            }
        }
    }

    @Override
    public int delete(Connection conn, String token) throws SQLException {
        String sql = "DELETE FROM " + Tokens.TABLE + " WHERE " + Tokens.TOKEN + " = ?";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, token);
            return ps.executeUpdate();
        }
    }
}
