package authcore.services;

import authcore.db.ConnectionPool;
import authcore.models.LoginResponse;
import authcore.models.Principal;
import authcore.models.PrincipalRole;
import authcore.repos.CredentialRepository;
import authcore.repos.CredentialRepository.CredentialRow;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Service für Authentifizierung und Autorisierung
 *
 * Einstiegspunkt für die RPC-/HTTP-Handler: createUser, login, logout,
 * validateToken und verifyUser.
 */
public class AuthService {
    private static final Set<PrincipalRole> ALL_ROLES = EnumSet.allOf(PrincipalRole.class);

    private final ConnectionPool pool;
    private final CredentialRepository credentials;
    private final PasswordHasher hasher;
    private final TokenService tokens;
    private final byte[] dummySalt;

    public AuthService(ConnectionPool pool, CredentialRepository credentials,
                       PasswordHasher hasher, TokenService tokens) {
        this.pool = pool;
        this.credentials = credentials;
        this.hasher = hasher;
        this.tokens = tokens;
        this.dummySalt = hasher.newSalt();
    }

    // Registrierung: speichert abgeleiteten Schlüssel + Salt. Existiert der Username bereits,
    // schlägt das INSERT am Primary Key fehl (SQLException) und der alte Eintrag bleibt unverändert
    public void createUser(PrincipalRole role, String username, String password) throws SQLException {
        if (role == null) throw new IllegalArgumentException("role required");
        if (username == null || username.isBlank()) throw new IllegalArgumentException("username required");
        if (password == null) throw new IllegalArgumentException("password required");

        var hashed = hasher.hash(password.toCharArray());
        var row = new CredentialRow(username, role, hashed.key(), hashed.salt());
        pool.useTransaction(conn -> {
            credentials.create(conn, row);
            return null;
        });
    }

    /**
     * Login: prüft Credentials und stellt bei Erfolg ein neues Token aus
     *
     * Unbekannter User und falsches Passwort liefern beide Optional.empty(),
     * damit Usernamen nicht ausgespäht werden können.
     */
    public Optional<LoginResponse> login(String username, String password) throws SQLException {
        if (username == null || password == null) return Optional.empty();

        // Schlüsselableitung läuft ohne geliehene Connection, damit langsame Logins den Pool nicht blockieren
        var row = pool.use(conn -> credentials.findByUsername(conn, username));
        if (row.isEmpty()) {
            // gleicher Aufwand wie bei falschem Passwort
            hasher.hash(password.toCharArray(), dummySalt);
            return Optional.empty();
        }

        var credential = row.get();
        if (!hasher.matches(password.toCharArray(), credential.passwordHash(), credential.salt())) {
            return Optional.empty();
        }

        var principal = credential.principal();
        String token = pool.useTransaction(conn -> tokens.issue(conn, principal));
        return Optional.of(new LoginResponse(principal, token));
    }

    // Logout: idempotent, unbekannte Tokens sind kein Fehler
    public void logout(String token) throws SQLException {
        tokens.revoke(token);
    }

    public Optional<Principal> validateToken(String token) throws SQLException {
        return tokens.verify(token);
    }

    // Autorisierung mit allen Rollen (USER und ADMIN)
    public Principal verifyUser(String token) throws SQLException {
        return verifyUser(token, ALL_ROLES);
    }

    /**
     * Einziges Autorisierungs-Gate für die Handler
     *
     * @throws UnauthorizedException wenn kein gültiges Token vorliegt
     * @throws ForbiddenException wenn die Rolle nicht in allowedRoles enthalten ist
     * @throws IllegalArgumentException wenn allowedRoles null ist
     */
    public Principal verifyUser(String token, Set<PrincipalRole> allowedRoles) throws SQLException {
        if (allowedRoles == null) throw new IllegalArgumentException("allowed roles required");
        var principal = validateToken(token).orElseThrow(UnauthorizedException::new);
        if (!allowedRoles.contains(principal.role())) throw new ForbiddenException();
        return principal;
    }
}
