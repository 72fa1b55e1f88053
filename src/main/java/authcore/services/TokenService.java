package authcore.services;

import authcore.db.ConnectionPool;
import authcore.models.Principal;
import authcore.repos.TokenRepository;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * Service für Token-Verwaltung
 *
 * Tokens sind Base64-kodierte Zufallsbytes. Die Validierung fragt zuerst den
 * TokenCache und greift nur bei einem Cache-Miss auf die Datenbank zu.
 */
public class TokenService {
    private final ConnectionPool pool;
    private final TokenRepository repo;
    private final TokenCache cache;
    private final AuthSettings settings;
    private final SecureRandom random;
    private final Clock clock;

    public TokenService(ConnectionPool pool, TokenRepository repo, TokenCache cache,
                        AuthSettings settings, SecureRandom random, Clock clock) {
        this.pool = pool;
        this.repo = repo;
        this.cache = cache;
        this.settings = settings;
        this.random = random;
        this.clock = clock;
    }

    // Erstellt ein neues Token auf der übergebenen Verbindung (läuft in der Login-Transaktion)
    public String issue(Connection conn, Principal principal) throws SQLException {
        String token = newToken();
        long expiry = clock.millis() + settings.tokenLifetime().toMillis();
        repo.create(conn, token, principal.username(), expiry);
        cache.store(token, principal, expiry);
        return token;
    }

    // Löscht das Token in der Datenbank. Der Cache-Eintrag bleibt bis zum Ablauf seiner TTL bestehen
    public void revoke(String token) throws SQLException {
        if (token == null) return;
        pool.useTransaction(conn -> repo.delete(conn, token));
    }

    /**
     * Validiert ein Token: Cache-Treffer innerhalb der TTL ohne DB-Zugriff,
     * sonst Abfrage mit expiry > now und Auffrischen des Caches
     *
     * Gibt Optional.empty() bei fehlendem, unbekanntem oder abgelaufenem Token zurück.
     * Datenbankfehler werden als SQLException weitergegeben.
     */
    public Optional<Principal> verify(String token) throws SQLException {
        if (token == null) return Optional.empty();

        var cached = cache.lookup(token);
        if (cached.isPresent()) return cached;

        var row = pool.use(conn -> repo.findValid(conn, token, clock.millis()));
        row.ifPresent(r -> cache.store(token, r.principal(), r.expiry()));
        return row.map(TokenRepository.TokenRow::principal);
    }

    private String newToken() {
        byte[] bytes = new byte[settings.tokenLength()];
        random.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }
}
