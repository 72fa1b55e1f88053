package authcore.services;

import authcore.models.Principal;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-Memory-Cache für validierte Tokens
 *
 * Lesen und Schreiben laufen unter demselben Lock. Einträge werden nie explizit
 * entfernt: nach Ablauf der TTL ignoriert lookup() sie und die nächste Validierung
 * überschreibt sie. Nach einem Logout kann ein Token deshalb noch bis zu einer
 * TTL lang aus dem Cache bestätigt werden.
 */
public class TokenCache {
    private final Map<String, CachedToken> entries = new HashMap<>(); // guarded by this
    private final Duration ttl;
    private final Clock clock;

    public TokenCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    private record CachedToken(long expiresAt, Principal principal) {}

    // Liefert den Principal nur wenn now < cacheExpiry, sonst empty (Aufrufer fragt die Datenbank)
    public synchronized Optional<Principal> lookup(String token) {
        var cached = entries.get(token);
        if (cached == null || clock.millis() >= cached.expiresAt()) return Optional.empty();
        return Optional.of(cached.principal());
    }

    public synchronized void store(String token, Principal principal) {
        entries.put(token, new CachedToken(clock.millis() + ttl.toMillis(), principal));
    }

    // Wie store(), aber der Eintrag lebt nie länger als das Token selbst (notAfter in Epoch-Millis)
    public synchronized void store(String token, Principal principal, long notAfter) {
        entries.put(token, new CachedToken(Math.min(clock.millis() + ttl.toMillis(), notAfter), principal));
    }

    public synchronized int size() {
        return entries.size();
    }
}
