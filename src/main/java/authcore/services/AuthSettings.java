package authcore.services;

import java.time.Duration;
import java.util.Map;

/**
 * Unveränderliche Konfiguration für Hashing, Tokens und Cache
 *
 * Wird beim Erzeugen der Services übergeben. In Tests kann z.B. die Anzahl der
 * Iterationen reduziert werden.
 *
 * @param iterations     PBKDF2-Iterationen
 * @param keyLengthBits  Länge des abgeleiteten Schlüssels in Bit
 * @param saltLength     Salt-Länge in Bytes
 * @param tokenLength    Anzahl Zufallsbytes pro Token (vor Base64)
 * @param tokenLifetime  Gültigkeit eines Tokens in der Datenbank
 * @param cacheTtl       wie lange ein validiertes Token ohne DB-Abfrage akzeptiert wird
 */
public record AuthSettings(
        int iterations,
        int keyLengthBits,
        int saltLength,
        int tokenLength,
        Duration tokenLifetime,
        Duration cacheTtl
) {
    public static final AuthSettings DEFAULTS = new AuthSettings(
            10_000, 256, 16, 64, Duration.ofDays(30), Duration.ofSeconds(60));

    public AuthSettings {
        if (iterations < 1) throw new IllegalArgumentException("iterations must be positive");
        if (keyLengthBits < 1) throw new IllegalArgumentException("key length must be positive");
        if (saltLength < 1) throw new IllegalArgumentException("salt length must be positive");
        if (tokenLength < 1) throw new IllegalArgumentException("token length must be positive");
        if (tokenLifetime == null || tokenLifetime.isNegative() || tokenLifetime.isZero()) {
            throw new IllegalArgumentException("token lifetime must be positive");
        }
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive");
        }
        if (cacheTtl.compareTo(tokenLifetime) >= 0) {
            throw new IllegalArgumentException("cache ttl must be shorter than token lifetime");
        }
    }

    public AuthSettings withIterations(int iterations) {
        return new AuthSettings(iterations, keyLengthBits, saltLength, tokenLength, tokenLifetime, cacheTtl);
    }

    // Überschreibt Defaults mit AUTH_KDF_ITERATIONS, AUTH_TOKEN_LIFETIME_DAYS, AUTH_CACHE_TTL_SECONDS
    public static AuthSettings fromEnvironment(Map<String, String> env) {
        var d = DEFAULTS;
        return new AuthSettings(
                intOr(env, "AUTH_KDF_ITERATIONS", d.iterations()),
                d.keyLengthBits(),
                d.saltLength(),
                d.tokenLength(),
                Duration.ofDays(intOr(env, "AUTH_TOKEN_LIFETIME_DAYS", (int) d.tokenLifetime().toDays())),
                Duration.ofSeconds(intOr(env, "AUTH_CACHE_TTL_SECONDS", (int) d.cacheTtl().toSeconds()))
        );
    }

    private static int intOr(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }
}
