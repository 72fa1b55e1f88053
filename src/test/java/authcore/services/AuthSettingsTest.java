package authcore.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.util.Map;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit-Tests für AuthSettings
 */
class AuthSettingsTest {

    @Test
    @DisplayName("Defaults: 10.000 Iterationen, 256 Bit, 16 Bytes Salt, 64 Bytes Token, 30 Tage, 60 Sekunden")
    void testDefaults_ShouldMatchHashingPolicy() {
        var d = AuthSettings.DEFAULTS;
        assertEquals(10_000, d.iterations());
        assertEquals(256, d.keyLengthBits());
        assertEquals(16, d.saltLength());
        assertEquals(64, d.tokenLength());
        assertEquals(Duration.ofDays(30), d.tokenLifetime());
        assertEquals(Duration.ofSeconds(60), d.cacheTtl());
    }

    @Test
    @DisplayName("Umgebungsvariablen überschreiben die Defaults")
    void testFromEnvironment_ShouldOverrideDefaults() {
        // ACT
        var settings = AuthSettings.fromEnvironment(Map.of(
            "AUTH_KDF_ITERATIONS", "20000",
            "AUTH_CACHE_TTL_SECONDS", "5"
        ));

        // ASSERT
        assertEquals(20_000, settings.iterations());
        assertEquals(Duration.ofSeconds(5), settings.cacheTtl());
        assertEquals(Duration.ofDays(30), settings.tokenLifetime(), "Nicht gesetzte Werte bleiben Default");
    }

    @Test
    @DisplayName("Ungültige Zahl in der Umgebung wird abgelehnt")
    void testFromEnvironment_ShouldRejectInvalidNumber() {
        assertThrows(IllegalArgumentException.class,
            () -> AuthSettings.fromEnvironment(Map.of("AUTH_KDF_ITERATIONS", "many")));
    }

    @Test
    @DisplayName("Cache-TTL muss kürzer als die Token-Lebensdauer sein")
    void testConstructor_ShouldRejectCacheTtlLongerThanTokenLifetime() {
        assertThrows(IllegalArgumentException.class,
            () -> new AuthSettings(1, 256, 16, 64, Duration.ofMinutes(1), Duration.ofMinutes(2)));
    }
}
