package authcore.services;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * Service für Passwort-Hashing
 *
 * PBKDF2 mit HMAC-SHA-512 und zufälligem Salt pro Credential. Passwörter werden
 * nie als Klartext gespeichert, nur abgeleiteter Schlüssel + Salt.
 */
public class PasswordHasher {
    public static final String ALGORITHM = "PBKDF2WithHmacSHA512";

    private final AuthSettings settings;
    private final SecureRandom random;
    private final String algorithm;

    public PasswordHasher(AuthSettings settings, SecureRandom random) {
        this(settings, random, ALGORITHM);
    }

    // Prüft die Verfügbarkeit des Algorithmus sofort, damit ein Fehler beim Start auffällt
    PasswordHasher(AuthSettings settings, SecureRandom random, String algorithm) {
        this.settings = settings;
        this.random = random;
        this.algorithm = algorithm;
        try {
            SecretKeyFactory.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoConfigurationException(algorithm + " not available", e);
        }
    }

    public record HashedPassword(byte[] key, byte[] salt) {}

    // Hasht mit neuem Salt (für Registrierung)
    public HashedPassword hash(char[] password) {
        return hash(password, newSalt());
    }

    // Hasht mit vorhandenem Salt (für Login); das char-Array wird danach überschrieben
    public HashedPassword hash(char[] password, byte[] salt) {
        var spec = new PBEKeySpec(password, salt, settings.iterations(), settings.keyLengthBits());
        try {
            byte[] key = SecretKeyFactory.getInstance(algorithm).generateSecret(spec).getEncoded();
            return new HashedPassword(key, salt);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new CryptoConfigurationException("key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '0');
        }
    }

    // Vergleich in konstanter Zeit (kein Timing-Seitenkanal)
    public boolean matches(char[] password, byte[] expectedKey, byte[] salt) {
        return MessageDigest.isEqual(hash(password, salt).key(), expectedKey);
    }

    public byte[] newSalt() {
        byte[] salt = new byte[settings.saltLength()];
        random.nextBytes(salt);
        return salt;
    }
}
