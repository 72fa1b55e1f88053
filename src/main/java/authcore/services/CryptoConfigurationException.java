package authcore.services;

/**
 * Der Key-Derivation-Algorithmus ist in dieser JVM nicht verfügbar oder falsch konfiguriert
 *
 * Nicht behebbar; wird beim Erzeugen des PasswordHasher geworfen, nicht pro Aufruf
 */
public class CryptoConfigurationException extends IllegalStateException {
    public CryptoConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
