package authcore.services;

/**
 * Gültiges Token, aber die Rolle ist nicht erlaubt (HTTP 403)
 */
public class ForbiddenException extends SecurityException {
    public ForbiddenException() {
        super("forbidden");
    }
}
