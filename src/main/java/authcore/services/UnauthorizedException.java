package authcore.services;

/**
 * Kein oder ungültiges Token (HTTP 401)
 */
public class UnauthorizedException extends SecurityException {
    public UnauthorizedException() {
        super("unauthorized");
    }
}
