package authcore.models;

/**
 * Authentifizierte Identität inkl. Rolle
 *
 * Wird an Aufrufer zurückgegeben und enthält nie Passwort-Hash oder Salt
 */
public record Principal(String username, PrincipalRole role) {
    public Principal {
        if (username == null) throw new IllegalArgumentException("username required");
        if (role == null) throw new IllegalArgumentException("role required");
    }
}
