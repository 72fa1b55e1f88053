package authcore.models;

/**
 * Rollen für die Autorisierung (wird als Name in credentials.principal_role gespeichert)
 */
public enum PrincipalRole {
    USER,
    ADMIN
}
