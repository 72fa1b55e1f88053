package authcore.models;

/**
 * Ergebnis eines erfolgreichen Logins: Principal + Session-Token (Base64)
 */
public record LoginResponse(Principal principal, String token) {}
