package authcore.controllers;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import authcore.models.PrincipalRole;
import authcore.services.AuthService;
import authcore.services.ForbiddenException;
import authcore.services.UnauthorizedException;

import java.io.OutputStream;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.EnumSet;

/**
 * Controller für User- und Session-Operationen
 *
 * Dünne HTTP-Schicht über dem AuthService; Autorisierung ausschließlich über verifyUser
 */
public class UsersController {
    private final AuthService auth;
    private final ObjectMapper json = new ObjectMapper();

    public UsersController(HttpServer server, AuthService auth) {
        this.auth = auth;
        server.createContext("/api/users/register", this::register);
        server.createContext("/api/users/login", this::login);
        server.createContext("/api/users/logout", this::logout);
        server.createContext("/api/users/me", this::me);
        server.createContext("/api/admin/users", this::createByAdmin);
    }

    // DTOs (Data Transfer Objects) – einfache Transport-Objekte für JSON-Serialisierung
    public record RegisterReq(String username, String password) {}
    public record LoginReq(String username, String password) {}
    public record CreateUserReq(String username, String password, PrincipalRole role) {}

    private void register(HttpExchange ex) {
        try {
            if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
                write(ex, 405, "{\"error\":\"method not allowed\"}");
                return;
            }
            var req = json.readValue(ex.getRequestBody(), RegisterReq.class);
            // Selbstregistrierung legt immer die Rolle USER an
            auth.createUser(PrincipalRole.USER, req.username(), req.password());
            write(ex, 201, String.format("{\"username\":%s,\"status\":\"created\"}", json.writeValueAsString(req.username())));
        } catch (IllegalArgumentException e) {
            write(ex, 400, err(e));
        } catch (SQLException e) {
            handleSqlError(ex, "register", e);
        } catch (Exception e) {
            System.err.println("Error in register: " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    private void login(HttpExchange ex) {
        try {
            if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
                write(ex, 405, "{\"error\":\"method not allowed\"}");
                return;
            }
            var req = json.readValue(ex.getRequestBody(), LoginReq.class);
            // Unbekannter User und falsches Passwort ergeben dieselbe Antwort
            var response = auth.login(req.username(), req.password());
            if (response.isEmpty()) {
                write(ex, 401, "{\"error\":\"invalid credentials\"}");
                return;
            }
            sendJson(ex, 200, response.get());
        } catch (Exception e) {
            System.err.println("Error in login: " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    private void logout(HttpExchange ex) {
        try {
            if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
                write(ex, 405, "{\"error\":\"method not allowed\"}");
                return;
            }
            auth.logout(bearerToken(ex));
            write(ex, 204, null);
        } catch (Exception e) {
            System.err.println("Error in logout: " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    private void me(HttpExchange ex) {
        try {
            if (!"GET".equalsIgnoreCase(ex.getRequestMethod())) {
                write(ex, 405, "{\"error\":\"method not allowed\"}");
                return;
            }
            sendJson(ex, 200, auth.verifyUser(bearerToken(ex)));
        } catch (UnauthorizedException e) {
            write(ex, 401, err(e));
        } catch (ForbiddenException e) {
            write(ex, 403, err(e));
        } catch (Exception e) {
            System.err.println("Error in me: " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    // Nur ADMIN darf User mit beliebiger Rolle anlegen
    private void createByAdmin(HttpExchange ex) {
        try {
            if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
                write(ex, 405, "{\"error\":\"method not allowed\"}");
                return;
            }
            auth.verifyUser(bearerToken(ex), EnumSet.of(PrincipalRole.ADMIN));
            var req = json.readValue(ex.getRequestBody(), CreateUserReq.class);
            auth.createUser(req.role(), req.username(), req.password());
            write(ex, 201, String.format("{\"username\":%s,\"status\":\"created\"}", json.writeValueAsString(req.username())));
        } catch (UnauthorizedException e) {
            write(ex, 401, err(e));
        } catch (ForbiddenException e) {
            write(ex, 403, err(e));
        } catch (IllegalArgumentException e) {
            write(ex, 400, err(e));
        } catch (SQLException e) {
            handleSqlError(ex, "createByAdmin", e);
        } catch (Exception e) {
            System.err.println("Error in createByAdmin: " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    // Extrahiert das Token aus dem Authorization-Header (Bearer), null wenn nicht vorhanden
    static String bearerToken(HttpExchange ex) {
        var header = ex.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.startsWith("Bearer ")) return null;
        var token = header.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    // Duplikat (Unique/Primary Key, SQLSTATE 23xxx) → 409 Conflict, sonst 500
    private void handleSqlError(HttpExchange ex, String operation, SQLException e) {
        boolean conflict = e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
        if (conflict) {
            write(ex, 409, "{\"error\":\"username already exists\"}");
        } else {
            System.err.println("Error in " + operation + " (SQL): " + e.getMessage());
            write(ex, 500, err(e));
        }
    }

    private void sendJson(HttpExchange ex, int code, Object data) {
        try {
            byte[] body = json.writeValueAsBytes(data);
            ex.getResponseHeaders().add("Content-Type", "application/json");
            ex.sendResponseHeaders(code, body.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(body);
            }
        } catch (Exception e) {
            System.err.println("Error in sendJson: " + e.getMessage());
        }
    }

    private static String err(Exception e) {
        String msg = e.getMessage() == null ? "error" : e.getMessage();
        return "{\"error\":\"" + msg.replace("\"", "\\\"") + "\"}";
    }

    private static void write(HttpExchange ex, int code, String body) {
        try {
            var bytes = body == null ? new byte[0] : body.getBytes();
            ex.getResponseHeaders().add("Content-Type", "application/json");
            // 204 darf keinen Body haben (-1 = keine Content-Length)
            ex.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        } catch (Exception e) {
            System.err.println("Error writing response: " + e.getMessage());
        }
    }
}
