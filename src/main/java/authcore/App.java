package authcore;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.io.OutputStream;
import java.security.SecureRandom;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Map;
import authcore.controllers.UsersController;
import authcore.db.ConnectionPool;
import authcore.db.Db;
import authcore.db.JdbcMigrationHandler;
import authcore.models.PrincipalRole;
import authcore.repos.JdbcCredentialRepository;
import authcore.repos.JdbcTokenRepository;
import authcore.repos.Schema;
import authcore.services.AuthService;
import authcore.services.AuthSettings;
import authcore.services.PasswordHasher;
import authcore.services.TokenCache;
import authcore.services.TokenService;

/**
 * Hauptklasse der Anwendung
 *
 * Setzt Connection-Pool, Migrationen, Services und den HTTP-Server auf
 */
public class App {
    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        int port = Integer.parseInt(env.getOrDefault("PORT", "8080"));

        // Datenbank + Schema
        var db = Db.fromEnvironment(env);
        var pool = ConnectionPool.of(db);
        System.out.println("Datenbank: " + db.url() + " (Pool-Größe " + db.poolSize() + ")");
        new JdbcMigrationHandler().register(Schema.TABLES).migrate(pool);

        // Services initialisieren
        var settings = AuthSettings.fromEnvironment(env);
        var random = new SecureRandom();
        var clock = Clock.systemUTC();
        var hasher = new PasswordHasher(settings, random);
        var cache = new TokenCache(settings.cacheTtl(), clock);
        var tokenService = new TokenService(pool, new JdbcTokenRepository(), cache, settings, random, clock);
        var authService = new AuthService(pool, new JdbcCredentialRepository(), hasher, tokenService);

        bootstrapAdmin(authService, env);

        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

        // Health-Check Endpoint
        server.createContext("/health", exchange -> {
            byte[] response = "{\"status\":\"ok\"}".getBytes();
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });

        // Datenbank-Health-Check Endpoint (nutzt eine Verbindung aus dem Pool)
        server.createContext("/db/ping", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            try {
                long millis = pool.use(conn -> {
                    try (var stmt = conn.createStatement();
                         var rs = stmt.executeQuery("SELECT 1")) {
                        rs.next();
                        return System.currentTimeMillis();
                    }
                });
                byte[] body = ("{\"status\":\"ok\",\"checked_at\":" + millis + "}").getBytes();
                exchange.sendResponseHeaders(200, body.length);
                try (var os = exchange.getResponseBody()) { os.write(body); }
            } catch (SQLException e) {
                String msg = (e.getMessage() == null ? "error" : e.getMessage()).replace("\"","\\\"");
                byte[] body = ("{\"status\":\"error\",\"message\":\"" + msg + "\"}").getBytes();
                exchange.sendResponseHeaders(500, body.length);
                try (var os = exchange.getResponseBody()) { os.write(body); }
            }
        });

        new UsersController(server, authService);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop(0);
            pool.close();
        }));

        server.start();
        System.out.println("✅ Server läuft auf http://localhost:" + port);
    }

    // Legt beim Start optional einen Admin an (AUTH_ADMIN_USER / AUTH_ADMIN_PASSWORD)
    static void bootstrapAdmin(AuthService auth, Map<String, String> env) {
        String username = env.get("AUTH_ADMIN_USER");
        String password = env.get("AUTH_ADMIN_PASSWORD");
        if (username == null || password == null) return;
        try {
            auth.createUser(PrincipalRole.ADMIN, username, password);
            System.out.println("Admin angelegt: " + username);
        } catch (SQLException e) {
            // existiert meistens schon aus einem früheren Start
            System.err.println("Admin " + username + " nicht angelegt: " + e.getMessage());
        }
    }
}
