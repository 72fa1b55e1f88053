package authcore.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Pool für JDBC-Verbindungen mit Transaktions-Helper
 *
 * Eine Verbindung wird nie mitten in einer Transaktion an den Pool zurückgegeben:
 * der Reset-Hook rollt offene Transaktionen zurück und verwirft geschlossene Verbindungen.
 *
 * Verwendung: pool.useTransaction(conn -> { ... })
 */
public class ConnectionPool extends ObjectPool<Connection> {

    public ConnectionPool(int size, ItemFactory<Connection> factory) {
        super(size, factory, ConnectionPool::reset);
    }

    public static ConnectionPool of(Db db) {
        return new ConnectionPool(db.poolSize(), db::open);
    }

    // Leiht eine Verbindung aus und führt den Block in einer Transaktion aus
    public <R> R useTransaction(PoolAction<Connection, R> block) throws SQLException {
        return use(conn -> withTransaction(conn, block));
    }

    /**
     * Führt den Block in einer (flachen) Transaktion aus
     *
     * Commit wenn der Block ohne Fehler durchläuft, sonst Rollback und die
     * ursprüngliche Exception wird weitergeworfen. Fehler beim Rollback werden
     * als suppressed angehängt.
     */
    public static <R> R withTransaction(Connection conn, PoolAction<Connection, R> block) throws SQLException {
        conn.setAutoCommit(false);
        R result;
        try {
            result = block.apply(conn);
            conn.commit();
        } catch (SQLException | RuntimeException | Error e) {
            try {
                conn.rollback();
                conn.setAutoCommit(true);
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        conn.setAutoCommit(true);
        return result;
    }

    private static void reset(Connection conn) throws SQLException {
        if (conn.isClosed()) throw new SQLException("connection closed");
        if (!conn.getAutoCommit()) {
            conn.rollback();
            conn.setAutoCommit(true);
        }
    }
}
