package authcore.db;

import authcore.support.TestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import java.sql.Connection;
import java.sql.SQLException;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit-Tests für ConnectionPool
 *
 * Transaktionssteuerung mit gemockter Connection, Rollback-Verhalten gegen H2
 */
@ExtendWith(MockitoExtension.class)
class ConnectionPoolTest {

    @Mock
    private Connection mockConn;

    @Test
    @DisplayName("withTransaction sollte bei Erfolg committen")
    void testWithTransaction_ShouldCommitOnSuccess() throws SQLException {
        // ACT
        String result = ConnectionPool.withTransaction(mockConn, conn -> "done");

        // ASSERT
        assertEquals("done", result);
        InOrder order = inOrder(mockConn);
        order.verify(mockConn).setAutoCommit(false);
        order.verify(mockConn).commit();
        order.verify(mockConn).setAutoCommit(true);
        verify(mockConn, never()).rollback();
    }

    @Test
    @DisplayName("withTransaction sollte bei Fehler zurückrollen und die Exception weiterwerfen")
    void testWithTransaction_ShouldRollbackAndRethrow() throws SQLException {
        // ARRANGE
        var failure = new IllegalStateException("block failed");

        // ACT
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> ConnectionPool.withTransaction(mockConn, conn -> { throw failure; }));

        // ASSERT
        assertSame(failure, exception, "Ursprüngliche Exception sollte unverändert weitergegeben werden");
        verify(mockConn).rollback();
        verify(mockConn, never()).commit();
        verify(mockConn).setAutoCommit(true);
    }

    @Test
    @DisplayName("Fehler beim Rollback wird als suppressed angehängt")
    void testWithTransaction_ShouldAttachRollbackFailure() throws SQLException {
        // ARRANGE
        doThrow(new SQLException("rollback failed")).when(mockConn).rollback();

        // ACT
        SQLException exception = assertThrows(SQLException.class,
            () -> ConnectionPool.withTransaction(mockConn, conn -> { throw new SQLException("insert failed"); }));

        // ASSERT
        assertEquals("insert failed", exception.getMessage());
        assertEquals(1, exception.getSuppressed().length);
        assertEquals("rollback failed", exception.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("Fehlgeschlagener Commit führt zu Rollback")
    void testWithTransaction_ShouldRollbackWhenCommitFails() throws SQLException {
        // ARRANGE
        doThrow(new SQLException("commit failed")).when(mockConn).commit();

        // ACT & ASSERT
        assertThrows(SQLException.class, () -> ConnectionPool.withTransaction(mockConn, conn -> 1));
        verify(mockConn).rollback();
    }

    @Test
    @DisplayName("Verbindung mit offener Transaktion wird beim Zurückgeben zurückgerollt")
    void testRelease_ShouldRollbackOpenTransaction() throws SQLException {
        // ARRANGE
        var pool = new ConnectionPool(1, () -> mockConn);
        when(mockConn.getAutoCommit()).thenReturn(false);

        // ACT
        pool.use(conn -> null);

        // ASSERT
        verify(mockConn).rollback();
        verify(mockConn).setAutoCommit(true);
    }

    @Test
    @DisplayName("Geschlossene Verbindung wird verworfen und neu erzeugt")
    void testRelease_ShouldDiscardClosedConnection() throws SQLException {
        // ARRANGE
        var created = new int[1];
        var pool = new ConnectionPool(1, () -> {
            created[0]++;
            return mockConn;
        });
        when(mockConn.isClosed()).thenReturn(true);

        // ACT
        pool.use(conn -> null);
        pool.use(conn -> null);

        // ASSERT
        assertEquals(2, created[0], "Geschlossene Verbindung sollte nicht wiederverwendet werden");
    }

    @Test
    @DisplayName("useTransaction sollte Änderungen bei Fehler in der Datenbank zurückrollen")
    void testUseTransaction_ShouldRollbackAgainstRealDatabase() throws SQLException {
        // ARRANGE
        var pool = TestDatabase.newPool(TestDatabase.newUrl(), 1);
        pool.use(conn -> {
            try (var st = conn.createStatement()) {
                st.executeUpdate("CREATE TABLE items(name VARCHAR(32) PRIMARY KEY)");
            }
            return null;
        });

        // ACT
        assertThrows(SQLException.class, () -> pool.useTransaction(conn -> {
            try (var st = conn.createStatement()) {
                st.executeUpdate("INSERT INTO items(name) VALUES ('a')");
                st.executeUpdate("INSERT INTO items(name) VALUES ('a')");
            }
            return null;
        }));

        // ASSERT
        int count = pool.use(conn -> {
            try (var st = conn.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM items")) {
                rs.next();
                return rs.getInt(1);
            }
        });
        assertEquals(0, count, "Erstes INSERT sollte mit zurückgerollt werden");
        assertTrue(pool.use(Connection::getAutoCommit), "Verbindung sollte wieder im Auto-Commit sein");
        pool.close();
    }
}
