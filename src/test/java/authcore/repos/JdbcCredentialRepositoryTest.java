package authcore.repos;

import authcore.db.ConnectionPool;
import authcore.models.PrincipalRole;
import authcore.repos.CredentialRepository.CredentialRow;
import authcore.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import java.sql.SQLException;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integrationstests für JdbcCredentialRepository (H2)
 */
class JdbcCredentialRepositoryTest {

    private ConnectionPool pool;
    private final CredentialRepository repo = new JdbcCredentialRepository();

    @BeforeEach
    void setUp() throws SQLException {
        pool = TestDatabase.migratedPool(1);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @DisplayName("Gespeichertes Credential sollte über den Username gefunden werden")
    void testFindByUsername_ShouldReturnStoredRow() throws SQLException {
        // ARRANGE
        var row = new CredentialRow("alice", PrincipalRole.ADMIN, new byte[] {1, 2, 3}, new byte[] {9, 8});
        pool.useTransaction(conn -> { repo.create(conn, row); return null; });

        // ACT
        var found = pool.use(conn -> repo.findByUsername(conn, "alice"));

        // ASSERT
        assertTrue(found.isPresent());
        assertEquals(PrincipalRole.ADMIN, found.get().role());
        assertArrayEquals(new byte[] {1, 2, 3}, found.get().passwordHash());
        assertArrayEquals(new byte[] {9, 8}, found.get().salt());
    }

    @Test
    @DisplayName("Unbekannter Username liefert empty")
    void testFindByUsername_ShouldReturnEmptyForUnknownUser() throws SQLException {
        // ACT & ASSERT
        assertTrue(pool.use(conn -> repo.findByUsername(conn, "nobody")).isEmpty());
    }

    @Test
    @DisplayName("Doppelter Username verletzt den Primary Key")
    void testCreate_ShouldFailForDuplicateUsername() throws SQLException {
        // ARRANGE
        var row = new CredentialRow("bob", PrincipalRole.USER, new byte[] {1}, new byte[] {2});
        pool.useTransaction(conn -> { repo.create(conn, row); return null; });

        // ACT & ASSERT
        var duplicate = new CredentialRow("bob", PrincipalRole.ADMIN, new byte[] {7}, new byte[] {7});
        assertThrows(SQLException.class, () -> pool.useTransaction(conn -> { repo.create(conn, duplicate); return null; }));
    }
}
