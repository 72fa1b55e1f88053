package authcore.db;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Semaphore;

/**
 * Generischer Pool mit fester Kapazität für wiederverwendbare Objekte
 *
 * Instanzen werden erst bei Bedarf über die Factory erzeugt und nach jeder Rückgabe
 * durch den Reset-Hook zurückgesetzt. Ist der Pool erschöpft, blockiert acquire()
 * bis eine Instanz zurückgegeben wird. Die Kapazität ist damit die obere Grenze
 * für gleichzeitige Zugriffe.
 *
 * @param <T> Typ der gepoolten Objekte (z.B. java.sql.Connection)
 */
public class ObjectPool<T> implements AutoCloseable {

    @FunctionalInterface
    public interface ItemFactory<T> {
        T create() throws SQLException;
    }

    @FunctionalInterface
    public interface ResetHook<T> {
        void reset(T item) throws SQLException;
    }

    @FunctionalInterface
    public interface PoolAction<T, R> {
        R apply(T item) throws SQLException;
    }

    private final int size;
    private final ItemFactory<T> factory;
    private final ResetHook<T> reset;
    private final Semaphore permits;
    private final Deque<T> idle = new ArrayDeque<>(); // guarded by idle
    private final Set<T> loaned = Collections.newSetFromMap(new IdentityHashMap<>()); // guarded by idle

    public ObjectPool(int size, ItemFactory<T> factory, ResetHook<T> reset) {
        if (size < 1) throw new IllegalArgumentException("pool size must be positive");
        if (factory == null || reset == null) throw new IllegalArgumentException("factory and reset hook required");
        this.size = size;
        this.factory = factory;
        this.reset = reset;
        this.permits = new Semaphore(size, true);
    }

    public int size() { return size; }

    // Anzahl der aktuell freien Plätze (erzeugt oder noch nicht erzeugt)
    public int available() { return permits.availablePermits(); }

    /**
     * Liefert eine freie Instanz, blockiert solange alle Instanzen vergeben sind
     *
     * @throws SQLException wenn die Factory fehlschlägt oder der Thread beim Warten unterbrochen wird
     */
    public T acquire() throws SQLException {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("interrupted while waiting for a pooled instance", e);
        }

        T item;
        synchronized (idle) {
            item = idle.pollFirst();
            if (item != null) {
                loaned.add(item);
                return item;
            }
        }

        // Lazy: neue Instanz nur wenn keine freie vorhanden ist
        try {
            item = factory.create();
        } catch (SQLException | RuntimeException e) {
            permits.release();
            throw e;
        }
        synchronized (idle) {
            loaned.add(item);
        }
        return item;
    }

    /**
     * Gibt eine Instanz zurück. Schlägt der Reset-Hook fehl, wird die Instanz verworfen
     * und beim nächsten acquire() eine neue erzeugt.
     *
     * @throws IllegalArgumentException wenn die Instanz nicht (mehr) ausgeliehen ist,
     *         z.B. bei doppelter Rückgabe; der Pool bleibt dann unverändert
     */
    public void release(T item) {
        synchronized (idle) {
            if (!loaned.remove(item)) {
                throw new IllegalArgumentException("instance is not on loan from this pool");
            }
        }
        try {
            reset.reset(item);
            synchronized (idle) {
                idle.addLast(item);
            }
        } catch (SQLException | RuntimeException e) {
            System.err.println("Discarding pooled instance after failed reset: " + e.getMessage());
            discard(item);
        } finally {
            permits.release();
        }
    }

    /**
     * Scoped-Use: Instanz wird für die Dauer der Aktion ausgeliehen und auf jedem
     * Ausgangspfad (auch bei Exceptions) zurückgegeben
     */
    public <R> R use(PoolAction<T, R> action) throws SQLException {
        T item = acquire();
        try {
            return action.apply(item);
        } finally {
            release(item);
        }
    }

    // Schließt alle freien Instanzen; ausgeliehene Instanzen bleiben unberührt
    @Override
    public void close() {
        List<T> drained;
        synchronized (idle) {
            drained = new ArrayList<>(idle);
            idle.clear();
        }
        drained.forEach(this::discard);
    }

    private void discard(T item) {
        if (item instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                System.err.println("Failed to close pooled instance: " + e.getMessage());
            }
        }
    }
}
