package com.botscript.session.database;

import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.ConnectionError;
import com.botscript.session.ConnectionEvent;
import com.botscript.session.SessionManager;
import com.botscript.session.SessionTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.botscript.session.SessionTestSupport.drain;
import static org.junit.jupiter.api.Assertions.*;

class DatabaseConnectionTest {

    private ExecutorService pool;
    private EventBus bus;
    private Instance instance;
    private ScriptContext ctx;
    private SessionManager sessions;
    private DatabaseConnection db;

    @BeforeEach
    void setUp() throws Exception {
        pool = Executors.newFixedThreadPool(2);
        bus = new EventBus();
        instance = SessionTestSupport.runningInstance("i1", pool);
        ctx = SessionTestSupport.context(instance, "store");
        sessions = new SessionManager(bus, SessionTestSupport.sessionsConfig(5_000));

        var opened = new CompletableFuture<ConnectionError>();
        db = sessions.openDatabase(ctx, DatabaseParams.from(Map.of("driver", "sqlite3")), opened::complete);
        assertNull(opened.get(5, TimeUnit.SECONDS));
    }

    @AfterEach
    void tearDown() {
        sessions.close();
        pool.shutdownNow();
    }

    private List<Map<String, Object>> query(String sql, Object... args) throws Exception {
        var result = new CompletableFuture<List<Map<String, Object>>>();
        db.query(sql, List.of(args), (err, rows) -> {
            if (err != null) {
                result.completeExceptionally(err);
            } else {
                result.complete(rows);
            }
        });
        return result.get(5, TimeUnit.SECONDS);
    }

    @Test
    void rows_comeBackAsColumnOrderedMaps() throws Exception {
        db.exec("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64), score INT)", List.of());
        db.exec("INSERT INTO users VALUES (?, ?, ?)", List.of(1, "ann", 10));
        db.exec("INSERT INTO users VALUES (?, ?, ?)", List.of(2, "bob", 20));

        var rows = query("SELECT id, name, score FROM users WHERE score > ? ORDER BY id", 5);

        assertEquals(2, rows.size());
        assertEquals(List.of("ID", "NAME", "SCORE"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals("ann", rows.get(0).get("NAME"));
        assertEquals(20, rows.get(1).get("SCORE"));
    }

    @Test
    void results_areDeliveredInRequestOrder() throws Exception {
        var order = new CopyOnWriteArrayList<Object>();
        for (int i = 0; i < 25; i++) {
            db.query("SELECT CAST(? AS INT) AS n", List.of(i), (err, rows) -> order.add(rows.get(0).get("N")));
        }
        query("SELECT 1");
        drain(instance);

        var expected = new ArrayList<Object>();
        for (int i = 0; i < 25; i++) {
            expected.add(i);
        }
        assertEquals(expected, order);
    }

    @Test
    void failedStatement_reportsAnError_andTheSessionStaysUsable() throws Exception {
        var errors = new CopyOnWriteArrayList<ConnectionError>();
        db.query("SELECT * FROM missing_table", List.of(), (err, rows) -> {
            assertNull(rows);
            errors.add(err);
        });

        assertEquals(List.of(Map.of("ONE", 1)), query("SELECT 1 AS one"));
        assertEquals(1, errors.size());
        assertTrue(db.isOpen());
    }

    @Test
    void failedExec_raisesDbError() throws Exception {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        bus.on(ctx, "db.error", e -> events.add((ConnectionEvent) e.payload()));

        db.exec("INSERT INTO missing_table VALUES (1)", List.of());
        query("SELECT 1");
        drain(instance);

        assertEquals(1, events.size());
        assertEquals(db.getId(), events.get(0).connectionId());
    }

    @Test
    void statementWithoutResultSet_yieldsNoRows() throws Exception {
        assertEquals(List.of(), query("CREATE TABLE t (x INT)"));
    }

    @Test
    void nullParameters_areBound() throws Exception {
        db.exec("CREATE TABLE t (x INT, y VARCHAR(8))", List.of());
        var args = new ArrayList<Object>();
        args.add(1);
        args.add(null);
        db.exec("INSERT INTO t VALUES (?, ?)", args);

        var rows = query("SELECT y FROM t WHERE x = 1");
        assertEquals(1, rows.size());
        assertNull(rows.get(0).get("Y"));
    }

    @Test
    void queryAfterClose_isNeverAnswered() throws Exception {
        var answered = new CopyOnWriteArrayList<Object>();
        db.close();
        db.query("SELECT 1", List.of(), (err, rows) -> answered.add(err != null ? err : rows));
        Thread.sleep(100);
        drain(instance);

        assertTrue(answered.isEmpty());
        assertEquals(0, sessions.size());
    }

    @Test
    void eachSqliteSession_hasItsOwnDatabase() throws Exception {
        db.exec("CREATE TABLE only_here (x INT)", List.of());
        query("SELECT 1");

        var opened = new CompletableFuture<ConnectionError>();
        var other = sessions.openDatabase(ctx, DatabaseParams.from(Map.of("driver", "sqlite3")), opened::complete);
        assertNull(opened.get(5, TimeUnit.SECONDS));
        var result = new CompletableFuture<ConnectionError>();
        other.query("SELECT * FROM only_here", List.of(), (err, rows) -> result.complete(err));

        assertNotNull(result.get(5, TimeUnit.SECONDS));
    }
}
