package net.pagewise.integration.spring.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.pagewise.adapter.jdbc.TxContext;
import org.junit.jupiter.api.*;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 스프링 트랜잭션 위 TxContext 전파: REQUIRED 참여, REQUIRES_NEW 분리, checked 예외 롤백.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.MethodName.class)
class SpringTxRunnerTest {
    OracleContainer oracle;
    DataSource ds;
    SpringTxRunner tx;

    @BeforeAll
    void setUp() throws Exception {
        Assumptions.assumeTrue(DockerClientFactory.instance().isDockerAvailable(),
                "Docker not available, skipping SpringTxRunner tests");
        oracle = new OracleContainer(DockerImageName.parse("gvenzl/oracle-xe:21-slim"))
                .withStartupTimeout(Duration.ofMinutes(5));
        oracle.start();

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(oracle.getJdbcUrl());
        cfg.setUsername(oracle.getUsername());
        cfg.setPassword(oracle.getPassword());
        cfg.setMaximumPoolSize(4);
        ds = new HikariDataSource(cfg);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);

        try (Connection c = ds.getConnection(); var st = c.createStatement()) {
            st.execute("CREATE TABLE TX_PROBE (ID NUMBER(10) PRIMARY KEY)");
        }
    }

    @BeforeEach
    void clean() throws Exception {
        try (Connection c = ds.getConnection(); var st = c.createStatement()) {
            st.execute("DELETE FROM TX_PROBE");
        }
    }

    @AfterAll
    void tearDown() {
        if (ds instanceof HikariDataSource h) h.close();
        if (oracle != null) oracle.stop();
    }

    private static void insert(int id) throws SQLException {
        try (var ps = TxContext.get().prepareStatement("INSERT INTO TX_PROBE (ID) VALUES (?)")) {
            ps.setInt(1, id);
            ps.executeUpdate();
        }
    }

    private int count() throws Exception {
        try (Connection c = ds.getConnection(); var st = c.createStatement();
             var rs = st.executeQuery("SELECT COUNT(*) FROM TX_PROBE")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void a1_required_commits_and_clears_context() throws Exception {
        tx.required(() -> { insert(1); return null; });

        assertEquals(1, count());
        assertNull(TxContext.get());
    }

    @Test
    void a2_checked_exception_rolls_back_and_keeps_its_type() throws Exception {
        var e = assertThrows(IOException.class, () -> tx.required(() -> {
            insert(1);
            throw new IOException("upstream closed");
        }));

        assertEquals("upstream closed", e.getMessage());
        assertEquals(0, count());
    }

    @Test
    void a3_nested_required_shares_the_connection() throws Exception {
        AtomicReference<Connection> inner = new AtomicReference<>();
        tx.required(() -> {
            Connection outer = TxContext.get();
            tx.required(() -> { inner.set(TxContext.get()); return null; });
            assertSame(outer, inner.get());
            return null;
        });
    }

    @Test
    void a4_requires_new_commits_even_when_outer_rolls_back() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            Connection outer = TxContext.get();
            insert(1);

            tx.requiresNew(() -> {
                assertNotSame(outer, TxContext.get());
                insert(2);
                return null;
            });

            // 안쪽이 끝나면 바깥 커넥션이 되돌아와야 한다
            assertSame(outer, TxContext.get());
            throw new IllegalStateException("outer fails");
        }));

        assertEquals(1, count());
        try (Connection c = ds.getConnection(); var st = c.createStatement();
             var rs = st.executeQuery("SELECT ID FROM TX_PROBE")) {
            assertTrue(rs.next());
            assertEquals(2, rs.getInt(1));
        }
    }
}
