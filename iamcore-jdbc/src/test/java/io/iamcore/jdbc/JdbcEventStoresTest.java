package io.iamcore.jdbc;

import io.iamcore.jdbc.store.AbstractJdbcEventStore;
import io.iamcore.jdbc.store.JdbcEventStores;
import io.iamcore.jdbc.store.MySqlEventStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcEventStoresTest {

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", JdbcEventStores.detect("jdbc:mysql://localhost:3306/iam").name());
        assertEquals("mysql", JdbcEventStores.detect("jdbc:tidb://localhost:4000/iam").name());
        assertEquals("postgresql", JdbcEventStores.detect("jdbc:postgresql://localhost:5432/iam").name());
        assertEquals("h2", JdbcEventStores.detect("JDBC:H2:mem:test").name());
    }

    @Test
    void detectFromJdbcUrlThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcEventStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
        assertTrue(ex.getMessage().contains("No event store found"));
    }

    @Test
    void detectFromJdbcUrlThrowsForNullOrEmpty() {
        assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect((String) null));
        assertThrows(IllegalArgumentException.class, () -> JdbcEventStores.detect(""));
    }

    @Test
    void detectFromDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:event_store_detect;DB_CLOSE_DELAY=-1");

        assertEquals("h2", JdbcEventStores.detect(ds).name());
    }

    @Test
    void detectFallsBackToProductNameForWrappedUrl() {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:event_store_wrapped;DB_CLOSE_DELAY=-1");

        assertEquals("h2", JdbcEventStores.detect(wrapped(h2, "jdbc:p6spy:h2:mem:event_store_wrapped", "H2")).name());
    }

    @Test
    void detectFromDataSourceThrowsForUnknownDatabase() {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:event_store_unknown;DB_CLOSE_DELAY=-1");
        DataSource oracle = wrapped(h2, "jdbc:oracle:thin:@db:1521:xe", "Oracle");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcEventStores.detect(oracle));
        assertTrue(ex.getMessage().contains("Oracle"));
    }

    @Test
    void detectWithTableName() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:event_store_table;DB_CLOSE_DELAY=-1");

        AbstractJdbcEventStore defaultTable = JdbcEventStores.detect(ds, "iam_event");
        AbstractJdbcEventStore custom = JdbcEventStores.detect(ds, "tenant_events");

        assertEquals("iam_event", defaultTable.tableName());
        assertEquals("h2", custom.name());
        assertEquals("tenant_events", custom.tableName());
    }

    @Test
    void withTableNameReturnsNewStore() {
        AbstractJdbcEventStore h2 = JdbcEventStores.detect("jdbc:h2:mem:test");
        AbstractJdbcEventStore custom = h2.withTableName("tenant_events");

        assertNotSame(h2, custom);
        assertEquals("h2", custom.name());
        assertEquals("tenant_events", custom.tableName());
        assertEquals("iam_event", h2.tableName());
    }

    @Test
    void mySqlRecognisesDuplicateEntryErrorCode() {
        MySqlEventStore mysql = new MySqlEventStore();

        assertTrue(mysql.isUniqueViolation(new SQLException("Duplicate entry", "23000", 1062)));
        assertFalse(mysql.isUniqueViolation(new SQLException("Deadlock", "40001", 1213)));
    }

    // reports the given URL and product name while delegating everything else to the target
    private static DataSource wrapped(JdbcDataSource target, String url, String product) {
        ClassLoader loader = JdbcEventStoresTest.class.getClassLoader();
        return (DataSource) Proxy.newProxyInstance(loader, new Class<?>[] {DataSource.class}, (ds, dsMethod, dsArgs) -> {
            if (!dsMethod.getName().equals("getConnection")) {
                return invoke(dsMethod, target, dsArgs);
            }
            Connection conn = target.getConnection();
            return Proxy.newProxyInstance(loader, new Class<?>[] {Connection.class}, (c, connMethod, connArgs) -> {
                if (!connMethod.getName().equals("getMetaData")) {
                    return invoke(connMethod, conn, connArgs);
                }
                DatabaseMetaData metaData = conn.getMetaData();
                return Proxy.newProxyInstance(loader, new Class<?>[] {DatabaseMetaData.class}, (m, mdMethod, mdArgs) -> {
                    if (mdMethod.getName().equals("getURL")) {
                        return url;
                    }
                    if (mdMethod.getName().equals("getDatabaseProductName")) {
                        return product;
                    }
                    return invoke(mdMethod, metaData, mdArgs);
                });
            });
        });
    }

    private static Object invoke(Method method, Object target, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }
}
