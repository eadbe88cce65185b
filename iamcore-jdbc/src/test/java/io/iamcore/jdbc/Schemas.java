package io.iamcore.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;

/**
 * Loads the bundled DDL scripts into a test database.
 */
final class Schemas {

    private Schemas() {
    }

    static void create(DataSource dataSource, String storeName) throws Exception {
        String schema = load("/schema/" + storeName + ".sql");
        try (Connection conn = dataSource.getConnection(); Statement statement = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                String trimmed = stmt.trim();
                if (!trimmed.isEmpty()) {
                    statement.execute(trimmed);
                }
            }
        }
    }

    private static String load(String path) throws IOException {
        try (InputStream is = Schemas.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Resource not found: " + path);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
