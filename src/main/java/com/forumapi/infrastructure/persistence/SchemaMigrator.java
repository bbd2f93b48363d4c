package com.forumapi.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Applies {@code schema.sql} from the classpath. Statements are split on a semicolon at the end
 * of a line and run in one transaction.
 */
public final class SchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    private SchemaMigrator() {
    }

    public static void migrate(DataSource ds) {
        String schema = readSchema();
        try (Connection conn = ds.getConnection();
             Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(false);
            int applied = 0;
            try {
                for (String sql : schema.split(";\\s*(\\r?\\n|$)")) {
                    if (sql.trim().isEmpty()) continue;
                    stmt.execute(sql.trim());
                    applied++;
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            LOG.info("Schema applied ({} statements)", applied);
        } catch (SQLException e) {
            throw new DataAccessException("Schema migration failed", e);
        }
    }

    private static String readSchema() {
        try (InputStream in = SchemaMigrator.class.getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema.sql not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema.sql", e);
        }
    }
}
