package de.bsommerfeld.cockpit.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;

/**
 * SQLite-backed {@link DurableCacheStore}.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on construction; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run. All other
 * statements are enumerated by {@link CacheStatement}, one
 * {@code sql/*.sql} file each.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, and the
 * {@link TieredCache} facade already serializes writers on the Java side.
 */
public class SqlCacheStore implements DurableCacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlCacheStore.class);

    private final String dbUrl;

    public SqlCacheStore(Path databaseFile) {
        this("jdbc:sqlite:" + prepare(databaseFile));
    }

    SqlCacheStore(String dbUrl) {
        this.dbUrl = dbUrl;
        initialize();
    }

    private static Path prepare(Path databaseFile) {
        Path absolute = databaseFile.toAbsolutePath();
        try {
            Path parent = absolute.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CacheException(CacheException.Reason.STORAGE, null,
                    "Cannot create cache directory for " + absolute, e);
        }
        return absolute;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing cache database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new CacheException(CacheException.Reason.STORAGE, null, "Cache database initialization failed", e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = SqlCacheStore.class.getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null)
                throw new SQLException("schema.sql not found on classpath");

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = stripComments(sql);
                if (statement.isEmpty())
                    continue;
                stmt.execute(statement);
            }
            conn.commit();
            LOG.debug("Cache schema applied");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit())
                conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder out = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--"))
                out.append(line).append('\n');
        }
        return out.toString().trim();
    }

    @Override
    public Optional<CacheEntry> find(String key) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.SELECT.sql())) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(new CacheEntry(rs.getBytes("value"), Instant.ofEpochMilli(rs.getLong("expires_at"))));
            }
        } catch (SQLException e) {
            throw storageFailure("read", key, e);
        }
    }

    @Override
    public void upsert(String key, CacheEntry entry) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.UPSERT.sql())) {
            ps.setString(1, key);
            ps.setBytes(2, entry.serializedValue());
            ps.setLong(3, entry.expiresAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw storageFailure("write", key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.DELETE.sql())) {
            ps.setString(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw storageFailure("delete", key, e);
        }
    }

    @Override
    public int clear() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.DELETE_ALL.sql())) {
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw storageFailure("clear", null, e);
        }
    }

    @Override
    public int deleteExpired(Instant now) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.DELETE_EXPIRED.sql())) {
            ps.setLong(1, now.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw storageFailure("sweep", null, e);
        }
    }

    /**
     * Number of rows currently stored, expired ones included.
     */
    public int count() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(CacheStatement.COUNT.sql());
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw storageFailure("count", null, e);
        }
    }

    private static CacheException storageFailure(String operation, String key, SQLException e) {
        return new CacheException(CacheException.Reason.STORAGE, key,
                "Cache database " + operation + " failed" + (key != null ? " for '" + key + "'" : ""), e);
    }
}
