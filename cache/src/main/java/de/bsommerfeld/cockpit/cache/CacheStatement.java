package de.bsommerfeld.cockpit.cache;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.io.Resources;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * Statements issued by {@link SqlCacheStore}. The SQL text of each lives in
 * {@code /sql/<file>.sql} and is read on first use.
 */
enum CacheStatement {

    SELECT("select-cache-entry"),
    UPSERT("upsert-cache-entry"),
    DELETE("delete-cache-entry"),
    DELETE_ALL("delete-all-cache-entries"),
    DELETE_EXPIRED("delete-expired-cache-entries"),
    COUNT("count-cache-entries");

    private final String file;
    private final Supplier<String> sql;

    CacheStatement(String file) {
        this.file = file;
        this.sql = Suppliers.memoize(() -> read("/sql/" + file + ".sql"));
    }

    String file() {
        return file;
    }

    /**
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    String sql() {
        return sql.get();
    }

    static String read(String resource) {
        URL url;
        try {
            url = Resources.getResource(CacheStatement.class, resource);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("SQL resource not found: " + resource, e);
        }
        try {
            return Resources.toString(url, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + resource, e);
        }
    }
}
