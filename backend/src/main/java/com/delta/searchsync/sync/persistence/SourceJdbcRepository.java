package com.delta.searchsync.sync.persistence;

import com.delta.searchsync.sync.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Repository
public class SourceJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(SourceJdbcRepository.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public SourceJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public Set<String> findExistingIds(String table, List<String> ids) {
        List<Long> numericIds = new ArrayList<>();
        for (String id : ids) {
            Long parsed = parseId(id);
            if (parsed != null) {
                numericIds.add(parsed);
            }
        }
        if (numericIds.isEmpty()) {
            return Set.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ids", numericIds);
        Set<String> existing = new HashSet<>();
        jdbc.query(
            "SELECT id FROM " + safeTable(table) + " WHERE id IN (:ids)",
            params,
            rs -> {
                existing.add(Long.toString(rs.getLong("id")));
            }
        );
        return existing;
    }

    public long estimateRowCount(String table) {
        String safeTable = safeTable(table);
        if (!postgres) {
            Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + safeTable, Long.class);
            return count == null ? 0L : count;
        }
        List<Double> estimates = jdbc.query(
            """
                SELECT reltuples AS estimate
                FROM pg_class
                WHERE relname = :table
                """,
            new MapSqlParameterSource().addValue("table", safeTable),
            (rs, rowNum) -> rs.getDouble("estimate")
        );
        if (estimates.isEmpty()) {
            return 0L;
        }
        return Math.max(0L, (long) estimates.get(0).doubleValue());
    }

    public List<Article> findArticlesAfter(long afterId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("afterId", Math.max(0L, afterId))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id,
                       title,
                       body,
                       author,
                       published_at,
                       updated_at
                FROM articles
                WHERE id > :afterId
                ORDER BY id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new Article(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("body"),
                rs.getString("author"),
                toInstant(rs.getTimestamp("published_at")),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
    }

    private static String safeTable(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        return table;
    }

    private static Long parseId(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; falling back to exact row counts", e);
            return false;
        }
    }
}
