package com.sitelens.crawl.persistence;

import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.ProfileStats;
import com.sitelens.crawl.model.SiteProfile;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Repository
public class SiteProfileJdbcRepository implements SiteProfileStore {
    private static final String SELECT_COLUMNS = """
        SELECT id,
               domain,
               pattern,
               main_content_selector,
               title_selector,
               comments_selector,
               extraction_mode,
               confidence,
               use_count,
               success_rate,
               created_at,
               last_used,
               notes
        FROM site_profiles
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public SiteProfileJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public SiteProfile insert(SiteProfile profile) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", profile.id())
            .addValue("domain", profile.domain())
            .addValue("pattern", profile.pattern())
            .addValue("mainContentSelector", profile.mainContentSelector())
            .addValue("titleSelector", profile.titleSelector())
            .addValue("commentsSelector", profile.commentsSelector())
            .addValue("extractionMode", profile.extractionMode().name())
            .addValue("confidence", profile.confidence())
            .addValue("useCount", profile.useCount())
            .addValue("successRate", profile.successRate())
            .addValue("createdAt", toTimestamp(profile.createdAt()))
            .addValue("lastUsed", toTimestamp(profile.lastUsed()))
            .addValue("notes", profile.notes());
        jdbc.update(
            """
                INSERT INTO site_profiles (
                    id, domain, pattern, main_content_selector, title_selector, comments_selector,
                    extraction_mode, confidence, use_count, success_rate, created_at, last_used, notes
                )
                VALUES (
                    :id, :domain, :pattern, :mainContentSelector, :titleSelector, :commentsSelector,
                    :extractionMode, :confidence, :useCount, :successRate, :createdAt, :lastUsed, :notes
                )
                """,
            params
        );
        return profile;
    }

    @Override
    public SiteProfile findById(String id) {
        List<SiteProfile> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            profileRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public SiteProfile findByDomain(String domain) {
        List<SiteProfile> rows = jdbc.query(
            SELECT_COLUMNS + """
                 WHERE domain = :domain
                 ORDER BY confidence DESC, last_used DESC
                 LIMIT 1
                """,
            new MapSqlParameterSource("domain", domain),
            profileRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public List<SiteProfile> findAll() {
        return jdbc.query(
            SELECT_COLUMNS + " ORDER BY confidence DESC, last_used DESC",
            new MapSqlParameterSource(),
            profileRowMapper()
        );
    }

    @Override
    public List<SiteProfile> findByMode(ExtractionMode mode) {
        return jdbc.query(
            SELECT_COLUMNS + """
                 WHERE extraction_mode = :mode
                 ORDER BY confidence DESC, last_used DESC
                """,
            new MapSqlParameterSource("mode", mode.name()),
            profileRowMapper()
        );
    }

    @Override
    @Transactional
    public SiteProfile updateUsage(String id, boolean success) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("gain", SiteProfile.FEEDBACK_WEIGHT * (success ? 1.0 : 0.0))
            .addValue("retain", 1.0 - SiteProfile.FEEDBACK_WEIGHT)
            .addValue("lastUsed", toTimestamp(Instant.now().truncatedTo(ChronoUnit.MICROS)));
        // Single statement so concurrent feedback on the same row is never lost.
        int updated = jdbc.update(
            """
                UPDATE site_profiles
                SET use_count = use_count + 1,
                    success_rate = LEAST(1.0, GREATEST(0.0,
                        CAST(:gain AS DOUBLE PRECISION) + CAST(:retain AS DOUBLE PRECISION) * success_rate)),
                    last_used = :lastUsed
                WHERE id = :id
                """,
            params
        );
        if (updated == 0) {
            return null;
        }
        return findById(id);
    }

    @Override
    public boolean delete(String id) {
        int deleted = jdbc.update(
            "DELETE FROM site_profiles WHERE id = :id",
            new MapSqlParameterSource("id", id)
        );
        return deleted > 0;
    }

    @Override
    public int clearAll() {
        return jdbc.update("DELETE FROM site_profiles", new MapSqlParameterSource());
    }

    @Override
    public ProfileStats stats() {
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total_profiles,
                       COUNT(DISTINCT domain) AS distinct_domains,
                       COALESCE(SUM(use_count), 0) AS total_uses,
                       COALESCE(AVG(confidence), 0) AS avg_confidence,
                       COALESCE(AVG(success_rate), 0) AS avg_success_rate
                FROM site_profiles
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ProfileStats(
                rs.getLong("total_profiles"),
                rs.getLong("distinct_domains"),
                rs.getLong("total_uses"),
                rs.getDouble("avg_confidence"),
                rs.getDouble("avg_success_rate")
            )
        );
    }

    private RowMapper<SiteProfile> profileRowMapper() {
        return (rs, rowNum) -> new SiteProfile(
            rs.getString("id"),
            rs.getString("domain"),
            rs.getString("pattern"),
            rs.getString("main_content_selector"),
            rs.getString("title_selector"),
            rs.getString("comments_selector"),
            ExtractionMode.parse(rs.getString("extraction_mode")),
            rs.getDouble("confidence"),
            rs.getInt("use_count"),
            rs.getDouble("success_rate"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("last_used")),
            rs.getString("notes")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
